package com.followertracker.crawl.service;

import com.followertracker.crawl.http.ApiCredentials;
import com.followertracker.crawl.http.FollowerApiClient;
import com.followertracker.crawl.model.FetchResult;
import com.followertracker.crawl.model.FollowerPage;
import com.followertracker.crawl.model.FollowerProfile;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * In-memory API double. Page responses are scripted per cursor and replayed in order, with the
 * last one repeating; profiles come from a responder function.
 */
class ScriptedFollowerApiClient implements FollowerApiClient {
    static final String FIRST = "<first>";

    private final Clock clock;
    private final Map<String, Deque<FetchResult<FollowerPage>>> pages = new ConcurrentHashMap<>();
    private final List<String> pageCalls = Collections.synchronizedList(new ArrayList<>());
    private final List<Instant> pageCallTimes = Collections.synchronizedList(new ArrayList<>());
    private final Map<String, AtomicInteger> profileCalls = new ConcurrentHashMap<>();
    private volatile Function<String, FetchResult<FollowerProfile>> profileResponder =
        id -> FetchResult.ok(profile(id), null);
    private volatile Consumer<String> afterPage = cursor -> {
    };

    ScriptedFollowerApiClient(Clock clock) {
        this.clock = clock;
    }

    @SafeVarargs
    final ScriptedFollowerApiClient onPage(String cursor, FetchResult<FollowerPage>... results) {
        Deque<FetchResult<FollowerPage>> queue = new ArrayDeque<>(List.of(results));
        pages.put(cursor == null ? FIRST : cursor, queue);
        return this;
    }

    ScriptedFollowerApiClient onProfile(Function<String, FetchResult<FollowerProfile>> responder) {
        this.profileResponder = responder;
        return this;
    }

    ScriptedFollowerApiClient afterPage(Consumer<String> listener) {
        this.afterPage = listener;
        return this;
    }

    @Override
    public FetchResult<FollowerPage> fetchFollowerPage(ApiCredentials credentials, String account, String cursor) {
        String key = cursor == null ? FIRST : cursor;
        pageCalls.add(key);
        pageCallTimes.add(clock.instant());
        Deque<FetchResult<FollowerPage>> queue = pages.get(key);
        if (queue == null || queue.isEmpty()) {
            throw new AssertionError("Unexpected page request for cursor " + key);
        }
        FetchResult<FollowerPage> result;
        synchronized (queue) {
            result = queue.size() > 1 ? queue.pollFirst() : queue.peekFirst();
        }
        afterPage.accept(key);
        return result;
    }

    @Override
    public FetchResult<FollowerProfile> fetchProfile(ApiCredentials credentials, String followerId) {
        profileCalls.computeIfAbsent(followerId, key -> new AtomicInteger()).incrementAndGet();
        return profileResponder.apply(followerId);
    }

    List<String> pageCalls() {
        synchronized (pageCalls) {
            return List.copyOf(pageCalls);
        }
    }

    List<Instant> pageCallTimes() {
        synchronized (pageCallTimes) {
            return List.copyOf(pageCallTimes);
        }
    }

    int profileCalls(String followerId) {
        AtomicInteger count = profileCalls.get(followerId);
        return count == null ? 0 : count.get();
    }

    int totalProfileCalls() {
        return profileCalls.values().stream().mapToInt(AtomicInteger::get).sum();
    }

    static FetchResult<FollowerPage> page(String nextCursor, String... ids) {
        boolean done = nextCursor == null;
        return FetchResult.ok(new FollowerPage(List.of(ids), nextCursor, done), null);
    }

    static FollowerProfile profile(String id) {
        return new FollowerProfile(
            id,
            "user" + id.toLowerCase(),
            "User " + id,
            "bio of " + id,
            null,
            null,
            1,
            2,
            3,
            0,
            0,
            false,
            false,
            null,
            "en",
            null,
            null,
            null
        );
    }
}
