package com.followertracker.crawl.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.followertracker.config.CrawlerProperties;
import com.followertracker.crawl.model.EndpointCategory;
import com.followertracker.crawl.model.FetchResult;
import com.followertracker.crawl.model.FollowerPage;
import com.followertracker.crawl.model.FollowerProfile;
import com.followertracker.crawl.model.QuotaObservation;
import com.followertracker.crawl.util.ReasonCodeClassifier;
import org.jsoup.parser.Parser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ExecutorService;
import java.util.function.Function;

@Service
public class TwitterFollowerApiClient implements FollowerApiClient {
    private static final Logger log = LoggerFactory.getLogger(TwitterFollowerApiClient.class);
    private static final String FIRST_PAGE_CURSOR = "-1";
    private static final String LAST_PAGE_CURSOR = "0";
    private static final String REMAINING_HEADER = "x-rate-limit-remaining";
    private static final String RESET_HEADER = "x-rate-limit-reset";
    private static final DateTimeFormatter CREATED_AT_FORMAT =
        DateTimeFormatter.ofPattern("EEE MMM dd HH:mm:ss Z yyyy", Locale.ENGLISH);

    private final CrawlerProperties properties;
    private final ObjectMapper objectMapper;
    private final HttpClient client;

    public TwitterFollowerApiClient(
        CrawlerProperties properties,
        @Qualifier("httpExecutor") ExecutorService httpExecutor,
        ObjectMapper objectMapper
    ) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.client = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.getApi().getRequestTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .executor(httpExecutor)
            .build();
    }

    @Override
    public FetchResult<FollowerPage> fetchFollowerPage(ApiCredentials credentials, String account, String cursor) {
        String safeCursor = cursor == null || cursor.isBlank() ? FIRST_PAGE_CURSOR : cursor;
        String url = baseUrl() + EndpointCategory.FOLLOWER_IDS.resource() + ".json"
            + "?screen_name=" + encode(normalizeAccount(account))
            + "&cursor=" + encode(safeCursor)
            + "&count=" + properties.getApi().getFollowerPageSize()
            + "&stringify_ids=true";
        return call(credentials, EndpointCategory.FOLLOWER_IDS, url, this::parseFollowerPage);
    }

    @Override
    public FetchResult<FollowerProfile> fetchProfile(ApiCredentials credentials, String followerId) {
        String url = baseUrl() + EndpointCategory.USER_SHOW.resource() + ".json"
            + "?user_id=" + encode(followerId)
            + "&include_entities=false"
            + "&tweet_mode=extended";
        return call(credentials, EndpointCategory.USER_SHOW, url, this::parseProfile);
    }

    private <T> FetchResult<T> call(
        ApiCredentials credentials,
        EndpointCategory category,
        String url,
        Function<JsonNode, T> parser
    ) {
        URI uri;
        try {
            uri = URI.create(url);
        } catch (IllegalArgumentException e) {
            return FetchResult.fatal(ReasonCodeClassifier.HTTP_400, "malformed request url", null);
        }
        HttpRequest request = HttpRequest.newBuilder(uri)
            .timeout(Duration.ofSeconds(properties.getApi().getRequestTimeoutSeconds()))
            .header("User-Agent", properties.getApi().getUserAgent())
            .header("Accept", "application/json")
            .header("Authorization", credentials.authorizationHeader())
            .GET()
            .build();

        int maxBytes = properties.getApi().getMaxResponseBytes();
        HttpResponse<InputStream> response;
        byte[] bodyBytes;
        try {
            response = client.send(request, HttpResponse.BodyHandlers.ofInputStream());
            try (InputStream in = response.body()) {
                bodyBytes = in.readNBytes(maxBytes + 1);
            }
        } catch (IOException e) {
            String reason = ReasonCodeClassifier.fromIoFailure(e);
            log.debug("{} request failed with {}: {}", category, reason, e.getMessage());
            return FetchResult.transientError(reason, e.getMessage(), null);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return FetchResult.transientError(ReasonCodeClassifier.INTERRUPTED, "interrupted", null);
        }

        QuotaObservation quota = parseQuota(response.headers());
        int status = response.statusCode();
        if (status == 429) {
            return FetchResult.rateLimited(quota);
        }
        if (bodyBytes.length > maxBytes) {
            log.warn("{} response exceeded {} bytes (http_{})", category, maxBytes, status);
            return FetchResult.transientError(
                ReasonCodeClassifier.BODY_TOO_LARGE,
                "response larger than " + maxBytes + " bytes",
                quota
            );
        }
        String body = new String(bodyBytes, StandardCharsets.UTF_8);
        if (status >= 200 && status < 300) {
            try {
                return FetchResult.ok(parser.apply(objectMapper.readTree(body)), quota);
            } catch (JsonProcessingException | RuntimeException e) {
                log.warn("Unparseable {} response: {}", category, e.getMessage());
                return FetchResult.transientError(ReasonCodeClassifier.PARSING_FAILED, e.getMessage(), quota);
            }
        }
        String reason = ReasonCodeClassifier.fromHttpStatus(status);
        if (category == EndpointCategory.USER_SHOW && (status == 403 || status == 404)) {
            String apiReason = apiErrorReason(body);
            if (status == 404 || ReasonCodeClassifier.isNotFound(apiReason)) {
                return FetchResult.notFound(ReasonCodeClassifier.isNotFound(apiReason) ? apiReason : reason, quota);
            }
        }
        if (ReasonCodeClassifier.isRetryable(reason)) {
            return FetchResult.transientError(reason, "http_" + status, quota);
        }
        return FetchResult.fatal(reason, "http_" + status + " from " + category.resource(), quota);
    }

    private FollowerPage parseFollowerPage(JsonNode root) {
        JsonNode ids = root.get("ids");
        if (ids == null || !ids.isArray()) {
            throw new IllegalArgumentException("missing ids array");
        }
        List<String> identifiers = new ArrayList<>(ids.size());
        for (JsonNode id : ids) {
            identifiers.add(id.asText());
        }
        String nextCursor = text(root, "next_cursor_str");
        if (nextCursor == null) {
            JsonNode numeric = root.get("next_cursor");
            nextCursor = numeric == null || numeric.isNull() ? LAST_PAGE_CURSOR : numeric.asText();
        }
        boolean done = LAST_PAGE_CURSOR.equals(nextCursor);
        return new FollowerPage(identifiers, done ? null : nextCursor, done);
    }

    private FollowerProfile parseProfile(JsonNode root) {
        String id = text(root, "id_str");
        if (id == null) {
            throw new IllegalArgumentException("missing id_str");
        }
        JsonNode status = root.get("status");
        String statusText = null;
        if (status != null && !status.isNull()) {
            statusText = text(status, "full_text");
            if (statusText == null) {
                statusText = text(status, "text");
            }
        }
        return new FollowerProfile(
            id,
            text(root, "screen_name"),
            unescape(text(root, "name")),
            unescape(text(root, "description")),
            unescape(text(root, "location")),
            text(root, "url"),
            root.path("followers_count").asLong(0),
            root.path("friends_count").asLong(0),
            root.path("statuses_count").asLong(0),
            root.path("listed_count").asLong(0),
            root.path("favourites_count").asLong(0),
            root.path("verified").asBoolean(false),
            root.path("protected").asBoolean(false),
            parseCreatedAt(text(root, "created_at")),
            text(root, "lang"),
            status == null || status.isNull() ? null : text(status, "id_str"),
            unescape(statusText),
            status == null || status.isNull() ? null : parseCreatedAt(text(status, "created_at"))
        );
    }

    private String apiErrorReason(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            JsonNode errors = objectMapper.readTree(body).path("errors");
            for (JsonNode error : errors) {
                String reason = ReasonCodeClassifier.fromApiErrorCode(error.path("code").asInt(-1));
                if (!ReasonCodeClassifier.UNKNOWN.equals(reason)) {
                    return reason;
                }
            }
        } catch (JsonProcessingException e) {
            log.debug("Ignoring unparseable error body: {}", e.getMessage());
        }
        return null;
    }

    private QuotaObservation parseQuota(HttpHeaders headers) {
        String remaining = headers.firstValue(REMAINING_HEADER).orElse(null);
        String reset = headers.firstValue(RESET_HEADER).orElse(null);
        if (remaining == null && reset == null) {
            return null;
        }
        try {
            int remainingValue = remaining == null ? 0 : Integer.parseInt(remaining.trim());
            Instant resetAt = reset == null ? null : Instant.ofEpochSecond(Long.parseLong(reset.trim()));
            return new QuotaObservation(remainingValue, resetAt);
        } catch (NumberFormatException e) {
            log.warn("Ignoring malformed rate-limit headers remaining={} reset={}", remaining, reset);
            return null;
        }
    }

    private Instant parseCreatedAt(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return ZonedDateTime.parse(value, CREATED_AT_FORMAT).toInstant();
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        return value.asText();
    }

    private String unescape(String value) {
        return value == null ? null : Parser.unescapeEntities(value, false);
    }

    private String baseUrl() {
        String base = properties.getApi().getBaseUrl();
        if (base == null || base.isBlank()) {
            return "https://api.twitter.com";
        }
        base = base.trim();
        return base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
    }

    private static String normalizeAccount(String account) {
        if (account == null) {
            return "";
        }
        String trimmed = account.trim();
        return trimmed.startsWith("@") ? trimmed.substring(1) : trimmed;
    }

    private static String encode(String value) {
        return URLEncoder.encode(value == null ? "" : value, StandardCharsets.UTF_8);
    }
}
