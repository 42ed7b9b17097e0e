package com.followertracker.crawl.http;

import com.followertracker.crawl.model.FetchResult;
import com.followertracker.crawl.model.FollowerPage;
import com.followertracker.crawl.model.FollowerProfile;

/**
 * Single-attempt access to the social network API. Implementations never throw for API or
 * transport failures; they classify them into a {@link FetchResult}.
 */
public interface FollowerApiClient {

    /**
     * @param cursor {@code null} for the first page
     */
    FetchResult<FollowerPage> fetchFollowerPage(ApiCredentials credentials, String account, String cursor);

    FetchResult<FollowerProfile> fetchProfile(ApiCredentials credentials, String followerId);
}
