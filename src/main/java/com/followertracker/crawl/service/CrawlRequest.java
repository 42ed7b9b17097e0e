package com.followertracker.crawl.service;

import com.followertracker.crawl.http.ApiCredentials;

import java.nio.file.Path;

/**
 * @param exitMarker file whose presence asks the crawl to stop cleanly; may be {@code null}
 */
public record CrawlRequest(String account, ApiCredentials credentials, Path exitMarker) {
}
