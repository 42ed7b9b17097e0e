package com.followertracker.crawl.model;

import java.time.Instant;

/**
 * Singleton crawl progress row. A {@code null} listing cursor means listing has not started;
 * {@link #LISTING_COMPLETE} means every follower page has been stored.
 */
public record CrawlCheckpoint(
    String account,
    String listingCursor,
    long pagesFetched,
    long enrichmentMarker,
    Instant updatedAt
) {
    public static final String LISTING_COMPLETE = "__complete__";

    public static CrawlCheckpoint notStarted(String account) {
        return new CrawlCheckpoint(account, null, 0, 0, null);
    }

    public boolean isListingStarted() {
        return listingCursor != null;
    }

    public boolean isListingComplete() {
        return LISTING_COMPLETE.equals(listingCursor);
    }

    public CrawlCheckpoint withListingCursor(String cursor, long pages) {
        return new CrawlCheckpoint(account, cursor, pages, enrichmentMarker, updatedAt);
    }

    public CrawlCheckpoint withEnrichmentMarker(long marker) {
        return new CrawlCheckpoint(account, listingCursor, pagesFetched, marker, updatedAt);
    }
}
