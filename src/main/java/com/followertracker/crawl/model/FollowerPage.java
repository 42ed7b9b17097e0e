package com.followertracker.crawl.model;

import java.util.List;

public record FollowerPage(List<String> identifiers, String nextCursor, boolean done) {
    public FollowerPage {
        identifiers = identifiers == null ? List.of() : List.copyOf(identifiers);
    }
}
