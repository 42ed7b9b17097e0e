package com.followertracker.crawl.model;

public enum EndpointCategory {
    FOLLOWER_IDS("/1.1/followers/ids"),
    USER_SHOW("/1.1/users/show");

    private final String resource;

    EndpointCategory(String resource) {
        this.resource = resource;
    }

    public String resource() {
        return resource;
    }
}
