package com.followertracker.crawl.model;

public record ProfileResult(FollowerProfile profile, String failureReason) {

    public static ProfileResult fetched(FollowerProfile profile) {
        return new ProfileResult(profile, null);
    }

    public static ProfileResult failed(String failureReason) {
        return new ProfileResult(null, failureReason == null ? "UNKNOWN" : failureReason);
    }

    public boolean isFetched() {
        return profile != null;
    }

    public FollowerStatus status() {
        return isFetched() ? FollowerStatus.PROFILE_FETCHED : FollowerStatus.PROFILE_FAILED;
    }
}
