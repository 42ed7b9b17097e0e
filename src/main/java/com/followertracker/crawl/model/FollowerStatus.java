package com.followertracker.crawl.model;

import java.util.Locale;

public enum FollowerStatus {
    DISCOVERED,
    PROFILE_FETCHED,
    PROFILE_FAILED;

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isTerminal() {
        return this != DISCOVERED;
    }

    public static FollowerStatus fromDbValue(String value) {
        if (value == null || value.isBlank()) {
            return DISCOVERED;
        }
        return FollowerStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
