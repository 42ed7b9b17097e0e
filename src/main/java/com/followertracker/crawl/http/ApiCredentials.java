package com.followertracker.crawl.http;

/**
 * Opaque credentials handle passed through to the API client. Never logged or persisted.
 */
public final class ApiCredentials {
    private final String bearerToken;

    public ApiCredentials(String bearerToken) {
        if (bearerToken == null || bearerToken.isBlank()) {
            throw new CredentialsException("Bearer token must not be blank");
        }
        this.bearerToken = bearerToken.trim();
    }

    String authorizationHeader() {
        return "Bearer " + bearerToken;
    }

    @Override
    public String toString() {
        return "ApiCredentials[redacted]";
    }
}
