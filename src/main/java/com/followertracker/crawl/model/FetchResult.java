package com.followertracker.crawl.model;

/**
 * Outcome of a single call across the API boundary. Every variant carries the quota the API
 * reported with the response, when it reported one, so the tracker can be refreshed even on
 * failure.
 *
 * @param <T> the payload of a successful call
 */
public sealed interface FetchResult<T>
    permits FetchResult.Ok, FetchResult.RateLimited, FetchResult.TransientError,
        FetchResult.NotFound, FetchResult.FatalError {

    QuotaObservation quota();

    record Ok<T>(T value, QuotaObservation quota) implements FetchResult<T> {
    }

    record RateLimited<T>(QuotaObservation quota) implements FetchResult<T> {
    }

    record TransientError<T>(String reasonCode, String message, QuotaObservation quota) implements FetchResult<T> {
    }

    record NotFound<T>(String reasonCode, QuotaObservation quota) implements FetchResult<T> {
    }

    record FatalError<T>(String reasonCode, String message, QuotaObservation quota) implements FetchResult<T> {
    }

    static <T> FetchResult<T> ok(T value, QuotaObservation quota) {
        return new Ok<>(value, quota);
    }

    static <T> FetchResult<T> rateLimited(QuotaObservation quota) {
        return new RateLimited<>(quota);
    }

    static <T> FetchResult<T> transientError(String reasonCode, String message, QuotaObservation quota) {
        return new TransientError<>(reasonCode, message, quota);
    }

    static <T> FetchResult<T> notFound(String reasonCode, QuotaObservation quota) {
        return new NotFound<>(reasonCode, quota);
    }

    static <T> FetchResult<T> fatal(String reasonCode, String message, QuotaObservation quota) {
        return new FatalError<>(reasonCode, message, quota);
    }
}
