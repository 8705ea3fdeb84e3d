package com.kotsin.portfolio.model;

import com.kotsin.portfolio.error.FetchErrorKind;

import java.time.Instant;

/**
 * Error annotation attached next to a (possibly stale) snapshot after a failed refresh.
 */
public record RefreshFailure(
        FetchErrorKind kind,
        String message,
        Instant occurredAt,
        int consecutiveFailures
) {
}
