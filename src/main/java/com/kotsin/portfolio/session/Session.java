package com.kotsin.portfolio.session;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * One authenticated identity against the provider. Immutable: every state
 * change produces a new instance that the {@link SessionManager} swaps in.
 */
@Value
@Builder(toBuilder = true)
public class Session {

    String token;
    Instant issuedAt;
    Instant expiresAt;      // null when the provider does not tell us
    SessionState state;

    public static Session unauthenticated() {
        return Session.builder().state(SessionState.UNAUTHENTICATED).build();
    }

    public boolean hasUnknownExpiry() {
        return expiresAt == null;
    }

    /**
     * A session can serve requests while VALID, not within {@code skew} of its
     * expiry and, for unknown expiry, not older than {@code maxTokenAge}
     * (zero or null disables the age limit).
     */
    public boolean isUsable(Instant now, Duration skew, Duration maxTokenAge) {
        if (state != SessionState.VALID || token == null) {
            return false;
        }
        if (expiresAt != null) {
            return now.isBefore(expiresAt.minus(skew));
        }
        if (maxTokenAge != null && !maxTokenAge.isZero() && issuedAt != null) {
            return now.isBefore(issuedAt.plus(maxTokenAge));
        }
        return true;
    }

    public Session expire() {
        return toBuilder().state(SessionState.EXPIRED).build();
    }

    public Session invalid() {
        return toBuilder().state(SessionState.INVALID).build();
    }
}
