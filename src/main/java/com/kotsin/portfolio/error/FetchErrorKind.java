package com.kotsin.portfolio.error;

/**
 * Failure kinds a refresh can end with. Raw transport errors never reach the
 * scheduler; they are converted to one of these at the fetcher boundary.
 */
public enum FetchErrorKind {

    INVALID_CREDENTIALS(false, true),   // login rejected, user must reconfigure
    AUTH_EXPIRED(true, false),          // token rejected, handled by one silent re-login
    NETWORK_ERROR(true, false),         // transport failure or provider-side error code
    PORTFOLIO_NOT_FOUND(false, true),   // portfolio removed/renamed upstream
    DECODE_ERROR(true, false);          // unexpected response shape

    private final boolean transientFailure;
    private final boolean userActionRequired;

    FetchErrorKind(boolean transientFailure, boolean userActionRequired) {
        this.transientFailure = transientFailure;
        this.userActionRequired = userActionRequired;
    }

    public boolean isTransient() {
        return transientFailure;
    }

    /**
     * Kinds that produce a persistent user notification on first occurrence.
     */
    public boolean requiresUserAction() {
        return userActionRequired;
    }
}
