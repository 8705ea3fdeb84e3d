package com.kotsin.portfolio.session;

public enum SessionState {
    UNAUTHENTICATED,
    VALID,
    EXPIRED,
    INVALID
}
