package com.kotsin.portfolio.scheduler;

/**
 * What happens on Saturday and Sunday. Intraday polling never runs on weekends.
 */
public enum WeekendPolicy {
    /** Morning and night checkpoints still fire on weekend days. */
    CHECKPOINTS,
    /** No weekend wakes at all; Friday's night checkpoint is followed by Monday's morning one. */
    SKIP
}
