package com.kotsin.portfolio.model;

import java.time.Instant;

public record ScheduleState(
        Instant nextWakeAt,
        Instant lastAttemptAt,
        Instant lastSuccessAt,
        boolean inFlight
) {
}
