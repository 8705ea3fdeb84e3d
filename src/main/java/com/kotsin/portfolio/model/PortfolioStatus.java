package com.kotsin.portfolio.model;

import com.kotsin.portfolio.scheduler.SchedulerState;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class PortfolioStatus {

    String portfolioId;
    String displayName;
    SchedulerState schedulerState;
    ScheduleState schedule;
    PortfolioSnapshot snapshot;     // null until the first successful refresh
    RefreshFailure lastFailure;     // null after a success

    public boolean isStale() {
        return snapshot != null && lastFailure != null;
    }
}
