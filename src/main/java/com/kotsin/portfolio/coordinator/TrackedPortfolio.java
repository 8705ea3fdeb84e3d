package com.kotsin.portfolio.coordinator;

import com.kotsin.portfolio.model.PortfolioConfig;
import com.kotsin.portfolio.model.PortfolioSnapshot;
import com.kotsin.portfolio.model.PortfolioStatus;
import com.kotsin.portfolio.model.RefreshFailure;
import com.kotsin.portfolio.scheduler.RefreshScheduler;

/**
 * Runtime record of one registered portfolio. Written only from its
 * scheduler's listener callbacks, which never overlap.
 */
class TrackedPortfolio {

    private final PortfolioConfig config;
    private RefreshScheduler scheduler;

    private volatile PortfolioSnapshot snapshot;
    private volatile RefreshFailure lastFailure;
    private volatile int consecutiveFailures;

    TrackedPortfolio(PortfolioConfig config) {
        this.config = config;
    }

    void attach(RefreshScheduler scheduler) {
        this.scheduler = scheduler;
    }

    void commit(PortfolioSnapshot fresh) {
        snapshot = fresh;
        lastFailure = null;
        consecutiveFailures = 0;
    }

    int nextFailureCount() {
        return ++consecutiveFailures;
    }

    void recordFailure(RefreshFailure failure) {
        lastFailure = failure;
    }

    PortfolioConfig config() {
        return config;
    }

    RefreshScheduler scheduler() {
        return scheduler;
    }

    PortfolioSnapshot snapshot() {
        return snapshot;
    }

    PortfolioStatus status() {
        return PortfolioStatus.builder()
                .portfolioId(config.getPortfolioId())
                .displayName(config.getDisplayName())
                .schedulerState(scheduler.getState())
                .schedule(scheduler.getScheduleState())
                .snapshot(snapshot)
                .lastFailure(lastFailure)
                .build();
    }
}
