package com.kotsin.portfolio.coordinator;

import com.kotsin.portfolio.model.PortfolioConfig;
import com.kotsin.portfolio.model.PortfolioSnapshot;
import com.kotsin.portfolio.model.RefreshFailure;

/**
 * Hook for the entity layer. Called synchronously, once per completed
 * refresh; exceptions are logged by the coordinator and otherwise ignored.
 */
public interface PortfolioObserver {

    void onSnapshotUpdated(PortfolioConfig config, PortfolioSnapshot snapshot);

    void onError(PortfolioConfig config, RefreshFailure failure);

    /**
     * Called after the portfolio's scheduler is stopped by removal or reconfiguration.
     */
    default void onPortfolioRemoved(PortfolioConfig config) {
    }
}
