package com.kotsin.portfolio.scheduler;

import com.kotsin.portfolio.error.PortfolioFetchException;
import com.kotsin.portfolio.model.PortfolioSnapshot;

/**
 * Receives the outcome of each refresh, once per transition, while the
 * scheduler still holds its lock (calls for one portfolio never overlap).
 */
public interface RefreshListener {

    void onRefreshed(PortfolioSnapshot snapshot);

    void onRefreshFailed(PortfolioFetchException error);
}
