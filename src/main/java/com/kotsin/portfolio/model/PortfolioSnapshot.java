package com.kotsin.portfolio.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Latest successfully fetched metrics for one portfolio.
 * Percentages are relative to {@code investedCapital}.
 */
@Value
@Builder
public class PortfolioSnapshot {

    String portfolioId;
    double investedCapital;
    double openPL;
    double openPLPercent;
    double dailyPL;
    double dailyPLPercent;
    int positionCount;
    Instant fetchedAt;
    String currency;
}
