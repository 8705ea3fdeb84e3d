package com.kotsin.portfolio.fetcher;

import com.kotsin.portfolio.model.PortfolioSnapshot;
import com.kotsin.portfolio.provider.Position;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.List;

/**
 * Reduces a position list to the five published figures.
 *
 * <p>Both percentages use invested capital as the baseline, so a day without
 * activity never divides by zero; an empty or zero-valued portfolio reports 0%.
 */
public final class PortfolioMetricsCalculator {

    private PortfolioMetricsCalculator() {
    }

    public static PortfolioSnapshot reduce(String portfolioId, List<Position> positions,
                                           String currency, Instant fetchedAt) {
        double invested = 0;
        double openPL = 0;
        double dailyPL = 0;
        for (Position p : positions) {
            invested += p.marketValue();
            openPL += p.openPL();
            dailyPL += p.dailyPL();
        }
        return PortfolioSnapshot.builder()
                .portfolioId(portfolioId)
                .investedCapital(round(invested))
                .openPL(round(openPL))
                .openPLPercent(percentOf(openPL, invested))
                .dailyPL(round(dailyPL))
                .dailyPLPercent(percentOf(dailyPL, invested))
                .positionCount(positions.size())
                .fetchedAt(fetchedAt)
                .currency(currency)
                .build();
    }

    static double percentOf(double value, double base) {
        if (base == 0 || !Double.isFinite(base) || !Double.isFinite(value)) {
            return 0.0;
        }
        return round(value / base * 100);
    }

    private static double round(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }
}
