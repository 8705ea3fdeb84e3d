package com.kotsin.portfolio.fetcher;

import com.kotsin.portfolio.model.PortfolioSnapshot;
import com.kotsin.portfolio.provider.Position;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PortfolioMetricsCalculatorTest {

    private static final Instant NOW = Instant.parse("2026-01-12T10:00:00Z");

    @Test
    @DisplayName("Sums position values and derives percentages from invested capital")
    void testReduce() {
        List<Position> positions = List.of(
                new Position("A", 240937.98, 70864.27, -1615.47),
                new Position("B", 10000.00, -864.27, 115.47));

        PortfolioSnapshot s = PortfolioMetricsCalculator.reduce("7", positions, "EUR", NOW);

        assertEquals(250937.98, s.getInvestedCapital(), 1e-9);
        assertEquals(70000.00, s.getOpenPL(), 1e-9);
        assertEquals(27.9, s.getOpenPLPercent(), 1e-9);
        assertEquals(-1500.00, s.getDailyPL(), 1e-9);
        assertEquals(-0.6, s.getDailyPLPercent(), 1e-9);
        assertEquals(2, s.getPositionCount());
    }

    @Test
    @DisplayName("Empty portfolio reports zeros, never NaN")
    void testEmptyPortfolio() {
        PortfolioSnapshot s = PortfolioMetricsCalculator.reduce("7", List.of(), "EUR", NOW);

        assertEquals(0.0, s.getInvestedCapital());
        assertEquals(0.0, s.getOpenPLPercent());
        assertEquals(0.0, s.getDailyPLPercent());
        assertEquals(0, s.getPositionCount());
    }

    @ParameterizedTest(name = "{0} of {1} = {2}%")
    @CsvSource({
            "50, 200, 25.0",
            "1, 3, 33.33",
            "2, 3, 66.67",
            "-5, 1000, -0.5",
            "10, 0, 0.0"
    })
    @DisplayName("Percent of base, rounded to two decimals")
    void testPercentOf(double value, double base, double expected) {
        assertEquals(expected, PortfolioMetricsCalculator.percentOf(value, base), 1e-9);
    }
}
