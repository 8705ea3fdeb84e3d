package com.kotsin.portfolio.entity;

import com.kotsin.portfolio.model.PortfolioConfig;
import com.kotsin.portfolio.model.PortfolioSnapshot;

import java.util.List;

/**
 * Maps a snapshot onto the five readings exposed per portfolio:
 * invested capital, open P/L, open P/L %, daily P/L and daily P/L %.
 */
public final class PortfolioReadings {

    public static final String PERCENT = "%";

    private PortfolioReadings() {
    }

    public static List<PortfolioReading> of(PortfolioConfig config, PortfolioSnapshot snapshot) {
        String slug = PortfolioNames.normalize(config.getDisplayName());
        String name = config.getDisplayName();
        String currency = snapshot.getCurrency();
        return List.of(
                new PortfolioReading("sensor.investing_" + slug,
                        "Investing " + name, snapshot.getInvestedCapital(), currency),
                new PortfolioReading("sensor.investing_" + slug + "_openpl",
                        "Open PL " + name, snapshot.getOpenPL(), currency),
                new PortfolioReading("sensor.investing_" + slug + "_openplperc",
                        "Open PL Perc " + name, snapshot.getOpenPLPercent(), PERCENT),
                new PortfolioReading("sensor.investing_" + slug + "_dailypl",
                        "Daily PL " + name, snapshot.getDailyPL(), currency),
                new PortfolioReading("sensor.investing_" + slug + "_dailyplperc",
                        "Daily PL Perc " + name, snapshot.getDailyPLPercent(), PERCENT));
    }

    /** Id of the trigger that requests a manual refresh. */
    public static String refreshButtonId(PortfolioConfig config) {
        return "button.update_investing_" + PortfolioNames.normalize(config.getDisplayName());
    }
}
