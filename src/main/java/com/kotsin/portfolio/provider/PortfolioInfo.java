package com.kotsin.portfolio.provider;

/**
 * One entry of the account's portfolio list as the provider reports it.
 */
public record PortfolioInfo(String id, String name, String type) {

    public static final String TYPE_POSITION = "position";

    public boolean isPositionPortfolio() {
        return TYPE_POSITION.equals(type);
    }
}
