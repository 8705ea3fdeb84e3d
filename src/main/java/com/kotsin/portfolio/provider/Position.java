package com.kotsin.portfolio.provider;

/**
 * One holding row; amounts are in the portfolio currency.
 */
public record Position(String name, double marketValue, double openPL, double dailyPL) {
}
