package com.kotsin.portfolio.entity;

/**
 * One published value of a portfolio, addressed by a stable entity id.
 */
public record PortfolioReading(String entityId, String name, double value, String unit) {
}
