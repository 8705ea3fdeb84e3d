package com.kotsin.portfolio.coordinator;

public class UnknownPortfolioException extends RuntimeException {

    public UnknownPortfolioException(String portfolioId) {
        super("Portfolio " + portfolioId + " is not registered");
    }
}
