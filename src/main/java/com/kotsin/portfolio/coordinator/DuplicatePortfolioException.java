package com.kotsin.portfolio.coordinator;

public class DuplicatePortfolioException extends RuntimeException {

    public DuplicatePortfolioException(String portfolioId) {
        super("Portfolio " + portfolioId + " is already registered");
    }
}
