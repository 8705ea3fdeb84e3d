package com.kotsin.portfolio.provider;

import com.kotsin.portfolio.error.PortfolioFetchException;

import java.util.List;

/**
 * Remote data provider contract. Implementations convert every transport or
 * protocol failure into a {@link PortfolioFetchException}.
 */
public interface PortfolioProvider {

    /**
     * Performs a login and returns the session token.
     *
     * @throws PortfolioFetchException INVALID_CREDENTIALS when the provider rejects the
     *                                 credentials, NETWORK_ERROR or DECODE_ERROR otherwise
     */
    String authenticate(String email, String password) throws PortfolioFetchException;

    /**
     * Every portfolio of the account, watchlists included.
     */
    List<PortfolioInfo> listPortfolios(String token) throws PortfolioFetchException;

    List<Position> getPositions(String token, String portfolioId) throws PortfolioFetchException;
}
