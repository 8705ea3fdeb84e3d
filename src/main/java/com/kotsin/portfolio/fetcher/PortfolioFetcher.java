package com.kotsin.portfolio.fetcher;

import com.kotsin.portfolio.error.FetchErrorKind;
import com.kotsin.portfolio.error.PortfolioFetchException;
import com.kotsin.portfolio.model.PortfolioSnapshot;
import com.kotsin.portfolio.provider.PortfolioInfo;
import com.kotsin.portfolio.provider.PortfolioProvider;
import com.kotsin.portfolio.provider.Position;
import com.kotsin.portfolio.session.SessionManager;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.List;
import java.util.function.Function;

/**
 * Retrieves and reduces portfolio data on behalf of the schedulers.
 *
 * <p>An expired-token answer triggers exactly one re-authentication and one
 * retried call; a second rejection right after a fresh login is escalated to
 * {@link FetchErrorKind#INVALID_CREDENTIALS} instead of being retried again.
 */
@Slf4j
public class PortfolioFetcher {

    private final PortfolioProvider provider;
    private final SessionManager sessionManager;
    private final Clock clock;
    private final String currency;

    public PortfolioFetcher(PortfolioProvider provider, SessionManager sessionManager,
                            Clock clock, String currency) {
        this.provider = provider;
        this.sessionManager = sessionManager;
        this.clock = clock;
        this.currency = currency;
    }

    /**
     * Single attempt with the given token.
     */
    public PortfolioSnapshot fetch(String portfolioId, String token) {
        try {
            List<Position> positions = provider.getPositions(token, portfolioId);
            return PortfolioMetricsCalculator.reduce(portfolioId, positions, currency, clock.instant());
        } catch (RuntimeException e) {
            throw PortfolioFetchException.classify(e);
        }
    }

    /**
     * Fetch with a session-managed token and the one-shot re-authentication policy.
     */
    public PortfolioSnapshot fetch(String portfolioId) {
        PortfolioSnapshot snapshot = withSession("portfolio " + portfolioId, token -> fetch(portfolioId, token));
        log.debug("Fetched portfolio {}: invested={} openPL={} dailyPL={}",
                portfolioId, snapshot.getInvestedCapital(), snapshot.getOpenPL(), snapshot.getDailyPL());
        return snapshot;
    }

    /**
     * Position-type portfolios of the account; watchlists are dropped.
     */
    public List<PortfolioInfo> listPortfolios() {
        List<PortfolioInfo> all = withSession("portfolio list", token -> {
            try {
                return provider.listPortfolios(token);
            } catch (RuntimeException e) {
                throw PortfolioFetchException.classify(e);
            }
        });
        return all.stream()
                .filter(PortfolioInfo::isPositionPortfolio)
                .toList();
    }

    private <T> T withSession(String what, Function<String, T> call) {
        String token = sessionManager.getValidToken();
        try {
            return call.apply(token);
        } catch (PortfolioFetchException first) {
            if (first.getKind() != FetchErrorKind.AUTH_EXPIRED) {
                throw first;
            }
            log.info("Token rejected while fetching {}; re-authenticating once", what);
            sessionManager.invalidate(token);
            String freshToken = sessionManager.getValidToken();
            try {
                return call.apply(freshToken);
            } catch (PortfolioFetchException second) {
                if (second.getKind() != FetchErrorKind.AUTH_EXPIRED) {
                    throw second;
                }
                sessionManager.markInvalid(freshToken);
                throw new PortfolioFetchException(FetchErrorKind.INVALID_CREDENTIALS,
                        "Provider rejected a freshly issued token for " + what, second);
            }
        }
    }
}
