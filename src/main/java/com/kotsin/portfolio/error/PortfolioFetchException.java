package com.kotsin.portfolio.error;

/**
 * Wrapper for any error on the refresh path, tagged with its {@link FetchErrorKind}.
 */
public class PortfolioFetchException extends RuntimeException {

    private final FetchErrorKind kind;

    public PortfolioFetchException(FetchErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public PortfolioFetchException(FetchErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public FetchErrorKind getKind() {
        return kind;
    }

    public static PortfolioFetchException invalidCredentials(String message) {
        return new PortfolioFetchException(FetchErrorKind.INVALID_CREDENTIALS, message);
    }

    public static PortfolioFetchException authExpired(String message) {
        return new PortfolioFetchException(FetchErrorKind.AUTH_EXPIRED, message);
    }

    public static PortfolioFetchException network(String message, Throwable cause) {
        return new PortfolioFetchException(FetchErrorKind.NETWORK_ERROR, message, cause);
    }

    public static PortfolioFetchException network(String message) {
        return new PortfolioFetchException(FetchErrorKind.NETWORK_ERROR, message);
    }

    public static PortfolioFetchException portfolioNotFound(String portfolioId) {
        return new PortfolioFetchException(FetchErrorKind.PORTFOLIO_NOT_FOUND,
                "Portfolio " + portfolioId + " not found");
    }

    public static PortfolioFetchException decode(String message, Throwable cause) {
        return new PortfolioFetchException(FetchErrorKind.DECODE_ERROR, message, cause);
    }

    public static PortfolioFetchException decode(String message) {
        return new PortfolioFetchException(FetchErrorKind.DECODE_ERROR, message);
    }

    /**
     * Converts an arbitrary throwable into the taxonomy; already-classified errors pass through.
     */
    public static PortfolioFetchException classify(Throwable t) {
        if (t instanceof PortfolioFetchException pfe) {
            return pfe;
        }
        return network("Unexpected error: " + t, t);
    }
}
