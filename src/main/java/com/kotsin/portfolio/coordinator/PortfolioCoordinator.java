package com.kotsin.portfolio.coordinator;

import com.kotsin.portfolio.config.TrackerProperties;
import com.kotsin.portfolio.error.PortfolioFetchException;
import com.kotsin.portfolio.fetcher.PortfolioFetcher;
import com.kotsin.portfolio.model.PortfolioConfig;
import com.kotsin.portfolio.model.PortfolioSnapshot;
import com.kotsin.portfolio.model.PortfolioStatus;
import com.kotsin.portfolio.model.RefreshFailure;
import com.kotsin.portfolio.provider.PortfolioInfo;
import com.kotsin.portfolio.provider.PortfolioProvider;
import com.kotsin.portfolio.scheduler.RefreshListener;
import com.kotsin.portfolio.scheduler.RefreshScheduler;
import com.kotsin.portfolio.scheduler.WakeTimePolicy;
import com.kotsin.portfolio.session.CredentialStore;
import com.kotsin.portfolio.session.Credentials;
import com.kotsin.portfolio.session.SessionManager;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Composition root of the refresh core: one scheduler + fetcher pair per
 * registered portfolio, all sharing one {@link SessionManager}.
 *
 * <p>A failing portfolio only affects its own entry: the previous snapshot
 * stays readable and a {@link RefreshFailure} is attached next to it.
 */
@Service
@Slf4j
public class PortfolioCoordinator {

    private final SessionManager sessionManager;
    private final PortfolioProvider provider;
    private final WakeTimePolicy policy;
    private final ScheduledExecutorService executor;
    private final Clock clock;
    private final MeterRegistry meterRegistry;
    private final CredentialStore credentialStore;
    private final String currency;
    private final boolean refreshOnStart;

    private final PortfolioFetcher directoryFetcher;
    private final List<PortfolioObserver> observers = new CopyOnWriteArrayList<>();
    private final ConcurrentMap<String, TrackedPortfolio> portfolios = new ConcurrentHashMap<>();

    @Autowired
    public PortfolioCoordinator(SessionManager sessionManager,
                                PortfolioProvider provider,
                                WakeTimePolicy policy,
                                ScheduledExecutorService refreshExecutor,
                                Clock clock,
                                MeterRegistry meterRegistry,
                                CredentialStore credentialStore,
                                TrackerProperties props,
                                List<PortfolioObserver> observers) {
        this(sessionManager, provider, policy, refreshExecutor, clock, meterRegistry, credentialStore,
                props.currency(), props.refreshOnStart(), observers);
    }

    public PortfolioCoordinator(SessionManager sessionManager,
                                PortfolioProvider provider,
                                WakeTimePolicy policy,
                                ScheduledExecutorService executor,
                                Clock clock,
                                MeterRegistry meterRegistry,
                                CredentialStore credentialStore,
                                String currency,
                                boolean refreshOnStart,
                                List<PortfolioObserver> observers) {
        this.sessionManager = sessionManager;
        this.provider = provider;
        this.policy = policy;
        this.executor = executor;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
        this.credentialStore = credentialStore;
        this.currency = currency;
        this.refreshOnStart = refreshOnStart;
        this.directoryFetcher = new PortfolioFetcher(provider, sessionManager, clock, currency);
        this.observers.addAll(observers);
    }

    // ---------------------------------------------------------------------
    // Registration
    // ---------------------------------------------------------------------

    /**
     * Registers and starts a portfolio.
     *
     * @throws DuplicatePortfolioException if the id is already registered
     */
    public void addPortfolio(PortfolioConfig config) {
        String id = config.getPortfolioId();
        TrackedPortfolio tracked = new TrackedPortfolio(config);
        PortfolioFetcher fetcher = new PortfolioFetcher(provider, sessionManager, clock, currency);
        tracked.attach(new RefreshScheduler(config, fetcher, policy, executor, clock, listenerFor(tracked)));

        if (portfolios.putIfAbsent(id, tracked) != null) {
            throw new DuplicatePortfolioException(id);
        }
        tracked.scheduler().start();
        log.info("Tracking portfolio '{}' ({}), next refresh at {}", config.getDisplayName(), id,
                tracked.scheduler().getScheduleState().nextWakeAt());

        if (refreshOnStart) {
            tracked.scheduler().requestRefresh();
        }
    }

    /**
     * Stops the portfolio's scheduler and drops its snapshot. The shared session is untouched.
     */
    public void removePortfolio(String portfolioId) {
        TrackedPortfolio tracked = portfolios.remove(portfolioId);
        if (tracked == null) {
            throw new UnknownPortfolioException(portfolioId);
        }
        tracked.scheduler().stop();
        notifyRemoved(tracked);
        log.info("Stopped tracking portfolio '{}' ({})", tracked.config().getDisplayName(), portfolioId);
    }

    /**
     * Replaces a portfolio's configuration wholesale; a paused portfolio starts over.
     */
    public void reconfigurePortfolio(PortfolioConfig config) {
        TrackedPortfolio previous = portfolios.remove(config.getPortfolioId());
        if (previous != null) {
            previous.scheduler().stop();
            notifyRemoved(previous);
        }
        addPortfolio(config);
    }

    public boolean isRegistered(String portfolioId) {
        return portfolios.containsKey(portfolioId);
    }

    // ---------------------------------------------------------------------
    // Queries and triggers
    // ---------------------------------------------------------------------
    public CompletableFuture<PortfolioSnapshot> manualRefresh(String portfolioId) {
        TrackedPortfolio tracked = require(portfolioId);
        log.info("Manual refresh triggered for portfolio: {}", tracked.config().getDisplayName());
        return tracked.scheduler().requestRefresh();
    }

    /**
     * Latest snapshot, possibly stale; empty until the first successful refresh.
     */
    public Optional<PortfolioSnapshot> getSnapshot(String portfolioId) {
        return Optional.ofNullable(require(portfolioId).snapshot());
    }

    public PortfolioStatus getStatus(String portfolioId) {
        return require(portfolioId).status();
    }

    public List<PortfolioStatus> getStatuses() {
        return portfolios.values().stream()
                .map(TrackedPortfolio::status)
                .sorted(Comparator.comparing(PortfolioStatus::getDisplayName))
                .toList();
    }

    public PortfolioConfig getConfig(String portfolioId) {
        return require(portfolioId).config();
    }

    /**
     * Position-type portfolios available on the account, for selection.
     */
    public List<PortfolioInfo> availablePortfolios() {
        return directoryFetcher.listPortfolios();
    }

    /**
     * Stores new credentials and logs in with them, lifting an INVALID session.
     */
    public void updateCredentials(String email, String password) {
        credentialStore.update(new Credentials(email, password));
        sessionManager.authenticate(email, password);
    }

    public void addObserver(PortfolioObserver observer) {
        observers.add(observer);
    }

    @PreDestroy
    public void shutdown() {
        log.info("Shutting down {} portfolio scheduler(s)", portfolios.size());
        portfolios.values().forEach(t -> t.scheduler().stop());
        portfolios.clear();
    }

    // ---------------------------------------------------------------------
    // Scheduler callbacks
    // ---------------------------------------------------------------------
    private RefreshListener listenerFor(TrackedPortfolio tracked) {
        return new RefreshListener() {
            @Override
            public void onRefreshed(PortfolioSnapshot snapshot) {
                handleSuccess(tracked, snapshot);
            }

            @Override
            public void onRefreshFailed(PortfolioFetchException error) {
                handleFailure(tracked, error);
            }
        };
    }

    private void handleSuccess(TrackedPortfolio tracked, PortfolioSnapshot snapshot) {
        tracked.commit(snapshot);
        meterRegistry.counter("portfolio.refresh", "outcome", "success", "kind", "none").increment();
        log.info("Portfolio '{}' refreshed: value={} {} openPL={} ({}%) dailyPL={} ({}%)",
                tracked.config().getDisplayName(), snapshot.getInvestedCapital(), snapshot.getCurrency(),
                snapshot.getOpenPL(), snapshot.getOpenPLPercent(),
                snapshot.getDailyPL(), snapshot.getDailyPLPercent());
        for (PortfolioObserver observer : observers) {
            try {
                observer.onSnapshotUpdated(tracked.config(), snapshot);
            } catch (RuntimeException e) {
                log.error("Observer {} failed on snapshot update", observer.getClass().getSimpleName(), e);
            }
        }
    }

    private void handleFailure(TrackedPortfolio tracked, PortfolioFetchException error) {
        RefreshFailure failure = new RefreshFailure(error.getKind(), error.getMessage(),
                clock.instant(), tracked.nextFailureCount());
        tracked.recordFailure(failure);
        meterRegistry.counter("portfolio.refresh", "outcome", "failure", "kind", error.getKind().name())
                .increment();
        for (PortfolioObserver observer : observers) {
            try {
                observer.onError(tracked.config(), failure);
            } catch (RuntimeException e) {
                log.error("Observer {} failed on error notification", observer.getClass().getSimpleName(), e);
            }
        }
    }

    private void notifyRemoved(TrackedPortfolio tracked) {
        for (PortfolioObserver observer : observers) {
            try {
                observer.onPortfolioRemoved(tracked.config());
            } catch (RuntimeException e) {
                log.error("Observer {} failed on portfolio removal", observer.getClass().getSimpleName(), e);
            }
        }
    }

    private TrackedPortfolio require(String portfolioId) {
        TrackedPortfolio tracked = portfolios.get(portfolioId);
        if (tracked == null) {
            throw new UnknownPortfolioException(portfolioId);
        }
        return tracked;
    }
}
