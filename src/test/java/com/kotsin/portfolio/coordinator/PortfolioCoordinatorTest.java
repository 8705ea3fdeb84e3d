package com.kotsin.portfolio.coordinator;

import com.kotsin.portfolio.error.FetchErrorKind;
import com.kotsin.portfolio.error.PortfolioFetchException;
import com.kotsin.portfolio.model.PortfolioConfig;
import com.kotsin.portfolio.model.PortfolioSnapshot;
import com.kotsin.portfolio.model.PortfolioStatus;
import com.kotsin.portfolio.model.RefreshFailure;
import com.kotsin.portfolio.provider.PortfolioInfo;
import com.kotsin.portfolio.provider.Position;
import com.kotsin.portfolio.scheduler.SchedulerState;
import com.kotsin.portfolio.scheduler.WakeTimePolicy;
import com.kotsin.portfolio.scheduler.WeekendPolicy;
import com.kotsin.portfolio.session.CredentialStore;
import com.kotsin.portfolio.session.Credentials;
import com.kotsin.portfolio.session.SessionManager;
import com.kotsin.portfolio.session.SessionState;
import com.kotsin.portfolio.support.FakePortfolioProvider;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class PortfolioCoordinatorTest {

    private static final ZoneId MADRID = ZoneId.of("Europe/Madrid");

    private final FakePortfolioProvider provider = new FakePortfolioProvider();
    private final Clock clock = Clock.fixed(Instant.parse("2026-01-12T09:00:30Z"), MADRID);
    private final ScheduledExecutorService executor = Executors.newScheduledThreadPool(2);
    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final CredentialStore credentials = new CredentialStore(new Credentials("user@example.com", "secret"));
    private final SessionManager sessions = new SessionManager(provider, credentials, clock, Duration.ZERO, registry);
    private final RecordingObserver observer = new RecordingObserver();

    private final PortfolioCoordinator coordinator = new PortfolioCoordinator(
            sessions, provider, new WakeTimePolicy(MADRID, WeekendPolicy.CHECKPOINTS), executor, clock,
            registry, credentials, "EUR", false, List.of(observer));

    private static PortfolioConfig portfolio(String id, String name) {
        return PortfolioConfig.builder().portfolioId(id).displayName(name).build();
    }

    @AfterEach
    void tearDown() {
        coordinator.shutdown();
        executor.shutdownNow();
    }

    @Test
    @DisplayName("Adding the same portfolio twice fails")
    void testDuplicateAdd() {
        coordinator.addPortfolio(portfolio("42", "Main"));

        assertThrows(DuplicatePortfolioException.class, () -> coordinator.addPortfolio(portfolio("42", "Again")));
        assertEquals("Main", coordinator.getStatus("42").getDisplayName());
    }

    @Test
    @DisplayName("Unknown ids are rejected")
    void testUnknownPortfolio() {
        assertThrows(UnknownPortfolioException.class, () -> coordinator.getSnapshot("nope"));
        assertThrows(UnknownPortfolioException.class, () -> coordinator.manualRefresh("nope"));
        assertThrows(UnknownPortfolioException.class, () -> coordinator.removePortfolio("nope"));
    }

    @Test
    @DisplayName("Snapshot is empty until the first refresh, then published once to observers")
    void testManualRefreshPublishes() throws Exception {
        coordinator.addPortfolio(portfolio("42", "Main"));
        assertTrue(coordinator.getSnapshot("42").isEmpty());

        PortfolioSnapshot snapshot = coordinator.manualRefresh("42").get(5, TimeUnit.SECONDS);

        assertEquals(snapshot, coordinator.getSnapshot("42").orElseThrow());
        assertEquals(1, observer.updates.size());
        assertTrue(observer.errors.isEmpty());
        assertEquals(1.0, registry.counter("portfolio.refresh", "outcome", "success", "kind", "none").count());
    }

    @Test
    @DisplayName("Failure keeps the previous snapshot readable and marks it stale")
    void testStaleSnapshotRetained() throws Exception {
        coordinator.addPortfolio(portfolio("42", "Main"));
        PortfolioSnapshot good = coordinator.manualRefresh("42").get(5, TimeUnit.SECONDS);

        provider.positionFailures.add(PortfolioFetchException.network("timeout"));
        provider.positionFailures.add(PortfolioFetchException.network("timeout"));
        assertThrows(ExecutionException.class, () -> coordinator.manualRefresh("42").get(5, TimeUnit.SECONDS));
        assertThrows(ExecutionException.class, () -> coordinator.manualRefresh("42").get(5, TimeUnit.SECONDS));

        PortfolioStatus status = coordinator.getStatus("42");
        assertSame(good, coordinator.getSnapshot("42").orElseThrow());
        assertTrue(status.isStale());
        assertEquals(FetchErrorKind.NETWORK_ERROR, status.getLastFailure().kind());
        assertEquals(2, status.getLastFailure().consecutiveFailures());
        assertEquals(List.of(1, 2), observer.errors.stream().map(RefreshFailure::consecutiveFailures).toList());
        assertEquals(2.0, registry.counter("portfolio.refresh", "outcome", "failure", "kind", "NETWORK_ERROR").count());

        coordinator.manualRefresh("42").get(5, TimeUnit.SECONDS);
        assertFalse(coordinator.getStatus("42").isStale());
        assertNull(coordinator.getStatus("42").getLastFailure());
    }

    @Test
    @DisplayName("One failing portfolio does not affect another")
    void testIsolation() throws Exception {
        provider.missingPortfolios.add("404");
        coordinator.addPortfolio(portfolio("42", "Main"));
        coordinator.addPortfolio(portfolio("404", "Gone"));

        CompletableFuture<PortfolioSnapshot> ok = coordinator.manualRefresh("42");
        CompletableFuture<PortfolioSnapshot> missing = coordinator.manualRefresh("404");

        assertNotNull(ok.get(5, TimeUnit.SECONDS));
        assertThrows(ExecutionException.class, () -> missing.get(5, TimeUnit.SECONDS));
        assertEquals(SchedulerState.WAITING_FOR_WAKE, coordinator.getStatus("42").getSchedulerState());
        assertEquals(SchedulerState.PAUSED, coordinator.getStatus("404").getSchedulerState());
        assertEquals(List.of("Gone", "Main"),
                coordinator.getStatuses().stream().map(PortfolioStatus::getDisplayName).toList());
    }

    @Test
    @DisplayName("Reconfiguring a paused portfolio starts it over")
    void testReconfigureResumes() throws Exception {
        provider.missingPortfolios.add("404");
        coordinator.addPortfolio(portfolio("404", "Gone"));
        assertThrows(ExecutionException.class, () -> coordinator.manualRefresh("404").get(5, TimeUnit.SECONDS));
        assertEquals(SchedulerState.PAUSED, coordinator.getStatus("404").getSchedulerState());

        coordinator.reconfigurePortfolio(portfolio("404", "Back"));

        assertEquals(SchedulerState.WAITING_FOR_WAKE, coordinator.getStatus("404").getSchedulerState());
        assertEquals("Back", coordinator.getConfig("404").getDisplayName());
    }

    @Test
    @DisplayName("Removing a portfolio drops it and its snapshot")
    void testRemove() throws Exception {
        coordinator.addPortfolio(portfolio("42", "Main"));
        coordinator.manualRefresh("42").get(5, TimeUnit.SECONDS);

        coordinator.removePortfolio("42");

        assertFalse(coordinator.isRegistered("42"));
        assertThrows(UnknownPortfolioException.class, () -> coordinator.getSnapshot("42"));
        assertEquals(SessionState.VALID, sessions.currentSession().getState());
        assertEquals(List.of("42"), observer.removed);
    }

    @Test
    @DisplayName("Reconfiguring tells observers the previous config is gone")
    void testReconfigureNotifiesRemoval() {
        coordinator.addPortfolio(portfolio("42", "Main"));

        coordinator.reconfigurePortfolio(portfolio("42", "Renamed"));

        assertEquals(List.of("42"), observer.removed);
        assertEquals("Renamed", coordinator.getConfig("42").getDisplayName());
    }

    @Test
    @DisplayName("A throwing observer does not block the others")
    void testObserverFailureContained() throws Exception {
        RecordingObserver second = new RecordingObserver();
        coordinator.addObserver(new PortfolioObserver() {
            @Override
            public void onSnapshotUpdated(PortfolioConfig config, PortfolioSnapshot snapshot) {
                throw new IllegalStateException("observer bug");
            }

            @Override
            public void onError(PortfolioConfig config, RefreshFailure failure) {
            }
        });
        coordinator.addObserver(second);
        coordinator.addPortfolio(portfolio("42", "Main"));

        coordinator.manualRefresh("42").get(5, TimeUnit.SECONDS);

        assertEquals(1, observer.updates.size());
        assertEquals(1, second.updates.size());
    }

    @Test
    @DisplayName("Refresh on start triggers an immediate fetch")
    void testRefreshOnStart() throws Exception {
        PortfolioCoordinator eager = new PortfolioCoordinator(
                sessions, provider, new WakeTimePolicy(MADRID, WeekendPolicy.CHECKPOINTS), executor, clock,
                registry, credentials, "EUR", true, List.of(observer));
        try {
            eager.addPortfolio(portfolio("7", "Eager"));
            // joins the start-up fetch if it is still running
            eager.manualRefresh("7").get(5, TimeUnit.SECONDS);

            assertTrue(eager.getSnapshot("7").isPresent());
            assertTrue(provider.positionCalls.get() >= 1);
        } finally {
            eager.shutdown();
        }
    }

    @Test
    @DisplayName("Available portfolios exclude watchlists")
    void testAvailablePortfolios() {
        provider.portfolios = List.of(
                new PortfolioInfo("1", "Main", "position"),
                new PortfolioInfo("2", "Ideas", "watchlist"));

        assertEquals(List.of(new PortfolioInfo("1", "Main", "position")), coordinator.availablePortfolios());
    }

    @Test
    @DisplayName("Updating credentials lifts an INVALID session")
    void testUpdateCredentials() throws Exception {
        provider.loginFailure = PortfolioFetchException.invalidCredentials("bad password");
        coordinator.addPortfolio(portfolio("42", "Main"));
        ExecutionException e = assertThrows(ExecutionException.class,
                () -> coordinator.manualRefresh("42").get(5, TimeUnit.SECONDS));
        assertEquals(FetchErrorKind.INVALID_CREDENTIALS, ((PortfolioFetchException) e.getCause()).getKind());

        provider.loginFailure = null;
        coordinator.updateCredentials("user@example.com", "fixed");

        assertEquals(new Credentials("user@example.com", "fixed"), credentials.current());
        assertEquals(SessionState.VALID, sessions.currentSession().getState());
        assertNotNull(coordinator.manualRefresh("42").get(5, TimeUnit.SECONDS));
    }

    @Test
    @DisplayName("Amounts from positions reach the snapshot")
    void testSnapshotValues() throws Exception {
        provider.positions = List.of(new Position("summary", 240937.98, 70864.27, -1615.47));
        coordinator.addPortfolio(portfolio("42", "Main"));

        PortfolioSnapshot s = coordinator.manualRefresh("42").get(5, TimeUnit.SECONDS);

        assertEquals(240937.98, s.getInvestedCapital(), 1e-9);
        assertEquals(29.41, s.getOpenPLPercent(), 1e-9);
        assertEquals(-0.67, s.getDailyPLPercent(), 1e-9);
    }

    static class RecordingObserver implements PortfolioObserver {

        final List<PortfolioSnapshot> updates = new CopyOnWriteArrayList<>();
        final List<RefreshFailure> errors = new CopyOnWriteArrayList<>();
        final List<String> removed = new CopyOnWriteArrayList<>();

        @Override
        public void onSnapshotUpdated(PortfolioConfig config, PortfolioSnapshot snapshot) {
            updates.add(snapshot);
        }

        @Override
        public void onError(PortfolioConfig config, RefreshFailure failure) {
            errors.add(failure);
        }

        @Override
        public void onPortfolioRemoved(PortfolioConfig config) {
            removed.add(config.getPortfolioId());
        }
    }
}
