package com.kotsin.portfolio.scheduler;

import com.kotsin.portfolio.error.FetchErrorKind;
import com.kotsin.portfolio.error.PortfolioFetchException;
import com.kotsin.portfolio.fetcher.PortfolioFetcher;
import com.kotsin.portfolio.model.PortfolioConfig;
import com.kotsin.portfolio.model.PortfolioSnapshot;
import com.kotsin.portfolio.model.ScheduleState;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-portfolio refresh state machine.
 *
 * <pre>
 *   IDLE -> WAITING_FOR_WAKE -> FETCHING -> WAITING_FOR_WAKE            (success)
 *                                        -> COOLDOWN -> WAITING_FOR_WAKE (failure)
 *                                        -> COOLDOWN -> PAUSED           (portfolio not found)
 * </pre>
 *
 * <p>At most one fetch is in flight. A manual request during a fetch joins the
 * running one instead of starting another. Failures keep the normal policy
 * cadence: no backoff and no early retry.
 */
@Slf4j
public class RefreshScheduler {

    private final PortfolioConfig config;
    private final PortfolioFetcher fetcher;
    private final WakeTimePolicy policy;
    private final ScheduledExecutorService executor;
    private final Clock clock;
    private final RefreshListener listener;

    private final ReentrantLock lock = new ReentrantLock();

    // guarded by lock
    private SchedulerState state = SchedulerState.IDLE;
    private ScheduledFuture<?> wakeTimer;
    private long wakeGeneration;
    private Future<?> fetchTask;
    private CompletableFuture<PortfolioSnapshot> inFlight;
    private Instant firedWakeAt;
    private Instant nextWakeAt;
    private Instant lastAttemptAt;
    private Instant lastSuccessAt;

    public RefreshScheduler(PortfolioConfig config,
                            PortfolioFetcher fetcher,
                            WakeTimePolicy policy,
                            ScheduledExecutorService executor,
                            Clock clock,
                            RefreshListener listener) {
        this.config = config;
        this.fetcher = fetcher;
        this.policy = policy;
        this.executor = executor;
        this.clock = clock;
        this.listener = listener;
    }

    public void start() {
        lock.lock();
        try {
            if (state != SchedulerState.IDLE) {
                throw new IllegalStateException("Scheduler for " + config.getPortfolioId() + " is " + state);
            }
            scheduleNextWake(clock.instant());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Starts a fetch now, or joins the one already running.
     * The returned future completes with the snapshot or a {@link PortfolioFetchException}.
     */
    public CompletableFuture<PortfolioSnapshot> requestRefresh() {
        lock.lock();
        try {
            if (state == SchedulerState.STOPPED) {
                return CompletableFuture.failedFuture(
                        new IllegalStateException("Scheduler for " + config.getPortfolioId() + " is stopped"));
            }
            if (inFlight != null) {
                log.debug("Refresh of {} already in flight; joining it", config.getPortfolioId());
                return inFlight.copy();
            }
            cancelWakeTimer();
            return beginFetch(null).copy();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Cancels the pending wake and any running fetch. A fetch that completes
     * afterwards is discarded without reaching the listener.
     */
    public void stop() {
        CompletableFuture<PortfolioSnapshot> pending;
        lock.lock();
        try {
            if (state == SchedulerState.STOPPED) {
                return;
            }
            state = SchedulerState.STOPPED;
            cancelWakeTimer();
            if (fetchTask != null) {
                fetchTask.cancel(true);
                fetchTask = null;
            }
            pending = inFlight;
            inFlight = null;
            nextWakeAt = null;
        } finally {
            lock.unlock();
        }
        if (pending != null) {
            pending.cancel(false);
        }
        log.info("Scheduler stopped for portfolio {}", config.getPortfolioId());
    }

    public SchedulerState getState() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    public ScheduleState getScheduleState() {
        lock.lock();
        try {
            return new ScheduleState(nextWakeAt, lastAttemptAt, lastSuccessAt, inFlight != null);
        } finally {
            lock.unlock();
        }
    }

    // ---------------------------------------------------------------------
    // Transitions (lock held unless noted)
    // ---------------------------------------------------------------------
    // package-private for tests
    void onWake(long generation) {
        lock.lock();
        try {
            // only the currently armed timer may start a fetch
            if (generation != wakeGeneration || state != SchedulerState.WAITING_FOR_WAKE || inFlight != null) {
                log.debug("Ignoring stale wake timer for {}", config.getPortfolioId());
                return;
            }
            wakeTimer = null;
            log.debug("Scheduled wake for {} at {}", config.getPortfolioId(), nextWakeAt);
            beginFetch(nextWakeAt);
        } finally {
            lock.unlock();
        }
    }

    private CompletableFuture<PortfolioSnapshot> beginFetch(Instant wake) {
        CompletableFuture<PortfolioSnapshot> result = new CompletableFuture<>();
        state = SchedulerState.FETCHING;
        firedWakeAt = wake;
        lastAttemptAt = clock.instant();
        inFlight = result;
        try {
            fetchTask = executor.submit(() -> runFetch(result));
        } catch (RejectedExecutionException e) {
            inFlight = null;
            state = SchedulerState.STOPPED;
            result.completeExceptionally(e);
        }
        return result;
    }

    // runs on the executor, lock not held
    private void runFetch(CompletableFuture<PortfolioSnapshot> result) {
        PortfolioSnapshot snapshot = null;
        PortfolioFetchException failure = null;
        try {
            snapshot = fetcher.fetch(config.getPortfolioId());
        } catch (RuntimeException e) {
            failure = PortfolioFetchException.classify(e);
        }
        finish(result, snapshot, failure);
    }

    private void finish(CompletableFuture<PortfolioSnapshot> result,
                        PortfolioSnapshot snapshot,
                        PortfolioFetchException failure) {
        lock.lock();
        try {
            if (inFlight != result) {
                log.debug("Discarding result of cancelled fetch for {}", config.getPortfolioId());
                return;
            }
            inFlight = null;
            fetchTask = null;
            Instant now = clock.instant();
            // a timer that fired a little early must not re-arm the same wake
            Instant from = firedWakeAt != null && now.isBefore(firedWakeAt) ? firedWakeAt : now;
            firedWakeAt = null;

            if (failure == null) {
                lastSuccessAt = now;
                notifyListener(() -> listener.onRefreshed(snapshot));
                scheduleNextWake(from);
            } else {
                state = SchedulerState.COOLDOWN;
                logFailure(failure);
                notifyListener(() -> listener.onRefreshFailed(failure));
                if (failure.getKind() == FetchErrorKind.PORTFOLIO_NOT_FOUND) {
                    state = SchedulerState.PAUSED;
                    nextWakeAt = null;
                    log.warn("Scheduler for {} paused until the portfolio is reconfigured",
                            config.getPortfolioId());
                } else {
                    scheduleNextWake(from);
                }
            }
        } finally {
            lock.unlock();
        }
        if (failure == null) {
            result.complete(snapshot);
        } else {
            result.completeExceptionally(failure);
        }
    }

    private void scheduleNextWake(Instant from) {
        Instant wake = policy.nextWake(from, config.getScheduleOptions());
        long delayMs = Math.max(0, Duration.between(clock.instant(), wake).toMillis());
        long generation = ++wakeGeneration;
        try {
            wakeTimer = executor.schedule(() -> onWake(generation), delayMs, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.warn("Executor rejected wake for {}; scheduler stopping", config.getPortfolioId());
            state = SchedulerState.STOPPED;
            nextWakeAt = null;
            return;
        }
        nextWakeAt = wake;
        state = SchedulerState.WAITING_FOR_WAKE;
        log.debug("Next refresh of {} at {}", config.getPortfolioId(), wake.atZone(policy.getZone()));
    }

    private void cancelWakeTimer() {
        wakeGeneration++;
        if (wakeTimer != null) {
            wakeTimer.cancel(false);
            wakeTimer = null;
        }
    }

    private void notifyListener(Runnable call) {
        try {
            call.run();
        } catch (RuntimeException e) {
            log.error("Refresh listener failed for {}", config.getPortfolioId(), e);
        }
    }

    private void logFailure(PortfolioFetchException failure) {
        String id = config.getPortfolioId();
        switch (failure.getKind()) {
            case DECODE_ERROR -> log.error("Unexpected response shape for '{}' ({}): {}",
                    config.getDisplayName(), id, failure.getMessage());
            case NETWORK_ERROR -> log.warn("Network error refreshing '{}' ({}): {}",
                    config.getDisplayName(), id, failure.getMessage());
            default -> log.error("Refresh of '{}' ({}) failed with {}: {}",
                    config.getDisplayName(), id, failure.getKind(), failure.getMessage());
        }
    }
}
