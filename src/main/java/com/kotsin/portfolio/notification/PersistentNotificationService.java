package com.kotsin.portfolio.notification;

import com.kotsin.portfolio.config.TrackerProperties;
import com.kotsin.portfolio.coordinator.PortfolioObserver;
import com.kotsin.portfolio.entity.PortfolioNames;
import com.kotsin.portfolio.error.FetchErrorKind;
import com.kotsin.portfolio.model.PortfolioConfig;
import com.kotsin.portfolio.model.PortfolioSnapshot;
import com.kotsin.portfolio.model.RefreshFailure;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;

/**
 * Raises one persistent notification per failing portfolio and dismisses it on
 * the next successful refresh.
 *
 * <p>Failures that need the user (bad credentials, deleted portfolio) notify on
 * first occurrence. Transient failures notify only after
 * {@code transientFailureThreshold} consecutive attempts have failed, and a
 * later user-action failure replaces a transient notice.
 *
 * <p>Relays are sent on {@code relayExecutor}, off the refresh thread.
 */
@Service
@Slf4j
public class PersistentNotificationService implements PortfolioObserver {

    static final String TITLE = "Investing Portfolio";
    static final String ID_PREFIX = "investing_portfolio_";

    private final List<NotificationRelay> relays;
    private final int transientFailureThreshold;
    private final Executor relayExecutor;
    private final ConcurrentMap<String, PersistentNotification> active = new ConcurrentHashMap<>();

    @Autowired
    public PersistentNotificationService(List<NotificationRelay> relays, TrackerProperties props) {
        this(relays, props.transientFailureThreshold(), Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "notification-relay");
            t.setDaemon(true);
            return t;
        }));
    }

    /**
     * Relays are sent on the calling thread.
     */
    public PersistentNotificationService(List<NotificationRelay> relays, int transientFailureThreshold) {
        this(relays, transientFailureThreshold, Runnable::run);
    }

    public PersistentNotificationService(List<NotificationRelay> relays,
                                         int transientFailureThreshold,
                                         Executor relayExecutor) {
        this.relays = relays;
        this.transientFailureThreshold = Math.max(1, transientFailureThreshold);
        this.relayExecutor = relayExecutor;
    }

    @Override
    public void onSnapshotUpdated(PortfolioConfig config, PortfolioSnapshot snapshot) {
        PersistentNotification dismissed = active.remove(notificationId(config));
        if (dismissed != null) {
            log.info("✅ [Notify] Cleared {} for '{}'", dismissed.kind(), config.getDisplayName());
        }
    }

    @Override
    public void onError(PortfolioConfig config, RefreshFailure failure) {
        FetchErrorKind kind = failure.kind();
        if (kind == FetchErrorKind.AUTH_EXPIRED) {
            return;
        }
        if (kind.isTransient() && failure.consecutiveFailures() < transientFailureThreshold) {
            return;
        }
        String id = notificationId(config);
        PersistentNotification notification = new PersistentNotification(
                id,
                config.getPortfolioId(),
                TITLE + " - " + config.getDisplayName(),
                messageFor(config, failure),
                kind,
                failure.occurredAt());
        PersistentNotification previous = active.get(id);
        if (previous != null && (previous.kind() == kind || !kind.requiresUserAction())) {
            return;
        }
        active.put(id, notification);
        log.warn("🔔 [Notify] {}: {}", notification.title(), notification.message());
        relay(notification);
    }

    @Override
    public void onPortfolioRemoved(PortfolioConfig config) {
        PersistentNotification dismissed = active.remove(notificationId(config));
        if (dismissed != null) {
            log.info("✅ [Notify] Cleared {} for removed portfolio '{}'", dismissed.kind(), config.getDisplayName());
        }
    }

    public List<PersistentNotification> activeNotifications() {
        return active.values().stream()
                .sorted(Comparator.comparing(PersistentNotification::createdAt))
                .toList();
    }

    @PreDestroy
    public void shutdown() {
        if (relayExecutor instanceof ExecutorService) {
            ((ExecutorService) relayExecutor).shutdown();
        }
    }

    private void relay(PersistentNotification notification) {
        for (NotificationRelay relay : relays) {
            try {
                relayExecutor.execute(() -> {
                    try {
                        relay.send(notification);
                    } catch (RuntimeException e) {
                        log.error("Notification relay {} failed", relay.getClass().getSimpleName(), e);
                    }
                });
            } catch (RejectedExecutionException e) {
                log.warn("Notification relay {} skipped: executor shut down", relay.getClass().getSimpleName());
            }
        }
    }

    static String notificationId(PortfolioConfig config) {
        return ID_PREFIX + PortfolioNames.normalize(config.getDisplayName()) + "_error";
    }

    private String messageFor(PortfolioConfig config, RefreshFailure failure) {
        String name = config.getDisplayName();
        return switch (failure.kind()) {
            case INVALID_CREDENTIALS -> "❌ Authentication token expired or invalid for '" + name + "'. "
                    + "Please re-configure the tracker with your credentials. Error: " + failure.message();
            case PORTFOLIO_NOT_FOUND -> "❌ Invalid portfolio ID for '" + name + "'. Error: " + failure.message();
            default -> "⚠️ " + failure.consecutiveFailures() + " consecutive failed updates for '" + name
                    + "' (" + failure.kind() + "). Last error: " + failure.message();
        };
    }
}
