package com.kotsin.portfolio.controller;

import com.kotsin.portfolio.coordinator.PortfolioCoordinator;
import com.kotsin.portfolio.coordinator.UnknownPortfolioException;
import com.kotsin.portfolio.entity.PortfolioReadings;
import com.kotsin.portfolio.error.PortfolioFetchException;
import com.kotsin.portfolio.model.PortfolioConfig;
import com.kotsin.portfolio.model.PortfolioSnapshot;
import com.kotsin.portfolio.model.PortfolioStatus;
import com.kotsin.portfolio.notification.PersistentNotification;
import com.kotsin.portfolio.notification.PersistentNotificationService;
import com.kotsin.portfolio.provider.PortfolioInfo;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 💰 Portfolio tracker API: statuses, readings and manual refresh.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class PortfolioController {

    static final long REFRESH_WAIT_SECONDS = 120;

    private final PortfolioCoordinator coordinator;
    private final PersistentNotificationService notificationService;

    @GetMapping("/portfolios")
    public ResponseEntity<List<PortfolioStatus>> getStatuses() {
        return ResponseEntity.ok(coordinator.getStatuses());
    }

    @GetMapping("/portfolios/{id}")
    public ResponseEntity<?> getStatus(@PathVariable String id) {
        try {
            return ResponseEntity.ok(coordinator.getStatus(id));
        } catch (UnknownPortfolioException e) {
            return notFound(id);
        }
    }

    /**
     * 📊 Readings of the latest snapshot, keyed by entity id. 204 until the first refresh succeeds.
     */
    @GetMapping("/portfolios/{id}/readings")
    public ResponseEntity<?> getReadings(@PathVariable String id) {
        try {
            PortfolioConfig config = coordinator.getConfig(id);
            return coordinator.getSnapshot(id)
                    .<ResponseEntity<?>>map(s -> ResponseEntity.ok(Map.of(
                            "portfolioId", id,
                            "fetchedAt", s.getFetchedAt(),
                            "refreshButton", PortfolioReadings.refreshButtonId(config),
                            "readings", PortfolioReadings.of(config, s))))
                    .orElseGet(() -> ResponseEntity.noContent().build());
        } catch (UnknownPortfolioException e) {
            return notFound(id);
        }
    }

    /**
     * 🔄 Manual refresh. Waits for the result; joins a refresh already in flight.
     */
    @PostMapping("/portfolios/{id}/refresh")
    public ResponseEntity<?> refresh(@PathVariable String id) {
        try {
            PortfolioSnapshot snapshot = coordinator.manualRefresh(id)
                    .get(REFRESH_WAIT_SECONDS, TimeUnit.SECONDS);
            return ResponseEntity.ok(snapshot);
        } catch (UnknownPortfolioException e) {
            return notFound(id);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof PortfolioFetchException pfe) {
                log.warn("🚨 [PortfolioAPI] Manual refresh of {} failed: {} {}", id, pfe.getKind(), pfe.getMessage());
                return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(error(pfe.getKind().name(), pfe.getMessage()));
            }
            log.error("🚨 [PortfolioAPI] Manual refresh of {} failed", id, cause);
            return ResponseEntity.internalServerError().body(error("INTERNAL", String.valueOf(cause)));
        } catch (TimeoutException e) {
            return ResponseEntity.status(HttpStatus.GATEWAY_TIMEOUT)
                    .body(error("TIMEOUT", "Refresh still running after " + REFRESH_WAIT_SECONDS + "s"));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(error("INTERRUPTED", "Interrupted"));
        }
    }

    @GetMapping("/portfolios/available")
    public ResponseEntity<?> available() {
        try {
            List<PortfolioInfo> portfolios = coordinator.availablePortfolios();
            return ResponseEntity.ok(portfolios);
        } catch (PortfolioFetchException e) {
            log.warn("🚨 [PortfolioAPI] Listing portfolios failed: {} {}", e.getKind(), e.getMessage());
            return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(error(e.getKind().name(), e.getMessage()));
        }
    }

    @GetMapping("/notifications")
    public ResponseEntity<List<PersistentNotification>> notifications() {
        return ResponseEntity.ok(notificationService.activeNotifications());
    }

    private ResponseEntity<?> notFound(String id) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(error("UNKNOWN_PORTFOLIO", "Portfolio not tracked: " + id));
    }

    private static Map<String, Object> error(String kind, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", kind);
        body.put("message", message);
        return body;
    }
}
