package com.kotsin.portfolio.coordinator;

import com.kotsin.portfolio.config.TrackerProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Registers the portfolios listed under {@code tracker.portfolios} once the context is up.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class PortfolioTrackerBootstrap {

    private final PortfolioCoordinator coordinator;
    private final TrackerProperties props;

    @EventListener(ApplicationReadyEvent.class)
    public void registerConfiguredPortfolios() {
        if (!props.autoStart()) {
            log.info("[Bootstrap] tracker.auto-start=false; no portfolios registered");
            return;
        }
        if (props.portfolios().isEmpty()) {
            log.warn("[Bootstrap] No portfolios configured under tracker.portfolios");
            return;
        }
        for (TrackerProperties.Portfolio entry : props.portfolios()) {
            try {
                coordinator.addPortfolio(entry.toConfig());
            } catch (IllegalArgumentException | DuplicatePortfolioException e) {
                log.error("[Bootstrap] Skipping portfolio entry {}: {}", entry.id(), e.getMessage());
            }
        }
        log.info("🚀 [Bootstrap] Tracking {} portfolio(s)", coordinator.getStatuses().size());
    }
}
