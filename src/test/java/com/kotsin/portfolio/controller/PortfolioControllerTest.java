package com.kotsin.portfolio.controller;

import com.kotsin.portfolio.coordinator.PortfolioCoordinator;
import com.kotsin.portfolio.coordinator.UnknownPortfolioException;
import com.kotsin.portfolio.error.FetchErrorKind;
import com.kotsin.portfolio.error.PortfolioFetchException;
import com.kotsin.portfolio.model.PortfolioConfig;
import com.kotsin.portfolio.model.PortfolioSnapshot;
import com.kotsin.portfolio.model.PortfolioStatus;
import com.kotsin.portfolio.notification.PersistentNotification;
import com.kotsin.portfolio.notification.PersistentNotificationService;
import com.kotsin.portfolio.provider.PortfolioInfo;
import com.kotsin.portfolio.scheduler.SchedulerState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(PortfolioController.class)
class PortfolioControllerTest {

    @Autowired
    private MockMvc mvc;

    @MockBean
    private PortfolioCoordinator coordinator;

    @MockBean
    private PersistentNotificationService notificationService;

    private final PortfolioConfig config = PortfolioConfig.builder().portfolioId("42").displayName("Main Portfolio").build();

    private final PortfolioSnapshot snapshot = PortfolioSnapshot.builder()
            .portfolioId("42")
            .investedCapital(240937.98)
            .openPL(70864.27)
            .openPLPercent(29.41)
            .dailyPL(-1615.47)
            .dailyPLPercent(-0.67)
            .positionCount(1)
            .fetchedAt(Instant.parse("2026-01-12T10:00:00Z"))
            .currency("EUR")
            .build();

    @Test
    @DisplayName("Lists portfolio statuses")
    void testStatuses() throws Exception {
        when(coordinator.getStatuses()).thenReturn(List.of(PortfolioStatus.builder()
                .portfolioId("42").displayName("Main Portfolio")
                .schedulerState(SchedulerState.WAITING_FOR_WAKE)
                .snapshot(snapshot)
                .build()));

        mvc.perform(get("/api/portfolios"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].portfolioId").value("42"))
                .andExpect(jsonPath("$[0].schedulerState").value("WAITING_FOR_WAKE"))
                .andExpect(jsonPath("$[0].snapshot.investedCapital").value(240937.98))
                .andExpect(jsonPath("$[0].stale").value(false));
    }

    @Test
    @DisplayName("Unknown portfolio answers 404")
    void testUnknown() throws Exception {
        when(coordinator.getStatus("nope")).thenThrow(new UnknownPortfolioException("nope"));

        mvc.perform(get("/api/portfolios/nope"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("UNKNOWN_PORTFOLIO"));
    }

    @Test
    @DisplayName("Readings are published under their entity ids")
    void testReadings() throws Exception {
        when(coordinator.getConfig("42")).thenReturn(config);
        when(coordinator.getSnapshot("42")).thenReturn(Optional.of(snapshot));

        mvc.perform(get("/api/portfolios/42/readings"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.refreshButton").value("button.update_investing_main_portfolio"))
                .andExpect(jsonPath("$.readings.length()").value(5))
                .andExpect(jsonPath("$.readings[0].entityId").value("sensor.investing_main_portfolio"))
                .andExpect(jsonPath("$.readings[2].unit").value("%"));
    }

    @Test
    @DisplayName("No readings before the first successful refresh")
    void testReadingsEmpty() throws Exception {
        when(coordinator.getConfig("42")).thenReturn(config);
        when(coordinator.getSnapshot("42")).thenReturn(Optional.empty());

        mvc.perform(get("/api/portfolios/42/readings"))
                .andExpect(status().isNoContent());
    }

    @Test
    @DisplayName("Manual refresh returns the fresh snapshot")
    void testRefresh() throws Exception {
        when(coordinator.manualRefresh("42")).thenReturn(CompletableFuture.completedFuture(snapshot));

        mvc.perform(post("/api/portfolios/42/refresh"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.openPL").value(70864.27))
                .andExpect(jsonPath("$.currency").value("EUR"));
    }

    @Test
    @DisplayName("Failed manual refresh answers 502 with the error kind")
    void testRefreshFailure() throws Exception {
        when(coordinator.manualRefresh("42"))
                .thenReturn(CompletableFuture.failedFuture(PortfolioFetchException.portfolioNotFound("42")));

        mvc.perform(post("/api/portfolios/42/refresh"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.error").value(FetchErrorKind.PORTFOLIO_NOT_FOUND.name()));
    }

    @Test
    @DisplayName("Available portfolios and provider failures")
    void testAvailable() throws Exception {
        when(coordinator.availablePortfolios()).thenReturn(List.of(new PortfolioInfo("42", "Main", "position")));

        mvc.perform(get("/api/portfolios/available"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value("42"));

        when(coordinator.availablePortfolios()).thenThrow(PortfolioFetchException.invalidCredentials("rejected"));

        mvc.perform(get("/api/portfolios/available"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.error").value("INVALID_CREDENTIALS"));
    }

    @Test
    @DisplayName("Active notifications")
    void testNotifications() throws Exception {
        when(notificationService.activeNotifications()).thenReturn(List.of(new PersistentNotification(
                "investing_portfolio_main_portfolio_error", "42", "Investing Portfolio - Main Portfolio",
                "❌ Invalid portfolio ID for 'Main Portfolio'.", FetchErrorKind.PORTFOLIO_NOT_FOUND,
                Instant.parse("2026-01-12T10:00:00Z"))));

        mvc.perform(get("/api/notifications"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].notificationId").value("investing_portfolio_main_portfolio_error"))
                .andExpect(jsonPath("$[0].kind").value("PORTFOLIO_NOT_FOUND"));
    }
}
