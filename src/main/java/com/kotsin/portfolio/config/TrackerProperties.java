package com.kotsin.portfolio.config;

import com.kotsin.portfolio.model.PortfolioConfig;
import com.kotsin.portfolio.model.ScheduleOptions;
import com.kotsin.portfolio.scheduler.WeekendPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;
import java.util.List;

@ConfigurationProperties(prefix = "tracker")
public record TrackerProperties(
        String email,
        String password,
        String deviceSeed,                                          // stable x-udid across restarts
        @DefaultValue("https://aappapi.investing.com") String baseUrl,
        @DefaultValue("Europe/Madrid") String zone,                 // reference zone for every schedule
        @DefaultValue("EUR") String currency,
        @DefaultValue("30s") Duration requestTimeout,
        @DefaultValue("0s") Duration maxTokenAge,                   // 0 = trust tokens of unknown expiry until rejected
        @DefaultValue("4") int schedulerThreads,
        @DefaultValue("true") boolean autoStart,
        @DefaultValue("true") boolean refreshOnStart,
        @DefaultValue("CHECKPOINTS") WeekendPolicy weekendPolicy,
        @DefaultValue("3") int transientFailureThreshold,
        List<Portfolio> portfolios
) {

    @Override
    public List<Portfolio> portfolios() {
        return portfolios != null ? portfolios : List.of();
    }

    public record Portfolio(
            String id,
            String name,
            Integer intervalMinutes,
            Integer startHour,
            Integer endHour,
            String nightUpdate,         // HH:MM
            String morningUpdate        // HH:MM
    ) {

        public PortfolioConfig toConfig() {
            if (id == null || id.isBlank()) {
                throw new IllegalArgumentException("tracker.portfolios[].id is required");
            }
            ScheduleOptions options = ScheduleOptions.builder()
                    .intervalMinutes(intervalMinutes)
                    .startHour(startHour)
                    .endHour(endHour)
                    .nightUpdate(ScheduleOptions.parseTime(nightUpdate))
                    .morningUpdate(ScheduleOptions.parseTime(morningUpdate))
                    .build();
            return PortfolioConfig.builder()
                    .portfolioId(id.trim())
                    .displayName(name != null && !name.isBlank() ? name : "Portfolio " + id.trim())
                    .scheduleOptions(options)
                    .build();
        }
    }
}
