package com.kotsin.portfolio.model;

import lombok.Builder;
import lombok.Value;

/**
 * Static, user-supplied description of one tracked portfolio.
 */
@Value
@Builder(toBuilder = true)
public class PortfolioConfig {

    String portfolioId;
    String displayName;
    @Builder.Default
    ScheduleOptions scheduleOptions = ScheduleOptions.defaults();
}
