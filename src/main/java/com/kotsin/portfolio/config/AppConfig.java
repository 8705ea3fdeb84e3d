package com.kotsin.portfolio.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.kotsin.portfolio.provider.DeviceIds;
import com.kotsin.portfolio.provider.InvestingComProvider;
import com.kotsin.portfolio.provider.PortfolioProvider;
import com.kotsin.portfolio.scheduler.WakeTimePolicy;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
@EnableConfigurationProperties(TrackerProperties.class)
@Slf4j
public class AppConfig {

    @Bean
    public OkHttpClient okHttpClient(TrackerProperties props) {
        return new OkHttpClient.Builder()
                .callTimeout(props.requestTimeout())
                .build();
    }

    @Bean
    public Clock clock(TrackerProperties props) {
        return Clock.system(ZoneId.of(props.zone()));
    }

    @Bean
    public WakeTimePolicy wakeTimePolicy(TrackerProperties props) {
        return new WakeTimePolicy(ZoneId.of(props.zone()), props.weekendPolicy());
    }

    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService refreshExecutor(TrackerProperties props) {
        AtomicInteger seq = new AtomicInteger();
        ThreadFactory factory = r -> {
            Thread t = new Thread(r, "portfolio-refresh-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        return Executors.newScheduledThreadPool(Math.max(1, props.schedulerThreads()), factory);
    }

    @Bean
    public PortfolioProvider portfolioProvider(OkHttpClient http, ObjectMapper mapper, TrackerProperties props) {
        String seed = props.deviceSeed();
        String udid = seed == null || seed.isBlank()
                ? DeviceIds.generate(null)
                : DeviceIds.generate(seed + ":" + props.email());
        log.info("[Config] Investing.com API at {} (zone {}, weekend policy {})",
                props.baseUrl(), props.zone(), props.weekendPolicy());
        return new InvestingComProvider(http, mapper, HttpUrl.get(props.baseUrl()), udid);
    }
}
