package com.fintech.marketmaking.config;

import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.config.MeterFilter;
import io.micrometer.core.instrument.distribution.DistributionStatisticConfig;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Metrics configuration for backtest runs.
 *
 * Timers here measure whole-security sessions and whole runs (milliseconds to minutes),
 * so histogram buckets are sized for that range rather than per-event latency.
 */
@Configuration
public class MetricsConfiguration {

    @Bean
    public MeterRegistryCustomizer<MeterRegistry> metricsCommonTags() {
        return registry -> {
            registry.config().commonTags(
                "application", "market-making-backtest",
                "environment", getEnvironment()
            );

            registry.config().meterFilter(new MeterFilter() {
                @Override
                public DistributionStatisticConfig configure(Meter.Id id, DistributionStatisticConfig config) {
                    if (id.getType() == Meter.Type.TIMER && id.getName().startsWith("backtest.")) {
                        return DistributionStatisticConfig.builder()
                            .percentiles(0.5, 0.95, 0.99)
                            .percentilePrecision(2)
                            .serviceLevelObjectives(
                                Duration.ofMillis(10).toNanos(),
                                Duration.ofMillis(100).toNanos(),
                                Duration.ofSeconds(1).toNanos(),
                                Duration.ofSeconds(10).toNanos(),
                                Duration.ofSeconds(60).toNanos(),
                                Duration.ofMinutes(10).toNanos()
                            )
                            .percentilesHistogram(true)
                            .expiry(Duration.ofMinutes(10))
                            .bufferLength(3)
                            .build()
                            .merge(config);
                    }
                    return config;
                }
            });
        };
    }

    /**
     * Detect environment from the active Spring profile.
     */
    private String getEnvironment() {
        String env = System.getenv("SPRING_PROFILES_ACTIVE");
        return env != null ? env : "local";
    }
}
