package com.fintech.marketdata.config;

import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.config.MeterFilter;
import io.micrometer.core.instrument.distribution.DistributionStatisticConfig;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Metrics configuration: common tags and percentiles for the service's own timers.
 *
 * Histogram buckets span 1ms to 30s, the range of upstream fetches and blob uploads.
 */
@Configuration
public class MetricsConfiguration {

    private static final String METRIC_PREFIX = "marketdata.";

    @Bean
    public MeterRegistryCustomizer<MeterRegistry> metricsCommonTags() {
        return registry -> {
            registry.config().commonTags(
                "application", "market-data-source-service",
                "environment", getEnvironment()
            );

            registry.config().meterFilter(new MeterFilter() {
                @Override
                public DistributionStatisticConfig configure(Meter.Id id, DistributionStatisticConfig config) {
                    if (id.getType() != Meter.Type.TIMER || !id.getName().startsWith(METRIC_PREFIX)) {
                        return config;
                    }
                    return DistributionStatisticConfig.builder()
                        .percentiles(0.5, 0.95, 0.99)
                        .percentilePrecision(2)
                        .serviceLevelObjectives(
                            Duration.ofMillis(1).toNanos(),
                            Duration.ofMillis(10).toNanos(),
                            Duration.ofMillis(100).toNanos(),
                            Duration.ofMillis(500).toNanos(),
                            Duration.ofSeconds(1).toNanos(),
                            Duration.ofSeconds(5).toNanos(),
                            Duration.ofSeconds(30).toNanos()
                        )
                        .percentilesHistogram(true)
                        .expiry(Duration.ofMinutes(2))
                        .bufferLength(3)
                        .build()
                        .merge(config);
                }
            });
        };
    }

    private String getEnvironment() {
        String env = System.getenv("SPRING_PROFILES_ACTIVE");
        return env != null ? env : "local";
    }
}
