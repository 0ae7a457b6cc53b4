package org.carball.pooltune.config;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Capacities, retention and scheduling for the query monitor.
 */
@Value
@Builder(toBuilder = true)
public class MonitorSettings {

    @Builder.Default
    PerformanceThresholds thresholds = PerformanceThresholds.defaults();

    @Builder.Default
    boolean monitoringEnabled = true;

    @Builder.Default
    int maxRecordsPerPattern = 100;

    @Builder.Default
    int maxSlowQueries = 1_000;

    // Patterns kept by the cleanup sweep, most recently executed first
    @Builder.Default
    int maxPatterns = 1_000;

    // Enforced on insert; the stalest pattern is evicted beyond this
    @Builder.Default
    int patternHardLimit = 5_000;

    @Builder.Default
    Duration retention = Duration.ofHours(24);

    @Builder.Default
    Duration cleanupInterval = Duration.ofHours(1);

    @Builder.Default
    Duration reportInterval = Duration.ofMinutes(15);

    @Builder.Default
    int reportPeriodMinutes = 60;

    @Builder.Default
    int topSlowQueryCount = 10;

    @Builder.Default
    int errorCountAlertThreshold = 5;

    // Executions per minute
    @Builder.Default
    int frequencyAlertThreshold = 10;

    public static MonitorSettings defaults() {
        return MonitorSettings.builder().build();
    }
}
