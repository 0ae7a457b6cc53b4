package org.carball.pooltune.config;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;
import lombok.extern.slf4j.Slf4j;

/**
 * Millisecond boundaries used to grade query executions.
 * A query faster than {@code excellentMs} is excellent, faster than {@code goodMs}
 * is good and so on; anything at or above {@code slowMs} is very slow.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@Slf4j
public class PerformanceThresholds {

    @Builder.Default
    long excellentMs = 10;

    @Builder.Default
    long goodMs = 50;

    @Builder.Default
    long acceptableMs = 200;

    @Builder.Default
    long slowMs = 1_000;

    // Execution time above which slow-query analysis suggests decomposing the query
    @Builder.Default
    long verySlowMs = 5_000;

    @Builder.Default
    long maxQueryTimeMs = 30_000;

    // Percent
    @Builder.Default
    double errorRateThreshold = 5.0;

    public static PerformanceThresholds defaults() {
        return PerformanceThresholds.builder().build();
    }

    /**
     * Logs warnings for boundaries that are out of order.
     */
    public void validate() {
        if (goodMs <= excellentMs) {
            log.warn("Good threshold ({}ms) should be greater than excellent threshold ({}ms)", goodMs, excellentMs);
        }
        if (acceptableMs <= goodMs) {
            log.warn("Acceptable threshold ({}ms) should be greater than good threshold ({}ms)", acceptableMs, goodMs);
        }
        if (slowMs <= acceptableMs) {
            log.warn("Slow threshold ({}ms) should be greater than acceptable threshold ({}ms)", slowMs, acceptableMs);
        }
        if (verySlowMs <= slowMs) {
            log.warn("Very slow threshold ({}ms) should be greater than slow threshold ({}ms)", verySlowMs, slowMs);
        }
        log.debug("Using query thresholds - excellent: {}ms, good: {}ms, acceptable: {}ms, slow: {}ms, verySlow: {}ms",
                excellentMs, goodMs, acceptableMs, slowMs, verySlowMs);
    }
}
