package org.carball.pooltune.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Tunable parameters of a database connection pool.
 * <p>
 * Instances are immutable; a new version of the configuration is produced
 * with {@link #toBuilder()} or {@link PoolConfigurationPatch#applyTo(PoolConfiguration)}
 * and replaces the previous one wholesale.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class PoolConfiguration {

    // Pool size
    int minConnections;
    int maxConnections;

    // Connection lifecycle
    long connectionTimeoutMs;
    long idleTimeoutMs;
    long maxConnectionLifetimeMs;

    // Retry and health checking
    int retryAttempts;
    long retryDelayMs;
    long healthCheckIntervalMs;
    long healthCheckTimeoutMs;

    // Statement limits
    long statementTimeoutMs;
    long queryTimeoutMs;
    String applicationTag;

    // Monitoring
    boolean metricsEnabled;
    long metricsIntervalMs;
    long slowQueryThresholdMs;

    /**
     * Returns a one-line description used in log output.
     */
    @JsonIgnore
    public String getSummary() {
        return String.format("min=%d max=%d connTimeout=%dms idle=%dms lifetime=%dms retries=%d/%dms tag=%s",
                minConnections, maxConnections, connectionTimeoutMs, idleTimeoutMs,
                maxConnectionLifetimeMs, retryAttempts, retryDelayMs, applicationTag);
    }
}
