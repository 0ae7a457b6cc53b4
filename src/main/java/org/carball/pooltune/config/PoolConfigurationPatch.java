package org.carball.pooltune.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A partial pool configuration. Fields left {@code null} keep the value of the
 * configuration the patch is applied to.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PoolConfigurationPatch {

    private Integer minConnections;
    private Integer maxConnections;
    private Long connectionTimeoutMs;
    private Long idleTimeoutMs;
    private Long maxConnectionLifetimeMs;
    private Integer retryAttempts;
    private Long retryDelayMs;
    private Long healthCheckIntervalMs;
    private Long healthCheckTimeoutMs;
    private Long statementTimeoutMs;
    private Long queryTimeoutMs;
    private String applicationTag;
    private Boolean metricsEnabled;
    private Long metricsIntervalMs;
    private Long slowQueryThresholdMs;

    /**
     * Creates a patch that sets every field to the value held by {@code config}.
     */
    public static PoolConfigurationPatch of(PoolConfiguration config) {
        return PoolConfigurationPatch.builder()
                .minConnections(config.getMinConnections())
                .maxConnections(config.getMaxConnections())
                .connectionTimeoutMs(config.getConnectionTimeoutMs())
                .idleTimeoutMs(config.getIdleTimeoutMs())
                .maxConnectionLifetimeMs(config.getMaxConnectionLifetimeMs())
                .retryAttempts(config.getRetryAttempts())
                .retryDelayMs(config.getRetryDelayMs())
                .healthCheckIntervalMs(config.getHealthCheckIntervalMs())
                .healthCheckTimeoutMs(config.getHealthCheckTimeoutMs())
                .statementTimeoutMs(config.getStatementTimeoutMs())
                .queryTimeoutMs(config.getQueryTimeoutMs())
                .applicationTag(config.getApplicationTag())
                .metricsEnabled(config.isMetricsEnabled())
                .metricsIntervalMs(config.getMetricsIntervalMs())
                .slowQueryThresholdMs(config.getSlowQueryThresholdMs())
                .build();
    }

    /**
     * Merges this patch onto {@code base}. The base is not modified.
     */
    public PoolConfiguration applyTo(PoolConfiguration base) {
        PoolConfiguration.PoolConfigurationBuilder builder = base.toBuilder();

        if (minConnections != null) builder.minConnections(minConnections);
        if (maxConnections != null) builder.maxConnections(maxConnections);
        if (connectionTimeoutMs != null) builder.connectionTimeoutMs(connectionTimeoutMs);
        if (idleTimeoutMs != null) builder.idleTimeoutMs(idleTimeoutMs);
        if (maxConnectionLifetimeMs != null) builder.maxConnectionLifetimeMs(maxConnectionLifetimeMs);
        if (retryAttempts != null) builder.retryAttempts(retryAttempts);
        if (retryDelayMs != null) builder.retryDelayMs(retryDelayMs);
        if (healthCheckIntervalMs != null) builder.healthCheckIntervalMs(healthCheckIntervalMs);
        if (healthCheckTimeoutMs != null) builder.healthCheckTimeoutMs(healthCheckTimeoutMs);
        if (statementTimeoutMs != null) builder.statementTimeoutMs(statementTimeoutMs);
        if (queryTimeoutMs != null) builder.queryTimeoutMs(queryTimeoutMs);
        if (applicationTag != null) builder.applicationTag(applicationTag);
        if (metricsEnabled != null) builder.metricsEnabled(metricsEnabled);
        if (metricsIntervalMs != null) builder.metricsIntervalMs(metricsIntervalMs);
        if (slowQueryThresholdMs != null) builder.slowQueryThresholdMs(slowQueryThresholdMs);

        return builder.build();
    }

    /**
     * Lists the fields this patch leaves unset. A complete patch can stand in
     * for a whole configuration.
     */
    @JsonIgnore
    public List<String> getMissingFields() {
        List<String> missing = new ArrayList<>();
        if (minConnections == null) missing.add("minConnections");
        if (maxConnections == null) missing.add("maxConnections");
        if (connectionTimeoutMs == null) missing.add("connectionTimeoutMs");
        if (idleTimeoutMs == null) missing.add("idleTimeoutMs");
        if (maxConnectionLifetimeMs == null) missing.add("maxConnectionLifetimeMs");
        if (retryAttempts == null) missing.add("retryAttempts");
        if (retryDelayMs == null) missing.add("retryDelayMs");
        if (healthCheckIntervalMs == null) missing.add("healthCheckIntervalMs");
        if (healthCheckTimeoutMs == null) missing.add("healthCheckTimeoutMs");
        if (statementTimeoutMs == null) missing.add("statementTimeoutMs");
        if (queryTimeoutMs == null) missing.add("queryTimeoutMs");
        if (applicationTag == null) missing.add("applicationTag");
        if (metricsEnabled == null) missing.add("metricsEnabled");
        if (metricsIntervalMs == null) missing.add("metricsIntervalMs");
        if (slowQueryThresholdMs == null) missing.add("slowQueryThresholdMs");
        return missing;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return getMissingFields().size() == 15;
    }
}
