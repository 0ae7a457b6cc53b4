package org.carball.pooltune.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

@Getter
public enum PoolEnvironment {

    DEVELOPMENT("development", "Fast connections, relaxed resource limits",
            50, 10, 200, false) {
        @Override
        public PoolConfiguration buildConfiguration() {
            return PoolConfiguration.builder()
                    .minConnections(2)
                    .maxConnections(10)
                    .connectionTimeoutMs(5_000)
                    .idleTimeoutMs(30_000)
                    .maxConnectionLifetimeMs(180_000)
                    .retryAttempts(3)
                    .retryDelayMs(1_000)
                    .healthCheckIntervalMs(10_000)
                    .healthCheckTimeoutMs(2_000)
                    .statementTimeoutMs(30_000)
                    .queryTimeoutMs(60_000)
                    .applicationTag("pooltune-dev")
                    .metricsEnabled(true)
                    .metricsIntervalMs(5_000)
                    .slowQueryThresholdMs(1_000)
                    .build();
        }
    },

    TEST("test", "Minimal resources, quick execution",
            20, 5, 100, false) {
        @Override
        public PoolConfiguration buildConfiguration() {
            return PoolConfiguration.builder()
                    .minConnections(1)
                    .maxConnections(5)
                    .connectionTimeoutMs(3_000)
                    .idleTimeoutMs(10_000)
                    .maxConnectionLifetimeMs(180_000)
                    .retryAttempts(2)
                    .retryDelayMs(500)
                    .healthCheckIntervalMs(15_000)
                    .healthCheckTimeoutMs(1_000)
                    .statementTimeoutMs(10_000)
                    .queryTimeoutMs(30_000)
                    .applicationTag("pooltune-test")
                    .metricsEnabled(false)
                    .metricsIntervalMs(10_000)
                    .slowQueryThresholdMs(500)
                    .build();
        }
    },

    STAGING("staging", "Close to production, smaller scale",
            100, 20, 500, false) {
        @Override
        public PoolConfiguration buildConfiguration() {
            return PoolConfiguration.builder()
                    .minConnections(5)
                    .maxConnections(20)
                    .connectionTimeoutMs(8_000)
                    .idleTimeoutMs(60_000)
                    .maxConnectionLifetimeMs(600_000)
                    .retryAttempts(5)
                    .retryDelayMs(2_000)
                    .healthCheckIntervalMs(8_000)
                    .healthCheckTimeoutMs(3_000)
                    .statementTimeoutMs(45_000)
                    .queryTimeoutMs(90_000)
                    .applicationTag("pooltune-staging")
                    .metricsEnabled(true)
                    .metricsIntervalMs(3_000)
                    .slowQueryThresholdMs(2_000)
                    .build();
        }
    },

    PRODUCTION("production", "High throughput and availability",
            500, 50, 1000, true) {
        @Override
        public PoolConfiguration buildConfiguration() {
            return PoolConfiguration.builder()
                    .minConnections(10)
                    .maxConnections(50)
                    .connectionTimeoutMs(10_000)
                    .idleTimeoutMs(120_000)
                    .maxConnectionLifetimeMs(1_800_000)
                    .retryAttempts(10)
                    .retryDelayMs(3_000)
                    .healthCheckIntervalMs(5_000)
                    .healthCheckTimeoutMs(5_000)
                    .statementTimeoutMs(60_000)
                    .queryTimeoutMs(120_000)
                    .applicationTag("pooltune-prod")
                    .metricsEnabled(true)
                    .metricsIntervalMs(1_000)
                    .slowQueryThresholdMs(5_000)
                    .build();
        }
    };

    private final String name;
    private final String description;
    /** Upper bound the optimizer may grow {@code maxConnections} to. */
    private final int scalingCeiling;
    /** Floor the optimizer never shrinks {@code maxConnections} below. */
    private final int baseMaxConnections;
    /** Hard limit enforced by validation. */
    private final int hardConnectionLimit;
    private final boolean productionLike;

    PoolEnvironment(String name, String description, int scalingCeiling, int baseMaxConnections,
                    int hardConnectionLimit, boolean productionLike) {
        this.name = name;
        this.description = description;
        this.scalingCeiling = scalingCeiling;
        this.baseMaxConnections = baseMaxConnections;
        this.hardConnectionLimit = hardConnectionLimit;
        this.productionLike = productionLike;
    }

    /**
     * Creates the preset pool configuration for this environment.
     */
    public abstract PoolConfiguration buildConfiguration();

    @JsonValue
    public String getName() {
        return name;
    }

    /**
     * Finds an environment by name (case-insensitive). Accepts the short forms
     * {@code dev} and {@code prod}.
     */
    @JsonCreator
    public static PoolEnvironment fromName(String name) {
        if (name != null) {
            String normalized = name.trim();
            if (normalized.equalsIgnoreCase("dev")) return DEVELOPMENT;
            if (normalized.equalsIgnoreCase("prod")) return PRODUCTION;
            for (PoolEnvironment environment : values()) {
                if (environment.getName().equalsIgnoreCase(normalized)) {
                    return environment;
                }
            }
        }
        throw new IllegalArgumentException("Unknown pool environment: " + name +
                ". Available environments: " + getAvailableEnvironments());
    }

    /**
     * Returns a comma-separated list of available environment names.
     */
    public static String getAvailableEnvironments() {
        StringBuilder sb = new StringBuilder();
        for (PoolEnvironment environment : values()) {
            if (!sb.isEmpty()) sb.append(", ");
            sb.append(environment.getName());
        }
        return sb.toString();
    }

    public static String getEnvironmentHelp() {
        StringBuilder help = new StringBuilder();
        help.append("Available Pool Environments:\n\n");
        for (PoolEnvironment environment : values()) {
            help.append(String.format("  %-12s %s (max connections %d..%d)\n",
                    environment.getName(), environment.getDescription(),
                    environment.getBaseMaxConnections(), environment.getScalingCeiling()));
        }
        return help.toString();
    }
}
