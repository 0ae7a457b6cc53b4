package org.carball.pooltune.config;

import lombok.extern.slf4j.Slf4j;
import org.carball.pooltune.exception.InvalidConfigurationException;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks a pool configuration against the invariants every committed
 * configuration must satisfy.
 */
@Slf4j
public class ConfigurationValidator {

    static final long MIN_CONNECTION_TIMEOUT_MS = 1_000;
    static final long MIN_IDLE_TIMEOUT_MS = 10_000;
    static final long MIN_CONNECTION_LIFETIME_MS = 180_000;

    private final PoolEnvironment environment;

    public ConfigurationValidator(PoolEnvironment environment) {
        this.environment = environment;
    }

    /**
     * Returns every violated rule; an empty list means the configuration is valid.
     */
    public List<String> validate(PoolConfiguration config) {
        List<String> violations = new ArrayList<>();

        if (config.getMinConnections() < 0) {
            violations.add("minConnections must not be negative (was " + config.getMinConnections() + ")");
        }
        if (config.getMaxConnections() <= config.getMinConnections()) {
            violations.add("maxConnections (" + config.getMaxConnections()
                    + ") must be greater than minConnections (" + config.getMinConnections() + ")");
        }
        if (config.getMaxConnections() > environment.getHardConnectionLimit()) {
            violations.add("maxConnections (" + config.getMaxConnections() + ") must not exceed "
                    + environment.getHardConnectionLimit() + " in " + environment.getName());
        }
        if (config.getConnectionTimeoutMs() < MIN_CONNECTION_TIMEOUT_MS) {
            violations.add("connectionTimeoutMs must be at least " + MIN_CONNECTION_TIMEOUT_MS
                    + " (was " + config.getConnectionTimeoutMs() + ")");
        }
        if (config.getIdleTimeoutMs() < MIN_IDLE_TIMEOUT_MS) {
            violations.add("idleTimeoutMs must be at least " + MIN_IDLE_TIMEOUT_MS
                    + " (was " + config.getIdleTimeoutMs() + ")");
        }
        if (config.getMaxConnectionLifetimeMs() < MIN_CONNECTION_LIFETIME_MS) {
            violations.add("maxConnectionLifetimeMs must be at least " + MIN_CONNECTION_LIFETIME_MS
                    + " (was " + config.getMaxConnectionLifetimeMs() + ")");
        }

        return violations;
    }

    /**
     * @throws InvalidConfigurationException listing every violation
     */
    public void requireValid(PoolConfiguration config) {
        List<String> violations = validate(config);
        if (!violations.isEmpty()) {
            log.error("Pool configuration validation failed for {}: {}", environment.getName(), violations);
            throw new InvalidConfigurationException(violations);
        }
        log.debug("Pool configuration valid for {}: {}", environment.getName(), config.getSummary());
    }
}
