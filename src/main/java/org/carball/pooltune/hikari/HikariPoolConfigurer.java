package org.carball.pooltune.hikari;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariConfigMXBean;
import lombok.extern.slf4j.Slf4j;
import org.carball.pooltune.config.PoolConfiguration;
import org.carball.pooltune.pool.PoolConfigurationListener;

/**
 * Maps pool configurations onto HikariCP, both when a pool is created and
 * while it is running.
 */
@Slf4j
public class HikariPoolConfigurer implements PoolConfigurationListener {

    private final HikariConfigMXBean runtimeConfig;

    /**
     * @param runtimeConfig the running pool that committed changes are pushed to
     */
    public HikariPoolConfigurer(HikariConfigMXBean runtimeConfig) {
        this.runtimeConfig = runtimeConfig;
    }

    /**
     * Creates a Hikari configuration for a new pool. Connection settings (JDBC
     * URL, credentials) are left to the caller.
     */
    public static HikariConfig toHikariConfig(PoolConfiguration config) {
        HikariConfig hikariConfig = new HikariConfig();

        // Pool size settings
        hikariConfig.setMinimumIdle(config.getMinConnections());
        hikariConfig.setMaximumPoolSize(config.getMaxConnections());

        // Timeout settings
        hikariConfig.setConnectionTimeout(config.getConnectionTimeoutMs());
        hikariConfig.setIdleTimeout(config.getIdleTimeoutMs());
        hikariConfig.setMaxLifetime(config.getMaxConnectionLifetimeMs());
        hikariConfig.setValidationTimeout(config.getHealthCheckTimeoutMs());
        hikariConfig.setKeepaliveTime(config.getHealthCheckIntervalMs());

        // Pool name for logging
        hikariConfig.setPoolName(config.getApplicationTag());
        hikariConfig.addDataSourceProperty("ApplicationName", config.getApplicationTag());

        hikariConfig.setRegisterMbeans(config.isMetricsEnabled());
        return hikariConfig;
    }

    @Override
    public void onConfigurationChanged(PoolConfiguration previous, PoolConfiguration current) {
        applyRuntime(current);
    }

    /**
     * Pushes the settings Hikari can change on a running pool.
     */
    public void applyRuntime(PoolConfiguration config) {
        // Keep minimumIdle <= maximumPoolSize at every step
        if (config.getMaxConnections() >= runtimeConfig.getMaximumPoolSize()) {
            runtimeConfig.setMaximumPoolSize(config.getMaxConnections());
            runtimeConfig.setMinimumIdle(config.getMinConnections());
        } else {
            runtimeConfig.setMinimumIdle(config.getMinConnections());
            runtimeConfig.setMaximumPoolSize(config.getMaxConnections());
        }
        runtimeConfig.setConnectionTimeout(config.getConnectionTimeoutMs());
        runtimeConfig.setIdleTimeout(config.getIdleTimeoutMs());
        runtimeConfig.setMaxLifetime(config.getMaxConnectionLifetimeMs());
        runtimeConfig.setValidationTimeout(config.getHealthCheckTimeoutMs());

        log.info("Applied configuration to running pool {}: {}", runtimeConfig.getPoolName(), config.getSummary());
    }
}
