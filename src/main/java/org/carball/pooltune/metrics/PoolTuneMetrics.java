package org.carball.pooltune.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.MeterBinder;
import lombok.extern.slf4j.Slf4j;
import org.carball.pooltune.config.PoolConfiguration;
import org.carball.pooltune.model.query.QueryAlert;
import org.carball.pooltune.model.query.QueryRecord;
import org.carball.pooltune.model.query.QueryStats;
import org.carball.pooltune.model.query.SlowQueryRecord;
import org.carball.pooltune.monitor.QueryMonitor;
import org.carball.pooltune.monitor.QueryMonitorListener;
import org.carball.pooltune.pool.PoolConfigurationListener;
import org.carball.pooltune.pool.PoolConfigurationManager;

import java.time.Duration;

/**
 * Exposes query timings and pool configuration as Micrometer meters.
 * Binding registers this instance as a listener on the monitor and the manager.
 */
@Slf4j
public class PoolTuneMetrics implements MeterBinder, QueryMonitorListener, PoolConfigurationListener {

    private final QueryMonitor queryMonitor;
    private final PoolConfigurationManager configurationManager;

    private volatile MeterRegistry registry;
    private Counter configurationChanges;

    public PoolTuneMetrics(QueryMonitor queryMonitor, PoolConfigurationManager configurationManager) {
        this.queryMonitor = queryMonitor;
        this.configurationManager = configurationManager;
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        String environment = configurationManager.getEnvironment().getName();

        Gauge.builder("pooltune.pool.connections.max", configurationManager,
                        m -> m.getCurrentConfiguration().getMaxConnections())
                .description("Configured maximum pool size")
                .tag("environment", environment)
                .register(registry);
        Gauge.builder("pooltune.pool.connections.min", configurationManager,
                        m -> m.getCurrentConfiguration().getMinConnections())
                .description("Configured minimum pool size")
                .tag("environment", environment)
                .register(registry);
        Gauge.builder("pooltune.pool.connection.timeout", configurationManager,
                        m -> m.getCurrentConfiguration().getConnectionTimeoutMs())
                .description("Configured connection timeout in milliseconds")
                .tag("environment", environment)
                .register(registry);
        Gauge.builder("pooltune.query.patterns", queryMonitor, QueryMonitor::getPatternCount)
                .description("Query patterns currently tracked")
                .register(registry);

        configurationChanges = Counter.builder("pooltune.pool.configuration.changes")
                .description("Committed pool configuration changes")
                .tag("environment", environment)
                .register(registry);

        this.registry = registry;
        queryMonitor.addListener(this);
        configurationManager.addListener(this);
        log.debug("Bound pooltune metrics for {}", environment);
    }

    @Override
    public void onQueryRecorded(QueryRecord record, QueryStats stats) {
        MeterRegistry current = registry;
        if (current == null) {
            return;
        }
        Timer.builder("pooltune.query.execution")
                .description("Query execution time")
                .tag("type", record.getType().name().toLowerCase())
                .tag("level", record.getPerformanceLevel().toJson())
                .register(current)
                .record(Duration.ofMillis(record.getExecutionTimeMs()));
        if (!record.isSuccess()) {
            current.counter("pooltune.query.errors", "type", record.getType().name().toLowerCase()).increment();
        }
    }

    @Override
    public void onSlowQuery(SlowQueryRecord slowQuery) {
        MeterRegistry current = registry;
        if (current != null) {
            current.counter("pooltune.query.slow", "type", slowQuery.record().getType().name().toLowerCase())
                    .increment();
        }
    }

    @Override
    public void onAlert(QueryAlert alert) {
        MeterRegistry current = registry;
        if (current != null) {
            current.counter("pooltune.query.alerts", "type", alert.type().toJson()).increment();
        }
    }

    @Override
    public void onConfigurationChanged(PoolConfiguration previous, PoolConfiguration current) {
        if (configurationChanges != null) {
            configurationChanges.increment();
        }
    }
}
