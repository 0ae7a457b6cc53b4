package org.carball.pooltune.metrics;

import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.carball.pooltune.MutableClock;
import org.carball.pooltune.config.MonitorSettings;
import org.carball.pooltune.config.OptimizationTuning;
import org.carball.pooltune.config.PoolConfigurationPatch;
import org.carball.pooltune.config.PoolEnvironment;
import org.carball.pooltune.model.query.QueryMetadata;
import org.carball.pooltune.monitor.QueryMonitor;
import org.carball.pooltune.pool.PoolConfigurationManager;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

public class PoolTuneMetricsTest {

    private SimpleMeterRegistry registry;
    private QueryMonitor monitor;
    private PoolConfigurationManager manager;

    @BeforeEach
    void setUp() {
        MutableClock clock = MutableClock.startingAt("2024-03-01T10:00:00Z");
        registry = new SimpleMeterRegistry();
        monitor = new QueryMonitor(MonitorSettings.defaults(), clock);
        manager = new PoolConfigurationManager(PoolEnvironment.STAGING,
                PoolEnvironment.STAGING.buildConfiguration(), OptimizationTuning.defaults(), clock);
        new PoolTuneMetrics(monitor, manager).bindTo(registry);
    }

    @AfterEach
    void tearDown() {
        monitor.close();
    }

    @Test
    void shouldExposeConfigurationGauges() {
        assertThat(registry.get("pooltune.pool.connections.max").tag("environment", "staging").gauge().value())
                .isEqualTo(20.0);
        assertThat(registry.get("pooltune.pool.connections.min").gauge().value()).isEqualTo(5.0);
        assertThat(registry.get("pooltune.pool.connection.timeout").gauge().value()).isEqualTo(8_000.0);
    }

    @Test
    void gaugesAndCounterShouldFollowCommittedChanges() {
        manager.updateConfiguration(PoolConfigurationPatch.builder().maxConnections(30).build());

        assertThat(registry.get("pooltune.pool.connections.max").gauge().value()).isEqualTo(30.0);
        assertThat(registry.get("pooltune.pool.configuration.changes").counter().count()).isEqualTo(1.0);
    }

    @Test
    void shouldTimeRecordedQueries() {
        // When
        monitor.recordQuery("SELECT name FROM users WHERE id = 1", List.of(), QueryMetadata.of(20));
        monitor.recordQuery("SELECT name FROM users WHERE id = 2", List.of(), QueryMetadata.of(40));
        monitor.recordQuery("DELETE FROM sessions WHERE id = 3", List.of(),
                QueryMetadata.builder().executionTimeMs(5).success(false).error("fk violation").build());

        // Then
        Timer timer = registry.get("pooltune.query.execution").tag("type", "select").tag("level", "good").timer();
        assertThat(timer.count()).isEqualTo(2);
        assertThat(timer.totalTime(TimeUnit.MILLISECONDS)).isCloseTo(60.0, within(0.001));
        assertThat(registry.get("pooltune.query.errors").tag("type", "delete").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("pooltune.query.patterns").gauge().value()).isEqualTo(2.0);
    }

    @Test
    void shouldCountSlowQueriesAndAlerts() {
        monitor.recordQuery("SELECT * FROM reports", List.of(), QueryMetadata.of(300));
        monitor.recordQuery("SELECT * FROM archive", List.of(), QueryMetadata.of(2_000));

        assertThat(registry.get("pooltune.query.slow").tag("type", "select").counter().count()).isEqualTo(2.0);
        assertThat(registry.get("pooltune.query.alerts").tag("type", "very_slow_query").counter().count())
                .isEqualTo(1.0);
    }
}
