package org.carball.pooltune.monitor;

import org.carball.pooltune.config.MonitorSettings;
import org.carball.pooltune.model.query.PerformanceReport;
import org.carball.pooltune.model.query.QueryMetadata;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

public class QueryMonitorSchedulingTest {

    private QueryMonitor monitor;

    @AfterEach
    void tearDown() {
        if (monitor != null) {
            monitor.close();
        }
    }

    @Test
    void shouldPublishReportsPeriodicallyOnceStarted() {
        // Given
        monitor = new QueryMonitor(MonitorSettings.builder()
                .cleanupInterval(Duration.ofMillis(50))
                .reportInterval(Duration.ofMillis(50))
                .build());
        List<PerformanceReport> reports = new CopyOnWriteArrayList<>();
        monitor.addListener(new QueryMonitorListener() {
            @Override
            public void onPerformanceReport(PerformanceReport report) {
                reports.add(report);
            }
        });
        monitor.recordQuery("SELECT id FROM users WHERE id = 1", List.of(), QueryMetadata.of(4));

        // When
        monitor.start();
        monitor.start();

        // Then
        await().atMost(Duration.ofSeconds(5)).until(() -> reports.size() >= 2);
        assertThat(reports.get(0).summary().totalQueries()).isEqualTo(1);
    }

    @Test
    void cleanupTimerShouldExpireOldRecords() {
        monitor = new QueryMonitor(MonitorSettings.builder()
                .retention(Duration.ofMillis(100))
                .cleanupInterval(Duration.ofMillis(50))
                .build());
        monitor.recordQuery("SELECT id FROM users WHERE id = 1", List.of(), QueryMetadata.of(4));
        assertThat(monitor.getPatternCount()).isEqualTo(1);

        monitor.start();

        await().atMost(Duration.ofSeconds(5)).until(() -> monitor.getPatternCount() == 0);
    }

    @Test
    void closeShouldStopScheduledWork() {
        monitor = new QueryMonitor(MonitorSettings.builder().reportInterval(Duration.ofMillis(20)).build());
        monitor.start();

        monitor.close();

        assertThat(monitor.getQueryStats()).isEmpty();
    }
}
