package org.carball.pooltune.monitor;

import org.carball.pooltune.MutableClock;
import org.carball.pooltune.config.MonitorSettings;
import org.carball.pooltune.model.query.IndexRecommendation;
import org.carball.pooltune.model.query.PerformanceReport;
import org.carball.pooltune.model.query.QueryMetadata;
import org.carball.pooltune.model.query.QueryType;
import org.carball.pooltune.model.query.QueryTypeSummary;
import org.carball.pooltune.model.query.SlowQueryRecord;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

public class PerformanceReportTest {

    private MutableClock clock;
    private QueryMonitor monitor;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-03-01T10:00:00Z");
        monitor = new QueryMonitor(MonitorSettings.defaults(), clock);
    }

    @AfterEach
    void tearDown() {
        monitor.close();
    }

    @Test
    void shouldSummarizeMixedWorkload() {
        // Given
        for (int i = 0; i < 8; i++) {
            monitor.recordQuery("SELECT name FROM users WHERE id = " + i, List.of(),
                    QueryMetadata.builder().executionTimeMs(5).cacheHit(i < 5).build());
        }
        monitor.recordQuery("INSERT INTO audit VALUES (1)", List.of(), QueryMetadata.of(300));
        monitor.recordQuery("COMMIT", List.of(),
                QueryMetadata.builder().executionTimeMs(1_500).success(false).error("lock timeout").build());

        // When
        PerformanceReport report = monitor.generatePerformanceReport(60);

        // Then
        assertThat(report.summary().totalQueries()).isEqualTo(10);
        assertThat(report.summary().slowQueries()).isEqualTo(2);
        assertThat(report.summary().averageExecutionTimeMs()).isCloseTo(184.0, within(0.001));
        assertThat(report.summary().errorRate()).isCloseTo(10.0, within(0.001));
        assertThat(report.summary().cacheHitRate()).isCloseTo(50.0, within(0.001));

        QueryTypeSummary selects = report.queryTypeStats().get(QueryType.SELECT);
        assertThat(selects.count()).isEqualTo(8);
        assertThat(selects.avgTimeMs()).isCloseTo(5.0, within(0.001));
        assertThat(selects.slowCount()).isZero();
        assertThat(report.queryTypeStats()).containsKeys(QueryType.INSERT, QueryType.TRANSACTION);

        assertThat(report.optimizationRecommendations())
                .anyMatch(r -> r.startsWith("20.0% of queries are slow"))
                .anyMatch(r -> r.startsWith("Slow transactions detected"))
                .noneMatch(r -> r.startsWith("Workload is read-heavy"));
        assertThat(report.period().minutes()).isEqualTo(60);
        assertThat(report.generatedAt()).isEqualTo(clock.instant());
    }

    @Test
    void shouldFlagReadHeavyWorkload() {
        for (int i = 0; i < 9; i++) {
            monitor.recordQuery("SELECT name FROM users WHERE id = " + i, List.of(), QueryMetadata.of(3));
        }
        monitor.recordQuery("INSERT INTO audit VALUES (1)", List.of(), QueryMetadata.of(3));

        PerformanceReport report = monitor.generatePerformanceReport(60);

        assertThat(report.optimizationRecommendations()).singleElement()
                .satisfies(r -> assertThat(r).startsWith("Workload is read-heavy"));
        assertThat(report.topSlowQueries()).isEmpty();
        assertThat(report.indexRecommendations()).isEmpty();
    }

    @Test
    void shouldOnlyIncludeRecordsInsideThePeriod() {
        monitor.recordQuery("SELECT * FROM archive", List.of(), QueryMetadata.of(2_000));
        clock.advance(Duration.ofHours(2));
        monitor.recordQuery("SELECT id FROM users WHERE id = 1", List.of(), QueryMetadata.of(4));

        PerformanceReport report = monitor.generatePerformanceReport(60);

        assertThat(report.summary().totalQueries()).isEqualTo(1);
        assertThat(report.topSlowQueries()).isEmpty();
        assertThat(report.period().start()).isEqualTo(clock.instant().minus(Duration.ofMinutes(60)));
    }

    @Test
    void shouldListSlowestQueriesFirstAndLimitThem() {
        for (int i = 1; i <= 12; i++) {
            monitor.recordQuery("SELECT * FROM t" + i, List.of(), QueryMetadata.of(200 + i * 10));
        }

        PerformanceReport report = monitor.generatePerformanceReport(60);

        assertThat(report.topSlowQueries()).hasSize(10)
                .extracting(SlowQueryRecord::executionTimeMs)
                .startsWith(320L, 310L)
                .isSortedAccordingTo((a, b) -> Long.compare(b, a));
    }

    @Test
    void shouldRecommendIndexesPerTable() {
        // Given
        monitor.recordQuery("SELECT id FROM orders WHERE customer_id = 1", List.of(), QueryMetadata.of(1_500));
        monitor.recordQuery("SELECT id FROM orders WHERE customer_id = 2", List.of(), QueryMetadata.of(1_200));
        monitor.recordQuery("SELECT id FROM users WHERE email = 'x'", List.of(), QueryMetadata.of(900));
        monitor.recordQuery("SELECT id FROM products WHERE sku = 'y'", List.of(),
                QueryMetadata.builder().executionTimeMs(900).indexUsed("products_sku_idx").build());

        // When
        List<IndexRecommendation> recommendations = monitor.generatePerformanceReport(60).indexRecommendations();

        // Then
        assertThat(recommendations).extracting(IndexRecommendation::table).containsExactly("orders", "users");
        assertThat(recommendations.get(0).columns()).containsExactly("customer_id");
        assertThat(recommendations.get(0).estimatedImprovementPercent()).isEqualTo(30);
        assertThat(recommendations.get(0).estimatedImprovement()).isEqualTo("30% faster queries on orders");
        assertThat(recommendations.get(1).columns()).containsExactly("email");
        assertThat(recommendations.get(1).estimatedImprovementPercent()).isEqualTo(15);
    }

    @Test
    void indexRecommendationsShouldOnlyCoverTheListedSlowQueries() {
        // Given
        for (int i = 0; i < 10; i++) {
            monitor.recordQuery("SELECT id FROM big WHERE k = " + i, List.of(), QueryMetadata.of(900));
        }
        monitor.recordQuery("SELECT id FROM small WHERE k = 1", List.of(), QueryMetadata.of(300));

        // When
        PerformanceReport report = monitor.generatePerformanceReport(60);

        // Then
        assertThat(report.topSlowQueries()).hasSize(10)
                .allSatisfy(entry -> assertThat(entry.executionTimeMs()).isEqualTo(900L));
        assertThat(report.indexRecommendations()).singleElement().satisfies(recommendation -> {
            assertThat(recommendation.table()).isEqualTo("big");
            assertThat(recommendation.estimatedImprovementPercent()).isEqualTo(95);
        });
    }

    @Test
    void emptyWindowShouldProduceEmptyReport() {
        PerformanceReport report = monitor.generatePerformanceReport(15);

        assertThat(report.summary().totalQueries()).isZero();
        assertThat(report.summary().averageExecutionTimeMs()).isZero();
        assertThat(report.queryTypeStats()).isEmpty();
        assertThat(report.optimizationRecommendations()).isEmpty();
    }
}
