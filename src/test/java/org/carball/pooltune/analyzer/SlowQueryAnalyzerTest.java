package org.carball.pooltune.analyzer;

import org.carball.pooltune.analyzer.detector.AntiPatternDetector;
import org.carball.pooltune.config.PerformanceThresholds;
import org.carball.pooltune.model.query.AntiPattern;
import org.carball.pooltune.model.query.QueryRecord;
import org.carball.pooltune.model.query.SlowQueryAnalysis;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

public class SlowQueryAnalyzerTest {

    private final SlowQueryAnalyzer analyzer = new SlowQueryAnalyzer();
    private final PerformanceThresholds thresholds = PerformanceThresholds.defaults();

    @Test
    void shouldFlagTableScanForSelectStarWithInequality() {
        SlowQueryAnalysis analysis = analyzer.analyze(record("SELECT * FROM t WHERE a=1 AND b!=2", 1_500), thresholds);

        assertThat(analysis.tableScanDetected()).isTrue();
        assertThat(analysis.nPlusOneDetected()).isFalse();
        assertThat(analysis.reason()).isEqualTo("Possible full table scan");
        assertThat(analysis.detectedPatterns()).containsExactly(AntiPattern.TABLE_SCAN);
        assertThat(analysis.missingIndexes()).containsExactly("a", "b");
    }

    @Test
    void shouldFlagInequalityCombinationWithoutSelectStar() {
        SlowQueryAnalysis analysis = analyzer.analyze(
                record("SELECT id FROM t WHERE a = 1 AND b <> 2 LIMIT 5", 1_500), thresholds);

        assertThat(analysis.tableScanDetected()).isTrue();
    }

    @Test
    void shouldFlagUnboundedOrderBy() {
        assertThat(analyzer.analyze(record("SELECT id FROM t WHERE a = 1 ORDER BY b", 1_500), thresholds)
                .tableScanDetected()).isTrue();
        assertThat(analyzer.analyze(record("SELECT id FROM t WHERE a = 1 ORDER BY b LIMIT 10", 1_500), thresholds)
                .tableScanDetected()).isFalse();
    }

    @Test
    void shouldReportDetectionsInOrderWithFirstAsReason() {
        SlowQueryAnalysis analysis = analyzer.analyze(
                record("SELECT * FROM users WHERE id IN (SELECT user_id FROM orders WHERE total = 5)", 2_000),
                thresholds);

        assertThat(analysis.detectedPatterns()).containsExactly(AntiPattern.TABLE_SCAN, AntiPattern.N_PLUS_ONE);
        assertThat(analysis.reason()).isEqualTo("Possible full table scan");
        assertThat(analysis.suggestions()).hasSizeGreaterThanOrEqualTo(2);
    }

    @Test
    void shouldDetectCartesianProduct() {
        SlowQueryAnalysis analysis = analyzer.analyze(record("SELECT a.x, b.y FROM a, b", 1_200), thresholds);

        assertThat(analysis.cartesianProduct()).isTrue();
        assertThat(analyzer.analyze(record("SELECT a.x FROM a, b WHERE a.id = b.id", 1_200), thresholds)
                .cartesianProduct()).isFalse();
    }

    @Test
    void shouldDetectCorrelatedSubquery() {
        SlowQueryAnalysis analysis = analyzer.analyze(record(
                "SELECT name FROM emp e WHERE salary = (SELECT MAX(salary) FROM emp x WHERE x.dept = e.dept)",
                1_200), thresholds);

        assertThat(analysis.subqueryIssue()).isTrue();

        assertThat(analyzer.analyze(record(
                "SELECT dept FROM emp GROUP BY dept HAVING COUNT(*) > (SELECT 3)", 1_200), thresholds)
                .subqueryIssue()).isTrue();
    }

    @Test
    void shouldSuggestDecompositionAboveVerySlowThreshold() {
        SlowQueryAnalysis analysis = analyzer.analyze(record("SELECT id FROM t WHERE a = 1 LIMIT 1", 6_000), thresholds);

        assertThat(analysis.suggestions()).anyMatch(s -> s.contains("breaking it into smaller queries"));
        assertThat(analysis.reason()).contains("6000ms");
    }

    @Test
    void shouldSkipIndexCandidatesWhenIndexUsageReported() {
        QueryRecord record = record("SELECT id FROM t WHERE a = 1 LIMIT 1", 1_500).toBuilder()
                .indexUsage(List.of("t_a_idx"))
                .build();

        SlowQueryAnalysis analysis = analyzer.analyze(record, thresholds);

        assertThat(analysis.missingIndexes()).isEmpty();
        assertThat(analysis.suggestions()).noneMatch(s -> s.startsWith("Consider adding indexes"));
    }

    @Test
    void failingDetectorShouldCountAsNoDetection() {
        AntiPatternDetector broken = new AntiPatternDetector() {
            @Override
            public AntiPattern getAntiPattern() {
                return AntiPattern.N_PLUS_ONE;
            }

            @Override
            public boolean detect(String normalizedQuery) {
                throw new IllegalStateException("boom");
            }

            @Override
            public String getReason() {
                return "never";
            }

            @Override
            public String getSuggestion() {
                return "never";
            }
        };
        SlowQueryAnalyzer withBroken = new SlowQueryAnalyzer(List.of(broken));

        SlowQueryAnalysis analysis = withBroken.analyze(record("SELECT id FROM t WHERE a = 1", 1_500), thresholds);

        assertThat(analysis.nPlusOneDetected()).isFalse();
        assertThat(analysis.detectedPatterns()).isEmpty();
    }

    @Test
    void shouldAnalyzeVeryLongQueriesWithoutFailing() {
        String longQuery = "SELECT * FROM t WHERE " + "a = 1 AND ".repeat(5_000) + "b = 2";

        SlowQueryAnalysis analysis = analyzer.analyze(record(longQuery, 1_500), thresholds);

        assertThat(analysis.tableScanDetected()).isTrue();
    }

    private static QueryRecord record(String query, long executionTimeMs) {
        return QueryRecord.builder()
                .query(query)
                .executionTimeMs(executionTimeMs)
                .build();
    }
}
