package org.carball.pooltune.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.pooltune.analyzer.detector.AntiPatternDetector;
import org.carball.pooltune.analyzer.detector.CartesianProductDetector;
import org.carball.pooltune.analyzer.detector.CorrelatedSubqueryDetector;
import org.carball.pooltune.analyzer.detector.NPlusOneDetector;
import org.carball.pooltune.analyzer.detector.TableScanDetector;
import org.carball.pooltune.config.PerformanceThresholds;
import org.carball.pooltune.model.query.AntiPattern;
import org.carball.pooltune.model.query.QueryRecord;
import org.carball.pooltune.model.query.SlowQueryAnalysis;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Runs the anti-pattern detectors over a slow query and assembles advisory findings.
 * A detector that fails is treated as not having detected anything.
 */
@Slf4j
public class SlowQueryAnalyzer {

    static final int MAX_ANALYZED_LENGTH = 10_000;

    private final List<AntiPatternDetector> detectors;

    public SlowQueryAnalyzer() {
        this(defaultDetectors());
    }

    public SlowQueryAnalyzer(List<AntiPatternDetector> detectors) {
        this.detectors = List.copyOf(detectors);
    }

    public static List<AntiPatternDetector> defaultDetectors() {
        return List.of(
                new TableScanDetector(),
                new NPlusOneDetector(),
                new CartesianProductDetector(),
                new CorrelatedSubqueryDetector()
        );
    }

    public SlowQueryAnalysis analyze(QueryRecord record, PerformanceThresholds thresholds) {
        String normalized = normalize(record.getQuery());

        String reason = null;
        List<String> suggestions = new ArrayList<>();
        Set<AntiPattern> detected = EnumSet.noneOf(AntiPattern.class);

        for (AntiPatternDetector detector : detectors) {
            if (runDetector(detector, normalized)) {
                detected.add(detector.getAntiPattern());
                suggestions.add(detector.getSuggestion());
                if (reason == null) {
                    reason = detector.getReason();
                }
            }
        }

        if (record.getExecutionTimeMs() > thresholds.getVerySlowMs()) {
            suggestions.add("Query exceeds " + thresholds.getVerySlowMs()
                    + "ms; consider breaking it into smaller queries");
        }

        List<String> missingIndexes = List.of();
        boolean indexUsageReported = record.getIndexUsage() != null && !record.getIndexUsage().isEmpty();
        if (!indexUsageReported) {
            missingIndexes = IndexCandidateExtractor.extract(truncate(record.getQuery()));
            if (!missingIndexes.isEmpty()) {
                suggestions.add("Consider adding indexes on: " + String.join(", ", missingIndexes));
            }
        }

        if (reason == null) {
            reason = "Execution time " + record.getExecutionTimeMs() + "ms exceeded the slow query threshold";
        }

        return new SlowQueryAnalysis(
                reason,
                suggestions,
                missingIndexes,
                detected.contains(AntiPattern.TABLE_SCAN),
                detected.contains(AntiPattern.N_PLUS_ONE),
                detected.contains(AntiPattern.CARTESIAN_PRODUCT),
                detected.contains(AntiPattern.CORRELATED_SUBQUERY),
                new ArrayList<>(detected)
        );
    }

    private boolean runDetector(AntiPatternDetector detector, String normalized) {
        try {
            return detector.detect(normalized);
        } catch (RuntimeException | StackOverflowError e) {
            log.debug("Detector {} failed, treating as no detection: {}",
                    detector.getAntiPattern(), e.toString());
            return false;
        }
    }

    static String normalize(String query) {
        return truncate(query).replaceAll("\\s+", " ").trim().toUpperCase(Locale.ROOT);
    }

    private static String truncate(String query) {
        if (query == null) {
            return "";
        }
        return query.length() > MAX_ANALYZED_LENGTH ? query.substring(0, MAX_ANALYZED_LENGTH) : query;
    }
}
