package org.carball.pooltune.model.query;

import java.util.List;

/**
 * Advisory findings for a slow query. Heuristic, never authoritative.
 */
public record SlowQueryAnalysis(
        String reason,
        List<String> suggestions,
        List<String> missingIndexes,
        boolean tableScanDetected,
        boolean nPlusOneDetected,
        boolean cartesianProduct,
        boolean subqueryIssue,
        List<AntiPattern> detectedPatterns
) {
    public SlowQueryAnalysis {
        suggestions = List.copyOf(suggestions);
        missingIndexes = List.copyOf(missingIndexes);
        detectedPatterns = List.copyOf(detectedPatterns);
    }
}
