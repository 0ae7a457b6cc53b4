package org.carball.pooltune.model.query;

import java.time.Instant;
import java.util.List;

public record QueryAlert(
        AlertType type,
        String queryPattern,
        String message,
        long executionTimeMs,
        long errorCount,
        double errorRate,
        int frequency,
        double averageExecutionTimeMs,
        List<String> suggestions,
        Instant timestamp
) {
    public QueryAlert {
        suggestions = List.copyOf(suggestions);
    }
}
