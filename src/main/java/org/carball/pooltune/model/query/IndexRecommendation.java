package org.carball.pooltune.model.query;

import java.util.List;

public record IndexRecommendation(
        String table,
        List<String> columns,
        int estimatedImprovementPercent,
        String estimatedImprovement
) {
    public IndexRecommendation {
        columns = List.copyOf(columns);
    }
}
