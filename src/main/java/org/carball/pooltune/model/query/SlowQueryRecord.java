package org.carball.pooltune.model.query;

import com.fasterxml.jackson.annotation.JsonUnwrapped;

/**
 * A slow query execution together with its analysis.
 */
public record SlowQueryRecord(
        @JsonUnwrapped QueryRecord record,
        SlowQueryAnalysis analysis
) {
    public long executionTimeMs() {
        return record.getExecutionTimeMs();
    }
}
