package org.carball.pooltune.model.pool;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

/**
 * Coarse risk classification of a proposed configuration change.
 *
 * @param level   overall risk level
 * @param score   accumulated risk score
 * @param factors human-readable contributing factors, in scoring order
 */
public record RiskAssessment(
        RiskLevel level,
        int score,
        List<String> factors
) {
    public RiskAssessment {
        factors = List.copyOf(factors);
    }

    @JsonIgnore
    public boolean isHigh() {
        return level == RiskLevel.HIGH;
    }
}
