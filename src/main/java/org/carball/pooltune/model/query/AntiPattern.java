package org.carball.pooltune.model.query;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Query shapes known to correlate with poor performance.
 */
public enum AntiPattern {
    TABLE_SCAN,
    N_PLUS_ONE,
    CARTESIAN_PRODUCT,
    CORRELATED_SUBQUERY;

    @JsonValue
    public String toJson() {
        return name().toLowerCase();
    }
}
