package org.carball.pooltune.model.query;

import com.fasterxml.jackson.annotation.JsonValue;

public enum PerformanceLevel {
    EXCELLENT,
    GOOD,
    ACCEPTABLE,
    SLOW,
    VERY_SLOW;

    public boolean isSlow() {
        return this == SLOW || this == VERY_SLOW;
    }

    @JsonValue
    public String toJson() {
        return name().toLowerCase();
    }
}
