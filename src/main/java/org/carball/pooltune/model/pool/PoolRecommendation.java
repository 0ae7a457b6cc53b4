package org.carball.pooltune.model.pool;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * A configuration hint derived from the latest pool metrics sample.
 */
public record PoolRecommendation(
        Type type,
        Priority priority,
        String description,
        String action,
        String expectedImpact
) {

    public enum Type {
        INCREASE_CONNECTIONS,
        DECREASE_CONNECTIONS,
        OPTIMIZE_LIFETIME;

        @JsonValue
        public String toJson() {
            return name().toLowerCase();
        }
    }

    public enum Priority {
        HIGH,
        MEDIUM,
        LOW;

        @JsonValue
        public String toJson() {
            return name().toLowerCase();
        }
    }
}
