package org.carball.pooltune.model.query;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AlertType {
    VERY_SLOW_QUERY,
    HIGH_ERROR_RATE,
    HIGH_FREQUENCY_QUERY;

    @JsonValue
    public String toJson() {
        return name().toLowerCase();
    }
}
