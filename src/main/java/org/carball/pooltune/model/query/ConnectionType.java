package org.carball.pooltune.model.query;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of connection a query ran on.
 */
public enum ConnectionType {
    READ,
    WRITE,
    ANALYTICS,
    BACKUP;

    @JsonValue
    public String toJson() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static ConnectionType fromJson(String value) {
        return value == null ? READ : valueOf(value.trim().toUpperCase());
    }
}
