package org.carball.pooltune.model.query;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * One completed query execution, as retained by the monitor.
 */
@Value
@Builder(toBuilder = true)
public class QueryRecord {
    String id;
    String query;
    String pattern;
    List<Object> params;
    QueryType type;
    long executionTimeMs;
    long rowsAffected;
    String poolTag;
    ConnectionType connectionType;
    Instant timestamp;
    boolean success;
    String error;
    PerformanceLevel performanceLevel;
    Boolean cacheHit;
    List<String> indexUsage;
    List<String> tablesAccessed;
    String requestId;
    String sessionId;
    String userId;
    List<String> tags;
    Map<String, String> attributes;

    public boolean servedFromCache() {
        return Boolean.TRUE.equals(cacheHit);
    }
}
