package org.carball.pooltune.model.query;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Execution details reported alongside a completed query.
 * <p>
 * The field set is fixed; {@code attributes} carries anything else a caller
 * wants attached to the record.
 */
@Value
@Builder(toBuilder = true)
public class QueryMetadata {

    public static final int CURRENT_VERSION = 1;

    @Builder.Default
    int version = CURRENT_VERSION;

    long executionTimeMs;
    long rowsAffected;

    @Builder.Default
    String poolTag = "unknown";

    @Builder.Default
    ConnectionType connectionType = ConnectionType.READ;

    @Builder.Default
    boolean success = true;

    String error;
    Boolean cacheHit;

    @Singular("indexUsed")
    List<String> indexUsage;

    // Extracted from the query text when empty
    @Singular("tableAccessed")
    List<String> tablesAccessed;

    String requestId;
    String sessionId;
    String userId;

    @Singular
    List<String> tags;

    @Singular
    Map<String, String> attributes;

    public static QueryMetadata of(long executionTimeMs) {
        return QueryMetadata.builder().executionTimeMs(executionTimeMs).build();
    }
}
