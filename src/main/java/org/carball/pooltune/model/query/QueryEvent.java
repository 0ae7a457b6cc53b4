package org.carball.pooltune.model.query;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;

/**
 * A query-completion event as delivered by the database access layer.
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class QueryEvent {

    String queryText;
    List<Object> params;
    long executionTimeMs;
    long rowsAffected;
    Boolean success;
    String error;
    String poolTag;
    List<String> tablesAccessed;
    ConnectionType connectionType;
    Boolean cacheHit;
    List<String> indexUsage;
    String requestId;
    String sessionId;
    String userId;
    List<String> tags;
    Map<String, String> attributes;

    public QueryMetadata toMetadata() {
        QueryMetadata.QueryMetadataBuilder builder = QueryMetadata.builder()
                .executionTimeMs(executionTimeMs)
                .rowsAffected(rowsAffected)
                .success(success == null || success)
                .error(error)
                .cacheHit(cacheHit)
                .requestId(requestId)
                .sessionId(sessionId)
                .userId(userId);

        if (poolTag != null) builder.poolTag(poolTag);
        if (connectionType != null) builder.connectionType(connectionType);
        if (tablesAccessed != null) builder.tablesAccessed(tablesAccessed);
        if (indexUsage != null) builder.indexUsage(indexUsage);
        if (tags != null) builder.tags(tags);
        if (attributes != null) builder.attributes(attributes);

        return builder.build();
    }
}
