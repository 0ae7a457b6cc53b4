package org.carball.pooltune.model.pool;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.carball.pooltune.config.PoolConfigurationPatch;

import java.time.Instant;

/**
 * Serialized form of a manager's configuration.
 * The configuration is carried as a patch so incomplete documents can be detected on import.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ConfigurationExport(
        Integer version,
        String environment,
        PoolConfigurationPatch configuration,
        Instant lastOptimization,
        Instant exportTime
) {
    public static final int CURRENT_VERSION = 1;
}
