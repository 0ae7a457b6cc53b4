package org.carball.pooltune.model.pool;

import org.carball.pooltune.config.PoolConfiguration;
import org.carball.pooltune.config.PoolEnvironment;

import java.time.Instant;
import java.util.List;

public record ConfigurationReport(
        PoolConfiguration current,
        PoolEnvironment environment,
        PoolUsage metrics,
        List<PoolRecommendation> recommendations,
        Instant lastOptimization
) {}
