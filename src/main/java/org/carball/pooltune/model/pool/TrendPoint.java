package org.carball.pooltune.model.pool;

import java.time.Instant;

public record TrendPoint(Instant timestamp, double value) {}
