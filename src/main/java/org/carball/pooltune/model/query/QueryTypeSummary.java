package org.carball.pooltune.model.query;

public record QueryTypeSummary(long count, double avgTimeMs, long slowCount) {}
