package org.carball.pooltune.model.query;

import java.time.Instant;

public record ReportPeriod(Instant start, Instant end, int minutes) {}
