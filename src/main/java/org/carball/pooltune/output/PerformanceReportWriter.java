package org.carball.pooltune.output;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.carball.pooltune.exception.PoolTuningException;
import org.carball.pooltune.model.query.IndexRecommendation;
import org.carball.pooltune.model.query.PerformanceReport;
import org.carball.pooltune.model.query.QueryTypeSummary;
import org.carball.pooltune.model.query.ReportSummary;
import org.carball.pooltune.model.query.SlowQueryRecord;

import java.util.Map;

@Slf4j
public class PerformanceReportWriter {

    private static final int QUERY_PREVIEW_LENGTH = 120;

    private final PerformanceReport report;
    private final ObjectMapper objectMapper;

    public PerformanceReportWriter(PerformanceReport report) {
        this.report = report;

        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.objectMapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    public String toJson() {
        try {
            return objectMapper.writeValueAsString(report);
        } catch (Exception e) {
            log.error("Error generating JSON performance report", e);
            throw new PoolTuningException("Failed to generate JSON performance report", e);
        }
    }

    public String toMarkdown() {
        StringBuilder md = new StringBuilder();
        ReportSummary summary = report.summary();

        // Header
        md.append("# Query Performance Report\n\n");
        md.append("**Generated:** ").append(report.generatedAt()).append("  \n");
        md.append("**Period:** last ").append(report.period().minutes()).append(" minutes (")
                .append(report.period().start()).append(" to ").append(report.period().end()).append(")\n\n");

        // Summary
        md.append("## Summary\n\n");
        md.append("| Metric | Value |\n");
        md.append("|--------|-------|\n");
        md.append("| Total Queries | ").append(summary.totalQueries()).append(" |\n");
        md.append("| Average Execution Time | ").append(format(summary.averageExecutionTimeMs())).append(" ms |\n");
        md.append("| Slow Queries | ").append(summary.slowQueries()).append(" |\n");
        md.append("| Error Rate | ").append(format(summary.errorRate())).append("% |\n");
        md.append("| Cache Hit Rate | ").append(format(summary.cacheHitRate())).append("% |\n\n");

        // By type
        if (!report.queryTypeStats().isEmpty()) {
            md.append("## Query Types\n\n");
            md.append("| Type | Count | Avg Time (ms) | Slow |\n");
            md.append("|------|-------|---------------|------|\n");
            for (Map.Entry<?, QueryTypeSummary> entry : report.queryTypeStats().entrySet()) {
                QueryTypeSummary typeSummary = entry.getValue();
                md.append("| ").append(entry.getKey()).append(" | ").append(typeSummary.count())
                        .append(" | ").append(format(typeSummary.avgTimeMs()))
                        .append(" | ").append(typeSummary.slowCount()).append(" |\n");
            }
            md.append("\n");
        }

        // Slow queries
        md.append("## Slowest Queries\n\n");
        if (report.topSlowQueries().isEmpty()) {
            md.append("**No slow queries in this period.**\n\n");
        }
        int rank = 1;
        for (SlowQueryRecord slowQuery : report.topSlowQueries()) {
            md.append("### ").append(rank++).append(". ").append(slowQuery.executionTimeMs()).append(" ms\n\n");
            md.append("```sql\n").append(preview(slowQuery.record().getQuery())).append("\n```\n\n");
            md.append("- **Reason:** ").append(slowQuery.analysis().reason()).append("\n");
            if (!slowQuery.analysis().missingIndexes().isEmpty()) {
                md.append("- **Index Candidates:** ")
                        .append(String.join(", ", slowQuery.analysis().missingIndexes())).append("\n");
            }
            slowQuery.analysis().suggestions().forEach(s -> md.append("- ").append(s).append("\n"));
            md.append("\n");
        }

        // Recommendations
        if (!report.optimizationRecommendations().isEmpty()) {
            md.append("## Recommendations\n\n");
            report.optimizationRecommendations().forEach(r -> md.append("- ").append(r).append("\n"));
            md.append("\n");
        }

        if (!report.indexRecommendations().isEmpty()) {
            md.append("## Index Recommendations\n\n");
            md.append("| Table | Columns | Estimated Improvement |\n");
            md.append("|-------|---------|-----------------------|\n");
            for (IndexRecommendation rec : report.indexRecommendations()) {
                md.append("| ").append(rec.table()).append(" | ").append(String.join(", ", rec.columns()))
                        .append(" | ").append(rec.estimatedImprovementPercent()).append("% |\n");
            }
            md.append("\n");
        }

        return md.toString();
    }

    private static String preview(String query) {
        if (query == null) {
            return "";
        }
        return query.length() > QUERY_PREVIEW_LENGTH ? query.substring(0, QUERY_PREVIEW_LENGTH) + "..." : query;
    }

    private static String format(double value) {
        return String.format("%.1f", value);
    }
}
