package org.carball.pooltune.output;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.carball.pooltune.config.PoolConfiguration;
import org.carball.pooltune.exception.PoolTuningException;
import org.carball.pooltune.model.pool.ConfigurationReport;
import org.carball.pooltune.model.pool.OptimizationResult;
import org.carball.pooltune.model.pool.PoolRecommendation;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Renders a configuration report, optionally with the optimization that was computed alongside it.
 */
@Slf4j
public class ConfigurationReportWriter {

    private final ConfigurationReport report;
    private final OptimizationResult optimization;
    private final ObjectMapper objectMapper;

    public ConfigurationReportWriter(ConfigurationReport report) {
        this(report, null);
    }

    public ConfigurationReportWriter(ConfigurationReport report, OptimizationResult optimization) {
        this.report = report;
        this.optimization = optimization;

        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.objectMapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    public String toJson() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("report", report);
        if (optimization != null) {
            data.put("optimization", optimization);
        }
        try {
            return objectMapper.writeValueAsString(data);
        } catch (Exception e) {
            log.error("Error generating JSON configuration report", e);
            throw new PoolTuningException("Failed to generate JSON configuration report", e);
        }
    }

    public String toMarkdown() {
        StringBuilder md = new StringBuilder();
        PoolConfiguration config = report.current();

        md.append("# Connection Pool Configuration Report\n\n");
        md.append("**Environment:** ").append(report.environment().getName()).append("  \n");
        md.append("**Last Optimization:** ")
                .append(report.lastOptimization() != null ? report.lastOptimization() : "never").append("\n\n");

        md.append("## Current Configuration\n\n");
        md.append("| Setting | Value |\n");
        md.append("|---------|-------|\n");
        appendRow(md, "Min Connections", config.getMinConnections());
        appendRow(md, "Max Connections", config.getMaxConnections());
        appendRow(md, "Connection Timeout (ms)", config.getConnectionTimeoutMs());
        appendRow(md, "Idle Timeout (ms)", config.getIdleTimeoutMs());
        appendRow(md, "Max Lifetime (ms)", config.getMaxConnectionLifetimeMs());
        appendRow(md, "Retry Attempts", config.getRetryAttempts());
        appendRow(md, "Retry Delay (ms)", config.getRetryDelayMs());
        appendRow(md, "Application Tag", config.getApplicationTag());
        md.append("\n");

        md.append("## Pool Usage\n\n");
        md.append("- **Total:** ").append(report.metrics().totalConnections()).append("\n");
        md.append("- **Active:** ").append(report.metrics().activeConnections()).append("\n");
        md.append("- **Idle:** ").append(report.metrics().idleConnections()).append("\n");
        md.append("- **Utilization:** ")
                .append(String.format("%.0f%%", report.metrics().utilizationRate() * 100)).append("\n\n");

        md.append("## Recommendations\n\n");
        if (report.recommendations().isEmpty()) {
            md.append("**No recommendations.**\n\n");
        }
        for (PoolRecommendation rec : report.recommendations()) {
            md.append("- **[").append(rec.priority().toJson()).append("] ").append(rec.description())
                    .append("**: ").append(rec.action()).append(" (").append(rec.expectedImpact()).append(")\n");
        }

        if (optimization != null) {
            md.append("\n## Optimization\n\n");
            md.append("- **Risk:** ").append(optimization.riskAssessment().level().toJson())
                    .append(" (score ").append(optimization.riskAssessment().score()).append(")\n");
            md.append("- **Expected Throughput Increase:** ")
                    .append(optimization.performanceGain().expectedThroughputIncrease()).append("%\n");
            md.append("- **Expected Latency Decrease:** ")
                    .append(optimization.performanceGain().expectedLatencyDecreaseMs()).append(" ms\n");
            md.append("- **Resource Change:** ")
                    .append(String.format("%.1f%%", optimization.performanceGain().resourceUtilizationChange()))
                    .append("\n\n");
            if (optimization.improvements().isEmpty()) {
                md.append("No changes recommended.\n");
            }
            optimization.improvements().forEach(i -> md.append("1. ").append(i).append("\n"));
            if (!optimization.riskAssessment().factors().isEmpty()) {
                md.append("\n**Risk Factors:**\n\n");
                optimization.riskAssessment().factors().forEach(f -> md.append("- ").append(f).append("\n"));
            }
        }

        return md.toString();
    }

    private static void appendRow(StringBuilder md, String name, Object value) {
        md.append("| ").append(name).append(" | ").append(value).append(" |\n");
    }
}
