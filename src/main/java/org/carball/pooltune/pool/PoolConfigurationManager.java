package org.carball.pooltune.pool;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.carball.pooltune.config.ConfigurationValidator;
import org.carball.pooltune.config.OptimizationTuning;
import org.carball.pooltune.config.PoolConfiguration;
import org.carball.pooltune.config.PoolConfigurationPatch;
import org.carball.pooltune.config.PoolEnvironment;
import org.carball.pooltune.exception.ImportFormatException;
import org.carball.pooltune.exception.OptimizationRejectedException;
import org.carball.pooltune.exception.PoolTuningException;
import org.carball.pooltune.model.pool.ConfigurationExport;
import org.carball.pooltune.model.pool.ConfigurationReport;
import org.carball.pooltune.model.pool.OptimizationResult;
import org.carball.pooltune.model.pool.PerformanceTrends;
import org.carball.pooltune.model.pool.PoolMetricsSample;
import org.carball.pooltune.model.pool.PoolRecommendation;
import org.carball.pooltune.model.pool.PoolUsage;
import org.carball.pooltune.model.pool.WorkloadMetrics;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;

/**
 * Owns the active pool configuration for one environment.
 * <p>
 * Readers always see a complete configuration; writers are serialized so that
 * merge, validation and commit happen as one step.
 */
@Slf4j
public class PoolConfigurationManager {

    static final double HIGH_UTILIZATION = 0.8;
    static final double LOW_UTILIZATION = 0.2;
    static final Duration LONG_CONNECTION_LIFETIME = Duration.ofHours(1);

    private final PoolEnvironment environment;
    private final ConfigurationValidator validator;
    private final WorkloadOptimizer optimizer;
    private final Clock clock;
    private final ObjectMapper objectMapper;
    private final MetricsHistory metricsHistory = new MetricsHistory(MetricsHistory.DEFAULT_CAPACITY);
    private final List<PoolConfigurationListener> listeners = new CopyOnWriteArrayList<>();

    private final AtomicReference<PoolConfiguration> current = new AtomicReference<>();
    private final ReentrantLock writeLock = new ReentrantLock();
    private volatile Instant lastOptimization;

    public PoolConfigurationManager(PoolEnvironment environment) {
        this(environment, environment.buildConfiguration());
    }

    public PoolConfigurationManager(PoolEnvironment environment, PoolConfiguration initial) {
        this(environment, initial, OptimizationTuning.defaults(), Clock.systemUTC());
    }

    public PoolConfigurationManager(PoolEnvironment environment, PoolConfiguration initial,
                                    OptimizationTuning tuning, Clock clock) {
        this.environment = environment;
        this.validator = new ConfigurationValidator(environment);
        this.optimizer = new WorkloadOptimizer(tuning);
        this.clock = clock;
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);

        validator.requireValid(initial);
        current.set(initial);
        log.info("Initialized pool configuration for {}: {}", environment.getName(), initial.getSummary());
    }

    public PoolConfiguration getCurrentConfiguration() {
        return current.get();
    }

    public PoolEnvironment getEnvironment() {
        return environment;
    }

    public Optional<Instant> getLastOptimization() {
        return Optional.ofNullable(lastOptimization);
    }

    /**
     * Merges the patch onto the current configuration and commits it if valid.
     *
     * @throws org.carball.pooltune.exception.InvalidConfigurationException if the merged result is invalid
     */
    public PoolConfiguration updateConfiguration(PoolConfigurationPatch patch) {
        return commit(patch::applyTo, "update");
    }

    public PoolConfiguration updateConfiguration(PoolConfiguration replacement) {
        return commit(previous -> replacement, "update");
    }

    public OptimizationResult optimizeForWorkload(WorkloadMetrics metrics) {
        return optimizer.optimize(current.get(), metrics, environment, clock.instant());
    }

    /**
     * Commits the recommended configuration unless the change was assessed as high risk.
     *
     * @throws OptimizationRejectedException for high-risk results; the configuration is left unchanged
     */
    public PoolConfiguration applyOptimization(OptimizationResult result) {
        if (result.riskAssessment().isHigh()) {
            log.warn("Rejected high-risk optimization for {}: {}", environment.getName(),
                    result.riskAssessment().factors());
            throw new OptimizationRejectedException(result.riskAssessment());
        }
        PoolConfiguration applied = commit(previous -> result.recommendedConfig(), "optimization");
        lastOptimization = clock.instant();
        log.info("Applied optimization for {} with {} improvements", environment.getName(),
                result.improvements().size());
        return applied;
    }

    private PoolConfiguration commit(UnaryOperator<PoolConfiguration> change, String reason) {
        PoolConfiguration previous;
        PoolConfiguration next;
        writeLock.lock();
        try {
            previous = current.get();
            next = change.apply(previous);
            validator.requireValid(next);
            current.set(next);
        } finally {
            writeLock.unlock();
        }
        log.info("Committed pool configuration ({}) for {}: {}", reason, environment.getName(), next.getSummary());
        notifyListeners(previous, next);
        return next;
    }

    private void notifyListeners(PoolConfiguration previous, PoolConfiguration next) {
        for (PoolConfigurationListener listener : listeners) {
            try {
                listener.onConfigurationChanged(previous, next);
            } catch (RuntimeException e) {
                log.warn("Pool configuration listener {} failed: {}",
                        listener.getClass().getSimpleName(), e.getMessage());
            }
        }
    }

    public ConfigurationReport generateConfigurationReport() {
        PoolConfiguration config = current.get();
        Optional<PoolMetricsSample> latest = metricsHistory.latest();
        PoolUsage usage = latest.map(PoolUsage::of).orElse(PoolUsage.EMPTY);

        List<PoolRecommendation> recommendations = new ArrayList<>();
        if (latest.isPresent()) {
            double utilization = usage.utilizationRate();
            if (utilization > HIGH_UTILIZATION) {
                recommendations.add(new PoolRecommendation(
                        PoolRecommendation.Type.INCREASE_CONNECTIONS,
                        PoolRecommendation.Priority.HIGH,
                        String.format("High connection utilization (%.0f%%)", utilization * 100),
                        "Increase maxConnections above " + config.getMaxConnections(),
                        "Fewer waits for connections under load"));
            } else if (utilization < LOW_UTILIZATION && config.getMaxConnections() > environment.getBaseMaxConnections()) {
                recommendations.add(new PoolRecommendation(
                        PoolRecommendation.Type.DECREASE_CONNECTIONS,
                        PoolRecommendation.Priority.MEDIUM,
                        String.format("Low connection utilization (%.0f%%)", utilization * 100),
                        "Reduce maxConnections toward " + environment.getBaseMaxConnections(),
                        "Lower database resource usage"));
            }
        }
        if (config.getMaxConnectionLifetimeMs() > LONG_CONNECTION_LIFETIME.toMillis()) {
            recommendations.add(new PoolRecommendation(
                    PoolRecommendation.Type.OPTIMIZE_LIFETIME,
                    PoolRecommendation.Priority.LOW,
                    "Connections live longer than one hour",
                    "Consider a shorter maxConnectionLifetimeMs",
                    "Better load distribution across database nodes"));
        }

        return new ConfigurationReport(config, environment, usage, recommendations, lastOptimization);
    }

    /**
     * Appends a sample to the history; samples without a timestamp are stamped now.
     */
    public void updateMetrics(PoolMetricsSample sample) {
        PoolMetricsSample stamped = sample.timestamp() == null ? sample.withTimestamp(clock.instant()) : sample;
        metricsHistory.add(stamped);
        log.debug("Pool metrics: {}/{} active, {} errors of {} queries", stamped.activeConnections(),
                stamped.totalConnections(), stamped.errorCount(), stamped.totalQueries());
    }

    public PerformanceTrends getPerformanceTrends(int hours) {
        return metricsHistory.trendsSince(clock.instant().minus(Duration.ofHours(hours)));
    }

    int getMetricsHistorySize() {
        return metricsHistory.size();
    }

    public String exportConfiguration() {
        ConfigurationExport export = new ConfigurationExport(
                ConfigurationExport.CURRENT_VERSION,
                environment.getName(),
                PoolConfigurationPatch.of(current.get()),
                lastOptimization,
                clock.instant());
        try {
            return objectMapper.writeValueAsString(export);
        } catch (JsonProcessingException e) {
            throw new PoolTuningException("Failed to export pool configuration", e);
        }
    }

    /**
     * Replaces the configuration with the one held in an exported document and
     * restores its last optimization time when the document carries one.
     *
     * @throws ImportFormatException if the document is malformed or incomplete
     * @throws org.carball.pooltune.exception.InvalidConfigurationException if the values are invalid
     */
    public PoolConfiguration importConfiguration(String json) {
        ConfigurationExport export;
        try {
            export = objectMapper.readValue(json, ConfigurationExport.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new ImportFormatException("Malformed configuration document: " + e.getMessage(), e);
        }
        if (export == null || export.configuration() == null) {
            throw new ImportFormatException("Configuration document has no configuration object");
        }
        List<String> missing = export.configuration().getMissingFields();
        if (!missing.isEmpty()) {
            throw new ImportFormatException("Configuration document is missing fields: " + String.join(", ", missing));
        }
        if (export.environment() != null && !environment.getName().equalsIgnoreCase(export.environment())) {
            log.warn("Importing configuration exported from {} into {}", export.environment(), environment.getName());
        }

        PoolConfiguration imported = export.configuration().applyTo(current.get());
        PoolConfiguration committed = commit(previous -> imported, "import");
        if (export.lastOptimization() != null) {
            lastOptimization = export.lastOptimization();
        }
        return committed;
    }

    public void addListener(PoolConfigurationListener listener) {
        listeners.add(listener);
    }

    public void removeListener(PoolConfigurationListener listener) {
        listeners.remove(listener);
    }
}
