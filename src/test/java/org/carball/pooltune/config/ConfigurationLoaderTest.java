package org.carball.pooltune.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.carball.pooltune.exception.InvalidConfigurationException;
import org.carball.pooltune.exception.PoolTuningException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ConfigurationLoaderTest {

    @TempDir
    Path tempDir;

    private ListAppender<ILoggingEvent> logAppender;
    private Logger logger;

    @BeforeEach
    void setUp() {
        logger = (Logger) LoggerFactory.getLogger(ConfigurationLoader.class);
        logAppender = new ListAppender<>();
        logAppender.start();
        logger.addAppender(logAppender);
    }

    @AfterEach
    void tearDown() {
        logger.detachAppender(logAppender);
    }

    @Test
    void shouldLoadDevelopmentPresetByDefault() {
        // When
        ConfigurationLoader loader = new ConfigurationLoader(Map.of());
        PoolConfiguration config = loader.loadConfiguration(new String[0]);

        // Then
        assertThat(loader.resolveEnvironment(new String[0])).isEqualTo(PoolEnvironment.DEVELOPMENT);
        assertThat(config).isEqualTo(PoolEnvironment.DEVELOPMENT.buildConfiguration());
    }

    @Test
    void shouldResolveEnvironmentFromArgumentBeforeVariable() {
        ConfigurationLoader loader = new ConfigurationLoader(Map.of("POOLTUNE_ENVIRONMENT", "staging"));

        assertThat(loader.resolveEnvironment(new String[0])).isEqualTo(PoolEnvironment.STAGING);
        assertThat(loader.resolveEnvironment(new String[]{"--environment", "prod"}))
                .isEqualTo(PoolEnvironment.PRODUCTION);
    }

    @Test
    void shouldThrowExceptionForUnknownEnvironment() {
        ConfigurationLoader loader = new ConfigurationLoader(Map.of());

        assertThatThrownBy(() -> loader.loadEnvironment("nonexistent"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown pool environment: nonexistent");
    }

    @Test
    void shouldApplyCliOverEnvironmentVariables() {
        // Given
        ConfigurationLoader loader = new ConfigurationLoader(Map.of(
                "POOLTUNE_MAX_CONNECTIONS", "30",
                "POOLTUNE_RETRY_ATTEMPTS", "6",
                "POOLTUNE_APPLICATION_TAG", "billing"));
        String[] args = {"--pool.max-connections", "40"};

        // When
        PoolConfiguration config = loader.loadConfiguration(PoolEnvironment.STAGING, args);

        // Then - CLI > env vars > preset
        assertThat(config.getMaxConnections()).isEqualTo(40);
        assertThat(config.getRetryAttempts()).isEqualTo(6);
        assertThat(config.getApplicationTag()).isEqualTo("billing");
        assertThat(config.getMinConnections()).isEqualTo(5);
    }

    @Test
    void shouldParseCLIArguments() {
        // Given
        String[] args = {
                "--pool.min-connections", "3",
                "--pool.max-connections", "12",
                "--pool.connection-timeout", "4000",
                "--pool.idle-timeout", "45000",
                "--pool.max-lifetime", "240000",
                "--pool.retry-attempts", "4",
                "--pool.retry-delay", "750",
                "--pool.slow-query-threshold", "800",
                "--pool.application-tag", "reports"
        };

        // When
        PoolConfiguration config = new ConfigurationLoader(Map.of()).loadConfiguration(PoolEnvironment.DEVELOPMENT, args);

        // Then
        assertThat(config.getMinConnections()).isEqualTo(3);
        assertThat(config.getMaxConnections()).isEqualTo(12);
        assertThat(config.getConnectionTimeoutMs()).isEqualTo(4_000);
        assertThat(config.getIdleTimeoutMs()).isEqualTo(45_000);
        assertThat(config.getMaxConnectionLifetimeMs()).isEqualTo(240_000);
        assertThat(config.getRetryAttempts()).isEqualTo(4);
        assertThat(config.getRetryDelayMs()).isEqualTo(750);
        assertThat(config.getSlowQueryThresholdMs()).isEqualTo(800);
        assertThat(config.getApplicationTag()).isEqualTo("reports");
    }

    @Test
    void shouldIgnoreInvalidNumbersWithWarning() {
        ConfigurationLoader loader = new ConfigurationLoader(Map.of("POOLTUNE_MIN_CONNECTIONS", "many"));

        PoolConfiguration config = loader.loadConfiguration(PoolEnvironment.DEVELOPMENT,
                new String[]{"--pool.max-connections", "ten"});

        assertThat(config.getMinConnections()).isEqualTo(2);
        assertThat(config.getMaxConnections()).isEqualTo(10);
        assertThat(logAppender.list)
                .filteredOn(event -> event.getLevel() == Level.WARN)
                .extracting(ILoggingEvent::getFormattedMessage)
                .containsExactly(
                        "Invalid numeric value for POOLTUNE_MIN_CONNECTIONS: many",
                        "Invalid numeric value for --pool.max-connections: ten");
    }

    @Test
    void shouldLayerConfigFileBetweenPresetAndEnvironment() throws Exception {
        // Given
        Path file = tempDir.resolve("pool.yaml");
        Files.writeString(file, """
                maxConnections: 25
                retryAttempts: 4
                applicationTag: from-file
                """);
        ConfigurationLoader loader = new ConfigurationLoader(Map.of("POOLTUNE_RETRY_ATTEMPTS", "8"));

        // When
        PoolConfiguration config = loader.loadConfiguration(PoolEnvironment.STAGING,
                new String[]{"--config-file", file.toString()});

        // Then
        assertThat(config.getMaxConnections()).isEqualTo(25);
        assertThat(config.getRetryAttempts()).isEqualTo(8);
        assertThat(config.getApplicationTag()).isEqualTo("from-file");
        assertThat(config.getIdleTimeoutMs()).isEqualTo(60_000);
    }

    @Test
    void shouldReadJsonConfigFile() throws Exception {
        Path file = tempDir.resolve("pool.json");
        Files.writeString(file, "{\"minConnections\": 4, \"maxConnections\": 16}");

        PoolConfiguration config = new ConfigurationLoader(Map.of())
                .loadConfiguration(PoolEnvironment.DEVELOPMENT, new String[]{"--config-file", file.toString()});

        assertThat(config.getMinConnections()).isEqualTo(4);
        assertThat(config.getMaxConnections()).isEqualTo(16);
    }

    @Test
    void shouldFailForMissingConfigFile() {
        ConfigurationLoader loader = new ConfigurationLoader(Map.of());
        String missing = tempDir.resolve("missing.yaml").toString();

        assertThatThrownBy(() -> loader.loadConfiguration(PoolEnvironment.DEVELOPMENT,
                new String[]{"--config-file", missing}))
                .isInstanceOf(PoolTuningException.class)
                .hasMessageContaining("Failed to read configuration file");
    }

    @Test
    void shouldRejectInvalidResult() {
        ConfigurationLoader loader = new ConfigurationLoader(Map.of());

        assertThatThrownBy(() -> loader.loadConfiguration(PoolEnvironment.DEVELOPMENT,
                new String[]{"--pool.max-connections", "1"}))
                .isInstanceOf(InvalidConfigurationException.class);
    }

    @Test
    void shouldProvideHelpText() {
        String help = ConfigurationLoader.getConfigurationHelp();

        assertThat(help).contains("--pool.max-connections", "POOLTUNE_MAX_CONNECTIONS", "Priority Order");
    }
}
