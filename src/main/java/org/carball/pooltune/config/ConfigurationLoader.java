package org.carball.pooltune.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;
import org.carball.pooltune.exception.PoolTuningException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.function.IntConsumer;
import java.util.function.LongConsumer;

@Slf4j
public class ConfigurationLoader {

    static final String ENVIRONMENT_VARIABLE = "POOLTUNE_ENVIRONMENT";

    private final Map<String, String> env;
    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public ConfigurationLoader() {
        this(System.getenv());
    }

    public ConfigurationLoader(Map<String, String> env) {
        this.env = env;
    }

    /**
     * Resolves the environment: {@code --environment} argument, then
     * {@code POOLTUNE_ENVIRONMENT}, then development.
     */
    public PoolEnvironment resolveEnvironment(String[] args) {
        String name = findArgument(args, "--environment");
        if (name == null) {
            name = env.get(ENVIRONMENT_VARIABLE);
        }
        return name == null ? PoolEnvironment.DEVELOPMENT : loadEnvironment(name);
    }

    public PoolEnvironment loadEnvironment(String environmentName) {
        try {
            return PoolEnvironment.fromName(environmentName);
        } catch (IllegalArgumentException e) {
            log.error("Unknown environment: {}. {}", environmentName, e.getMessage());
            throw e;
        }
    }

    /**
     * Loads configuration using the hierarchy: CLI args > env vars > config file > environment preset
     */
    public PoolConfiguration loadConfiguration(String[] args) {
        return loadConfiguration(resolveEnvironment(args), args);
    }

    public PoolConfiguration loadConfiguration(PoolEnvironment environment, String[] args) {
        log.debug("Loading configuration for {}", environment.getName());

        // Start with the preset
        PoolConfiguration.PoolConfigurationBuilder builder = environment.buildConfiguration().toBuilder();

        // 1. Apply config file
        String configFile = findArgument(args, "--config-file");
        if (configFile != null) {
            builder = loadConfigFile(Path.of(configFile)).applyTo(builder.build()).toBuilder();
        }

        // 2. Apply environment variables
        applyEnvironmentVariables(builder);

        // 3. Apply CLI arguments (highest priority)
        applyCLIArguments(builder, args);

        PoolConfiguration config = builder.build();
        new ConfigurationValidator(environment).requireValid(config);

        log.info("Configuration loaded for '{}': {}", environment.getName(), config.getSummary());
        return config;
    }

    PoolConfigurationPatch loadConfigFile(Path path) {
        try {
            PoolConfigurationPatch patch = yamlMapper.readValue(Files.readString(path), PoolConfigurationPatch.class);
            if (patch == null) {
                log.warn("Configuration file {} is empty", path);
                return new PoolConfigurationPatch();
            }
            log.debug("Loaded configuration file {}", path);
            return patch;
        } catch (IOException e) {
            throw new PoolTuningException("Failed to read configuration file " + path + ": " + e.getMessage(), e);
        }
    }

    private void applyEnvironmentVariables(PoolConfiguration.PoolConfigurationBuilder builder) {
        applyInt("POOLTUNE_MIN_CONNECTIONS", env.get("POOLTUNE_MIN_CONNECTIONS"), builder::minConnections);
        applyInt("POOLTUNE_MAX_CONNECTIONS", env.get("POOLTUNE_MAX_CONNECTIONS"), builder::maxConnections);
        applyLong("POOLTUNE_CONNECTION_TIMEOUT_MS", env.get("POOLTUNE_CONNECTION_TIMEOUT_MS"), builder::connectionTimeoutMs);
        applyLong("POOLTUNE_IDLE_TIMEOUT_MS", env.get("POOLTUNE_IDLE_TIMEOUT_MS"), builder::idleTimeoutMs);
        applyLong("POOLTUNE_MAX_LIFETIME_MS", env.get("POOLTUNE_MAX_LIFETIME_MS"), builder::maxConnectionLifetimeMs);
        applyInt("POOLTUNE_RETRY_ATTEMPTS", env.get("POOLTUNE_RETRY_ATTEMPTS"), builder::retryAttempts);
        applyLong("POOLTUNE_RETRY_DELAY_MS", env.get("POOLTUNE_RETRY_DELAY_MS"), builder::retryDelayMs);
        applyLong("POOLTUNE_SLOW_QUERY_THRESHOLD_MS", env.get("POOLTUNE_SLOW_QUERY_THRESHOLD_MS"),
                builder::slowQueryThresholdMs);
        if (env.containsKey("POOLTUNE_APPLICATION_TAG")) {
            builder.applicationTag(env.get("POOLTUNE_APPLICATION_TAG"));
        }
    }

    private void applyCLIArguments(PoolConfiguration.PoolConfigurationBuilder builder, String[] args) {
        for (int i = 0; i < args.length - 1; i++) {
            String arg = args[i];
            String value = args[i + 1];

            switch (arg) {
                case "--pool.min-connections":
                    applyInt(arg, value, builder::minConnections);
                    break;
                case "--pool.max-connections":
                    applyInt(arg, value, builder::maxConnections);
                    break;
                case "--pool.connection-timeout":
                    applyLong(arg, value, builder::connectionTimeoutMs);
                    break;
                case "--pool.idle-timeout":
                    applyLong(arg, value, builder::idleTimeoutMs);
                    break;
                case "--pool.max-lifetime":
                    applyLong(arg, value, builder::maxConnectionLifetimeMs);
                    break;
                case "--pool.retry-attempts":
                    applyInt(arg, value, builder::retryAttempts);
                    break;
                case "--pool.retry-delay":
                    applyLong(arg, value, builder::retryDelayMs);
                    break;
                case "--pool.slow-query-threshold":
                    applyLong(arg, value, builder::slowQueryThresholdMs);
                    break;
                case "--pool.application-tag":
                    builder.applicationTag(value);
                    break;
                default:
                    break;
            }
        }
    }

    private static void applyInt(String source, String value, IntConsumer setter) {
        if (value == null) {
            return;
        }
        try {
            setter.accept(Integer.parseInt(value.trim()));
        } catch (NumberFormatException e) {
            log.warn("Invalid numeric value for {}: {}", source, value);
        }
    }

    private static void applyLong(String source, String value, LongConsumer setter) {
        if (value == null) {
            return;
        }
        try {
            setter.accept(Long.parseLong(value.trim()));
        } catch (NumberFormatException e) {
            log.warn("Invalid numeric value for {}: {}", source, value);
        }
    }

    private static String findArgument(String[] args, String name) {
        for (int i = 0; i < args.length - 1; i++) {
            if (name.equals(args[i])) {
                return args[i + 1];
            }
        }
        return null;
    }

    /**
     * Returns help text for pool configuration options.
     */
    public static String getConfigurationHelp() {
        return """
            Pool Configuration Options:

            CLI Arguments:
              --environment <name>                  development, test, staging or production
              --config-file <path>                  YAML or JSON file with pool settings
              --pool.min-connections <num>          Minimum pool size
              --pool.max-connections <num>          Maximum pool size
              --pool.connection-timeout <ms>        Connection acquisition timeout
              --pool.idle-timeout <ms>              Idle connection timeout
              --pool.max-lifetime <ms>              Maximum connection lifetime
              --pool.retry-attempts <num>           Connection retry attempts
              --pool.retry-delay <ms>               Delay between retries
              --pool.slow-query-threshold <ms>      Slow query threshold
              --pool.application-tag <tag>          Application name reported to the database

            Environment Variables:
              POOLTUNE_ENVIRONMENT                  Same as --environment
              POOLTUNE_MIN_CONNECTIONS              Same as --pool.min-connections
              POOLTUNE_MAX_CONNECTIONS              Same as --pool.max-connections
              POOLTUNE_CONNECTION_TIMEOUT_MS        Same as --pool.connection-timeout
              POOLTUNE_IDLE_TIMEOUT_MS              Same as --pool.idle-timeout
              POOLTUNE_MAX_LIFETIME_MS              Same as --pool.max-lifetime
              POOLTUNE_RETRY_ATTEMPTS               Same as --pool.retry-attempts
              POOLTUNE_RETRY_DELAY_MS               Same as --pool.retry-delay
              POOLTUNE_SLOW_QUERY_THRESHOLD_MS      Same as --pool.slow-query-threshold
              POOLTUNE_APPLICATION_TAG              Same as --pool.application-tag

            Priority Order (highest to lowest):
              1. CLI arguments
              2. Environment variables
              3. Configuration file
              4. Environment preset
            """;
    }
}
