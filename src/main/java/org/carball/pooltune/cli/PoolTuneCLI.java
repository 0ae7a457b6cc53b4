package org.carball.pooltune.cli;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;
import org.carball.pooltune.config.ConfigurationLoader;
import org.carball.pooltune.config.MonitorSettings;
import org.carball.pooltune.config.PoolConfiguration;
import org.carball.pooltune.config.PoolEnvironment;
import org.carball.pooltune.exception.OptimizationRejectedException;
import org.carball.pooltune.exception.PoolTuningException;
import org.carball.pooltune.model.pool.OptimizationResult;
import org.carball.pooltune.model.pool.WorkloadMetrics;
import org.carball.pooltune.model.query.PerformanceReport;
import org.carball.pooltune.model.query.QueryEvent;
import org.carball.pooltune.monitor.QueryMonitor;
import org.carball.pooltune.output.ConfigurationReportWriter;
import org.carball.pooltune.output.PerformanceReportWriter;
import org.carball.pooltune.pool.PoolConfigurationManager;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

@Slf4j
public class PoolTuneCLI {

    private static final String VERSION = "1.0.0";
    private static final String BANNER = """
        ╔═══════════════════════════════════════════════════════════════╗
        ║        Connection Pool Tuning & Query Monitor v%s          ║
        ╚═══════════════════════════════════════════════════════════════╝
        """;

    static final int DEFAULT_PERIOD_MINUTES = 60;

    private static final ObjectMapper INPUT_MAPPER = new ObjectMapper(new YAMLFactory())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final PrintStream out;
    private final PrintStream err;
    private final ConfigurationLoader configurationLoader;

    PoolTuneCLI(PrintStream out, PrintStream err, ConfigurationLoader configurationLoader) {
        this.out = out;
        this.err = err;
        this.configurationLoader = configurationLoader;
    }

    public static void main(String[] args) {
        System.out.printf((BANNER) + "%n", VERSION);
        int exitCode = new PoolTuneCLI(System.out, System.err, new ConfigurationLoader()).run(args);
        System.exit(exitCode);
    }

    int run(String[] args) {
        if (args.length == 0 || isHelpRequested(args)) {
            printUsage();
            return args.length == 0 ? 1 : 0;
        }

        try {
            switch (args[0]) {
                case "optimize":
                    return optimize(args);
                case "analyze":
                    return analyze(args);
                case "environments":
                    out.println(PoolEnvironment.getEnvironmentHelp());
                    return 0;
                default:
                    err.println("\n❌ Unknown command: " + args[0]);
                    err.println("\nRun with --help for usage information.");
                    return 1;
            }
        } catch (IllegalArgumentException e) {
            err.println("\n❌ Configuration error: " + e.getMessage());
            err.println("\nRun with --help for usage information.");
            log.debug("Configuration error details", e);
            return 1;
        } catch (IOException e) {
            err.println("\n❌ IO error: " + e.getMessage());
            log.debug("IO error details", e);
            return 1;
        } catch (PoolTuningException e) {
            err.println("\n❌ " + e.getMessage());
            log.debug("Pool tuning error details", e);
            return 1;
        }
    }

    private int optimize(String[] args) throws IOException {
        String workloadFile = requireArgument(args, "--workload");

        PoolEnvironment environment = configurationLoader.resolveEnvironment(args);
        PoolConfiguration config = configurationLoader.loadConfiguration(environment, args);
        WorkloadMetrics workload = INPUT_MAPPER.readValue(Path.of(workloadFile).toFile(), WorkloadMetrics.class);

        out.println("\n🔍 Optimizing pool configuration...");
        out.println("   Environment: " + environment.getName());
        out.println("   Workload file: " + workloadFile);
        out.println();

        PoolConfigurationManager manager = new PoolConfigurationManager(environment, config);
        OptimizationResult result = manager.optimizeForWorkload(workload);

        int exitCode = 0;
        if (hasFlag(args, "--apply")) {
            out.print("⚙️ Applying optimization... ");
            try {
                manager.applyOptimization(result);
                out.println("✓");
            } catch (OptimizationRejectedException e) {
                out.println("✗");
                err.println("\n⚠️ " + e.getMessage());
                exitCode = 2;
            }
        }

        ConfigurationReportWriter writer = new ConfigurationReportWriter(manager.generateConfigurationReport(), result);
        writeOutput(args, writer.toJson(), writer.toMarkdown());

        out.println("\n📊 Summary");
        out.println("   Changes: " + result.improvements().size());
        out.println("   Risk: " + result.riskAssessment().level().toJson()
                + " (score " + result.riskAssessment().score() + ")");
        out.println("   Expected throughput increase: "
                + result.performanceGain().expectedThroughputIncrease() + "%");
        return exitCode;
    }

    private int analyze(String[] args) throws IOException {
        String queriesFile = requireArgument(args, "--queries");
        int periodMinutes = parsePeriod(findArgument(args, "--period"));

        List<QueryEvent> events = INPUT_MAPPER.readValue(Path.of(queriesFile).toFile(),
                new TypeReference<List<QueryEvent>>() {});

        out.println("\n🔍 Analyzing " + events.size() + " queries from " + queriesFile + "...");

        PerformanceReport report;
        try (QueryMonitor monitor = new QueryMonitor(MonitorSettings.defaults())) {
            events.forEach(monitor::recordQuery);
            report = monitor.generatePerformanceReport(periodMinutes);
        }

        PerformanceReportWriter writer = new PerformanceReportWriter(report);
        writeOutput(args, writer.toJson(), writer.toMarkdown());

        out.println("\n📊 Summary");
        out.println("   Total queries: " + report.summary().totalQueries());
        out.println("   Slow queries: " + report.summary().slowQueries());
        out.println("   Recommendations: " + report.optimizationRecommendations().size());
        return 0;
    }

    private void writeOutput(String[] args, String json, String markdown) throws IOException {
        String outputFile = findArgument(args, "--output");
        String format = findArgument(args, "--format");
        if (format == null) {
            format = outputFile != null && outputFile.endsWith(".json") ? "json" : "markdown";
        }

        if (outputFile == null) {
            out.println();
            out.println("json".equalsIgnoreCase(format) ? json : markdown);
            return;
        }

        switch (format.toLowerCase()) {
            case "json":
                Files.writeString(Path.of(outputFile), json);
                break;
            case "markdown":
                Files.writeString(Path.of(outputFile), markdown);
                break;
            case "both":
                String baseFileName = removeFileExtension(outputFile);
                Files.writeString(Path.of(baseFileName + ".json"), json);
                Files.writeString(Path.of(baseFileName + ".md"), markdown);
                break;
            default:
                throw new IllegalArgumentException("Unknown output format: " + format + ". Use json, markdown or both");
        }
        out.println("\n✅ Output written to " + outputFile);
    }

    private static int parsePeriod(String value) {
        if (value == null) {
            return DEFAULT_PERIOD_MINUTES;
        }
        try {
            int minutes = Integer.parseInt(value);
            if (minutes <= 0) {
                throw new IllegalArgumentException("--period must be positive: " + value);
            }
            return minutes;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid --period: " + value);
        }
    }

    private static String requireArgument(String[] args, String name) {
        String value = findArgument(args, name);
        if (value == null) {
            throw new IllegalArgumentException("Missing required option " + name);
        }
        return value;
    }

    private static String findArgument(String[] args, String name) {
        for (int i = 0; i < args.length - 1; i++) {
            if (name.equals(args[i])) {
                return args[i + 1];
            }
        }
        return null;
    }

    private static boolean hasFlag(String[] args, String flag) {
        return Arrays.asList(args).contains(flag);
    }

    private static boolean isHelpRequested(String[] args) {
        return Arrays.stream(args).anyMatch(arg -> arg.equals("--help") || arg.equals("-h"));
    }

    private static String removeFileExtension(String filename) {
        int lastDot = filename.lastIndexOf('.');
        int lastSeparator = Math.max(filename.lastIndexOf('/'), filename.lastIndexOf('\\'));
        return lastDot > lastSeparator ? filename.substring(0, lastDot) : filename;
    }

    private void printUsage() {
        out.println("""
            Usage: pooltune <command> [options]

            Commands:
              optimize      Recommend pool settings for a recorded workload
              analyze       Build a performance report from recorded query events
              environments  List the available environment presets

            Optimize Options:
              --workload <file>        JSON/YAML workload metrics (required)
              --environment <name>     Environment preset (default: development)
              --apply                  Apply the recommendation unless it is high risk

            Analyze Options:
              --queries <file>         JSON/YAML list of query events (required)
              --period <minutes>       Report window (default: 60)

            Output Options:
              --output <file>          Write the report to a file instead of stdout
              --format <fmt>           json, markdown or both
            """);
        out.println(ConfigurationLoader.getConfigurationHelp());
    }
}
