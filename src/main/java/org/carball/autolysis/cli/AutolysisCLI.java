package org.carball.autolysis.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import lombok.extern.slf4j.Slf4j;
import org.carball.autolysis.ai.NarrativeGenerator;
import org.carball.autolysis.ai.OpenAiNarrativeGenerator;
import org.carball.autolysis.analyzer.DatasetProfiler;
import org.carball.autolysis.config.AutolysisConfig;
import org.carball.autolysis.config.ClusteringSettings;
import org.carball.autolysis.config.ConfigurationLoader;
import org.carball.autolysis.config.NarrativeConfig;
import org.carball.autolysis.config.OutputFormat;
import org.carball.autolysis.ingest.CsvTableReader;
import org.carball.autolysis.model.analysis.ColumnProfile;
import org.carball.autolysis.model.report.ProfileReport;
import org.carball.autolysis.model.report.ReportSection;
import org.carball.autolysis.model.table.Table;
import org.carball.autolysis.output.AnalysisReport;
import org.carball.autolysis.render.Java2DChartRenderer;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Slf4j
public class AutolysisCLI {

    private static final String VERSION = "1.0.0";
    private static final String BANNER = """
        ╔═══════════════════════════════════════════════════════════════╗
        ║          Autolysis Automated Dataset Analysis v%s          ║
        ╚═══════════════════════════════════════════════════════════════╝
        """;

    static final String ENV_API_TOKEN = "AIPROXY_TOKEN";

    static final int EXIT_OK = 0;
    static final int EXIT_ERROR = 1;

    public static void main(String[] args) {
        System.exit(run(args, System.getenv()));
    }

    static int run(String[] args, Map<String, String> env) {
        System.out.printf((BANNER) + "%n", VERSION);

        if (args.length < 1 || isHelpRequested(args)) {
            printUsage();
            return args.length < 1 ? EXIT_ERROR : EXIT_OK;
        }

        try {
            AutolysisConfig config = parseArgs(args, env);
            if (config.isVerbose()) {
                enableVerboseLogging();
            }

            System.out.println("\n🔍 Starting analysis...");
            System.out.println("   Dataset: " + config.getDatasetFile());
            System.out.println("   Output directory: " + config.getOutputDirectory());
            System.out.println("   Clustering: " + config.getClusteringSettings().getDescription());
            System.out.println();

            System.out.print("📥 Loading dataset... ");
            Table table = new CsvTableReader().read(config.getDatasetFile());
            System.out.println("✓ (" + table.getRowCount() + " rows, " + table.getColumnCount() + " columns)");

            System.out.print("📊 Profiling dataset... ");
            ProfileReport report = new DatasetProfiler(config.getClusteringSettings())
                    .profile(table, requestedSections(args));
            System.out.println(report.isComplete() ? "✓" : "✓ (" + report.absentSections().size() + " sections unavailable)");

            Map<String, Path> charts = new LinkedHashMap<>();
            if (config.isRenderCharts()) {
                System.out.print("🎨 Rendering charts... ");
                charts = new Java2DChartRenderer().render(table, report, config.getOutputDirectory());
                System.out.println("✓ (" + charts.size() + " charts)");
            }

            System.out.print("🤖 Generating narrative... ");
            NarrativeGenerator narrator = new OpenAiNarrativeGenerator(config.getNarrativeConfig());
            String narrative = narrator.generateNarrative(report, charts);
            System.out.println("✓");

            System.out.print("📝 Writing results... ");
            List<Path> written = new AnalysisReport(report, narrative, charts)
                    .write(config.getOutputDirectory(), config.getOutputFormat());
            System.out.println("✓");

            printSummary(report);

            System.out.println("\n✅ Analysis complete!");
            System.out.println("   Output files:");
            written.forEach(file -> System.out.println("     - " + file));
            charts.values().forEach(file -> System.out.println("     - " + file));
            return EXIT_OK;

        } catch (IllegalArgumentException e) {
            System.err.println("\n❌ Configuration error: " + e.getMessage());
            System.err.println("\nRun with --help for usage information.");
            log.debug("Configuration error details", e);
            return EXIT_ERROR;
        } catch (IOException e) {
            System.err.println("\n❌ IO error: " + e.getMessage());
            log.debug("IO error details", e);
            return EXIT_ERROR;
        } catch (Exception e) {
            System.err.println("\n❌ Unexpected error: " + e.getMessage());
            log.debug("Unexpected error details", e);
            return EXIT_ERROR;
        }
    }

    private static boolean isHelpRequested(String[] args) {
        return Arrays.asList(args).contains("--help") ||
                Arrays.asList(args).contains("-h") ||
                Arrays.asList(args).contains("help");
    }

    private static void printUsage() {
        System.out.println("\nUsage: java -jar autolysis.jar <dataset.csv> [options]");
        System.out.println();
        System.out.println("Arguments:");
        System.out.println("  dataset.csv         CSV file with a header row, any common encoding");
        System.out.println();
        System.out.println("Options:");
        System.out.println("  --output-dir, -o    Directory for README.md, analysis.json and charts (default: .)");
        System.out.println("  --format, -f        Output format: json|markdown|both (default: markdown)");
        System.out.println("  --api-key           Narrative service token (or set AIPROXY_TOKEN env var)");
        System.out.println("  --config            YAML file with clustering settings (optional)");
        System.out.println("  --no-charts         Do not render PNG charts");
        System.out.println("  --skip-ai           Use the built-in narrative instead of the narrative service");
        System.out.println("  --skip-hierarchical Skip Ward clustering, useful for very large datasets");
        System.out.println("  --verbose, -v       Enable verbose output");
        System.out.println("  --help, -h          Show this help message");
        System.out.println();
        System.out.println(ConfigurationLoader.getConfigurationHelp());
        System.out.println("Examples:");
        System.out.println("  java -jar autolysis.jar goodreads.csv");
        System.out.println("  java -jar autolysis.jar media.csv --eps 0.8 --min-samples 3 --format both");
        System.out.println("  java -jar autolysis.jar happiness.csv --skip-ai --output-dir happiness");
        System.out.println();
        System.out.println("Environment Variables:");
        System.out.println("  AIPROXY_TOKEN       Token for the narrative service");
    }

    static AutolysisConfig parseArgs(String[] args, Map<String, String> env) throws IOException {
        AutolysisConfig config = new AutolysisConfig();
        config.setDatasetFile(Paths.get(args[0]));

        // Set defaults
        config.setOutputDirectory(Paths.get("."));
        config.setOutputFormat(OutputFormat.MARKDOWN);
        config.setRenderCharts(true);
        config.setVerbose(false);

        String apiKey = null;
        Path configFile = null;
        boolean skipAi = "true".equals(System.getProperty("skip.ai"));

        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--output-dir":
                case "-o":
                    config.setOutputDirectory(Paths.get(requireValue(args, i++, "Output directory not specified")));
                    break;
                case "--format":
                case "-f":
                    String format = requireValue(args, i++, "Output format not specified");
                    try {
                        config.setOutputFormat(OutputFormat.valueOf(format.toUpperCase()));
                    } catch (IllegalArgumentException e) {
                        throw new IllegalArgumentException("Invalid output format. Use: json, markdown, or both");
                    }
                    break;
                case "--api-key":
                    apiKey = requireValue(args, i++, "API key not specified");
                    break;
                case "--config":
                    configFile = Paths.get(requireValue(args, i++, "Configuration file not specified"));
                    break;
                case "--eps":
                case "--min-samples":
                case "--iqr-multiplier":
                case "--threads":
                    // Value is handled by ConfigurationLoader
                    requireValue(args, i, "Value for " + args[i] + " not specified");
                    i++;
                    break;
                case "--no-charts":
                    config.setRenderCharts(false);
                    break;
                case "--skip-ai":
                    skipAi = true;
                    break;
                case "--skip-hierarchical":
                    break;
                case "--verbose":
                case "-v":
                    config.setVerbose(true);
                    break;
                default:
                    throw new IllegalArgumentException("Unknown option: " + args[i]);
            }
        }

        ClusteringSettings settings = new ConfigurationLoader().loadConfiguration(configFile, env, args);
        config.setClusteringSettings(settings);

        if (skipAi) {
            config.setNarrativeConfig(NarrativeConfig.disabled());
        } else {
            String token = apiKey != null ? apiKey : env.get(ENV_API_TOKEN);
            if (token == null || token.isBlank()) {
                throw new IllegalArgumentException(
                        "Narrative service token required. Use --api-key or set " + ENV_API_TOKEN
                                + " environment variable. To skip the narrative service, use --skip-ai");
            }
            config.setNarrativeConfig(NarrativeConfig.builder().apiToken(token).build());
        }

        validateConfig(config);
        return config;
    }

    private static String requireValue(String[] args, int index, String message) {
        if (index + 1 >= args.length) {
            throw new IllegalArgumentException(message);
        }
        return args[index + 1];
    }

    private static void validateConfig(AutolysisConfig config) {
        if (!Files.exists(config.getDatasetFile())) {
            throw new IllegalArgumentException("Dataset file not found: " + config.getDatasetFile());
        }
        if (Files.isDirectory(config.getDatasetFile())) {
            throw new IllegalArgumentException("Dataset path must be a file");
        }
        if (Files.exists(config.getOutputDirectory()) && !Files.isDirectory(config.getOutputDirectory())) {
            throw new IllegalArgumentException("Output path is not a directory: " + config.getOutputDirectory());
        }
    }

    static Set<ReportSection> requestedSections(String[] args) {
        Set<ReportSection> sections = EnumSet.allOf(ReportSection.class);
        if (Arrays.asList(args).contains("--skip-hierarchical")) {
            sections.remove(ReportSection.MERGE_TREE);
        }
        return sections;
    }

    private static void enableVerboseLogging() {
        Logger logger = (Logger) LoggerFactory.getLogger("org.carball.autolysis");
        logger.setLevel(Level.DEBUG);
        log.debug("Verbose logging enabled");
    }

    private static void printSummary(ProfileReport report) {
        System.out.println("\n" + "=".repeat(60));
        System.out.println("📊 ANALYSIS SUMMARY");
        System.out.println("=".repeat(60));

        System.out.println("\nDataset: " + report.tableName());
        System.out.println("Rows: " + report.rowCount() + ", columns: " + report.columnCount());

        if (report.columnProfiles() != null) {
            long numeric = report.columnProfiles().values().stream().filter(ColumnProfile::isNumeric).count();
            System.out.println("Numeric columns: " + numeric);
            System.out.println("Missing cells: " + report.missingValues().values().stream()
                    .mapToInt(Integer::intValue).sum());
        }
        if (report.outliers() != null) {
            System.out.println("Outliers flagged: " + report.outliers().totalOutliers());
        }
        if (report.clusters() != null) {
            System.out.printf("DBSCAN: %d clusters, %d noise points%n",
                    report.clusters().clusterCount(), report.clusters().noiseCount());
        }
        if (report.mergeTree() != null) {
            System.out.printf("Ward: %d merges, final distance %.3f%n",
                    report.mergeTree().size(), report.mergeTree().maxDistance());
        }

        if (!report.absentSections().isEmpty()) {
            System.out.println("\n⚠️  Unavailable sections:");
            report.absentSections().forEach((section, reason) ->
                    System.out.println("  - " + section.getDisplayName() + ": " + reason));
        }
        if (!report.warnings().isEmpty()) {
            System.out.println("\n💡 Warnings:");
            report.warnings().forEach(w -> System.out.println("  - " + w.getDescription()));
        }
    }
}
