package org.carball.autolysis.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

@Slf4j
public class ConfigurationLoader {

    static final String ENV_EPS = "AUTOLYSIS_DBSCAN_EPS";
    static final String ENV_MIN_SAMPLES = "AUTOLYSIS_DBSCAN_MIN_SAMPLES";
    static final String ENV_IQR_MULTIPLIER = "AUTOLYSIS_IQR_MULTIPLIER";
    static final String ENV_THREADS = "AUTOLYSIS_THREADS";

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    /**
     * Loads configuration using the hierarchy: CLI args > env vars > YAML file > defaults
     */
    public ClusteringSettings loadConfiguration(Path configFile, String[] args) throws IOException {
        return loadConfiguration(configFile, System.getenv(), args);
    }

    public ClusteringSettings loadConfiguration(Path configFile, Map<String, String> env, String[] args)
            throws IOException {
        log.debug("Loading clustering configuration");

        // Start with the file, or defaults
        ClusteringSettings settings = configFile != null ? loadFile(configFile) : ClusteringSettings.defaults();

        // 1. Apply environment variables
        applyEnvironmentVariables(settings, env);

        // 2. Apply CLI arguments (highest priority)
        applyCLIArguments(settings, args);

        settings.validate();

        log.info("Configuration loaded: {}", settings.getDescription());
        return settings;
    }

    /**
     * Reads settings from a YAML file. Keys not present keep their defaults.
     */
    public ClusteringSettings loadFile(Path configFile) throws IOException {
        if (!Files.exists(configFile)) {
            throw new ConfigurationException("Configuration file not found: " + configFile);
        }
        String content = Files.readString(configFile);
        ClusteringSettings settings;
        try {
            settings = content.isBlank() ? null : yamlMapper.readValue(content, ClusteringSettings.class);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Invalid configuration file " + configFile + ": "
                    + e.getOriginalMessage(), e);
        }
        if (settings == null) {
            log.warn("Configuration file {} is empty, using defaults", configFile);
            return ClusteringSettings.defaults();
        }
        log.info("Loaded clustering configuration from: {}", configFile);
        return settings;
    }

    private void applyEnvironmentVariables(ClusteringSettings settings, Map<String, String> env) {
        if (env.containsKey(ENV_EPS)) {
            settings.setEps(parseDouble(ENV_EPS, env.get(ENV_EPS)));
        }
        if (env.containsKey(ENV_MIN_SAMPLES)) {
            settings.setMinSamples(parseInt(ENV_MIN_SAMPLES, env.get(ENV_MIN_SAMPLES)));
        }
        if (env.containsKey(ENV_IQR_MULTIPLIER)) {
            settings.setIqrMultiplier(parseDouble(ENV_IQR_MULTIPLIER, env.get(ENV_IQR_MULTIPLIER)));
        }
        if (env.containsKey(ENV_THREADS)) {
            settings.setThreads(parseInt(ENV_THREADS, env.get(ENV_THREADS)));
        }
    }

    private void applyCLIArguments(ClusteringSettings settings, String[] args) {
        for (int i = 0; i < args.length - 1; i++) {
            String arg = args[i];
            String value = args[i + 1];

            switch (arg) {
                case "--eps":
                    settings.setEps(parseDouble(arg, value));
                    break;
                case "--min-samples":
                    settings.setMinSamples(parseInt(arg, value));
                    break;
                case "--iqr-multiplier":
                    settings.setIqrMultiplier(parseDouble(arg, value));
                    break;
                case "--threads":
                    settings.setThreads(parseInt(arg, value));
                    break;
                default:
                    break;
            }
        }
    }

    private static double parseDouble(String source, String value) {
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Invalid numeric value for " + source + ": " + value, e);
        }
    }

    private static int parseInt(String source, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Invalid integer value for " + source + ": " + value, e);
        }
    }

    /**
     * Returns help text for clustering configuration options.
     */
    public static String getConfigurationHelp() {
        return """
            Clustering Configuration Options:

            CLI Arguments:
              --eps <num>              DBSCAN neighbourhood radius in standardized units (default 0.5)
              --min-samples <num>      Points needed within eps for a core point (default 5)
              --iqr-multiplier <num>   IQR multiplier for outlier fences (default 1.5)
              --threads <num>          Worker threads, 0 for one per processor (default 0)
              --config <file>          YAML file with eps, min_samples, iqr_multiplier, threads

            Environment Variables:
              AUTOLYSIS_DBSCAN_EPS           Same as --eps
              AUTOLYSIS_DBSCAN_MIN_SAMPLES   Same as --min-samples
              AUTOLYSIS_IQR_MULTIPLIER       Same as --iqr-multiplier
              AUTOLYSIS_THREADS              Same as --threads

            Priority Order (highest to lowest):
              1. CLI arguments
              2. Environment variables
              3. YAML configuration file
              4. Built-in defaults
            """;
    }
}
