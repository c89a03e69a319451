package org.carball.autolysis.config;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ConfigurationLoaderTest {

    private ConfigurationLoader loader;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        loader = new ConfigurationLoader();
    }

    @Test
    void shouldLoadDefaultConfiguration() throws IOException {
        // When
        ClusteringSettings settings = loader.loadConfiguration(null, Map.of(), new String[0]);

        // Then
        assertThat(settings.getEps()).isEqualTo(0.5);
        assertThat(settings.getMinSamples()).isEqualTo(5);
        assertThat(settings.getIqrMultiplier()).isEqualTo(1.5);
    }

    @Test
    void shouldLoadYamlFileKeepingDefaultsForMissingKeys() throws IOException {
        // Given
        Path file = tempDir.resolve("clustering.yml");
        Files.writeString(file, """
                eps: 0.8
                min_samples: 3
                unknown_key: ignored
                """);

        // When
        ClusteringSettings settings = loader.loadConfiguration(file, Map.of(), new String[0]);

        // Then
        assertThat(settings.getEps()).isEqualTo(0.8);
        assertThat(settings.getMinSamples()).isEqualTo(3);
        assertThat(settings.getIqrMultiplier()).isEqualTo(1.5);
    }

    @Test
    void shouldApplyPrecedenceCliOverEnvOverFile() throws IOException {
        // Given
        Path file = tempDir.resolve("clustering.yml");
        Files.writeString(file, """
                eps: 0.8
                min_samples: 3
                iqr_multiplier: 2.0
                threads: 2
                """);
        Map<String, String> env = Map.of(
                ConfigurationLoader.ENV_EPS, "0.9",
                ConfigurationLoader.ENV_MIN_SAMPLES, "4");
        String[] args = {"data.csv", "--eps", "1.1"};

        // When
        ClusteringSettings settings = loader.loadConfiguration(file, env, args);

        // Then - CLI > env vars > file > defaults
        assertThat(settings.getEps()).isEqualTo(1.1);
        assertThat(settings.getMinSamples()).isEqualTo(4);
        assertThat(settings.getIqrMultiplier()).isEqualTo(2.0);
        assertThat(settings.getThreads()).isEqualTo(2);
    }

    @Test
    void shouldApplyAllCliArguments() throws IOException {
        // Given
        String[] args = {"--eps", "0.3", "--min-samples", "7", "--iqr-multiplier", "3", "--threads", "1"};

        // When
        ClusteringSettings settings = loader.loadConfiguration(null, Map.of(), args);

        // Then
        assertThat(settings.getEps()).isEqualTo(0.3);
        assertThat(settings.getMinSamples()).isEqualTo(7);
        assertThat(settings.getIqrMultiplier()).isEqualTo(3.0);
        assertThat(settings.getThreads()).isEqualTo(1);
    }

    @Test
    void shouldRejectUnparseableValues() {
        assertThatThrownBy(() -> loader.loadConfiguration(null, Map.of(ConfigurationLoader.ENV_EPS, "wide"), new String[0]))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining(ConfigurationLoader.ENV_EPS);
        assertThatThrownBy(() -> loader.loadConfiguration(null, Map.of(), new String[]{"--min-samples", "2.5"}))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("--min-samples");
    }

    @Test
    void shouldRejectInvalidResultingSettings() {
        assertThatThrownBy(() -> loader.loadConfiguration(null, Map.of(), new String[]{"--eps", "0"}))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("eps");
    }

    @Test
    void shouldRejectMissingFile() {
        assertThatThrownBy(() -> loader.loadFile(tempDir.resolve("absent.yml")))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("not found");
    }

    @Test
    void shouldReportNonNumericFileValueAsConfigurationError() throws IOException {
        // Given
        Path file = tempDir.resolve("bad.yml");
        Files.writeString(file, "eps: wide\nmin_samples: 3\n");

        // When/Then
        assertThatThrownBy(() -> loader.loadConfiguration(file, Map.of(), new String[0]))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("bad.yml");
    }

    @Test
    void shouldReportMalformedYamlAsConfigurationError() throws IOException {
        // Given
        Path file = tempDir.resolve("broken.yml");
        Files.writeString(file, "eps: [0.5\n");

        // When/Then
        assertThatThrownBy(() -> loader.loadFile(file))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("Invalid configuration file");
    }

    @Test
    void shouldUseDefaultsForEmptyFile() throws IOException {
        // Given
        Path file = tempDir.resolve("empty.yml");
        Files.writeString(file, "");

        // When
        ClusteringSettings settings = loader.loadFile(file);

        // Then
        assertThat(settings).isEqualTo(ClusteringSettings.defaults());
    }

    @Test
    void shouldDescribeOptionsInHelp() {
        assertThat(ConfigurationLoader.getConfigurationHelp())
                .contains("--eps", "--min-samples", "AUTOLYSIS_DBSCAN_EPS", "Priority Order");
    }
}
