package org.carball.autolysis.config;

import lombok.Data;

import java.nio.file.Path;

@Data
public class AutolysisConfig {
    private Path datasetFile;
    private Path outputDirectory;
    private OutputFormat outputFormat;
    private boolean renderCharts;
    private boolean verbose;
    private ClusteringSettings clusteringSettings;
    private NarrativeConfig narrativeConfig;
}
