package org.carball.autolysis.output;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.carball.autolysis.config.OutputFormat;
import org.carball.autolysis.model.analysis.ColumnProfile;
import org.carball.autolysis.model.analysis.CorrelationMatrix;
import org.carball.autolysis.model.analysis.OutlierBounds;
import org.carball.autolysis.model.analysis.ProfileWarning;
import org.carball.autolysis.model.cluster.ClusterAssignment;
import org.carball.autolysis.model.cluster.MergeEvent;
import org.carball.autolysis.model.cluster.MergeTree;
import org.carball.autolysis.model.report.ProfileReport;
import org.carball.autolysis.model.report.ReportSection;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
public class AnalysisReport {

    public static final String MARKDOWN_FILE = "README.md";
    public static final String JSON_FILE = "analysis.json";

    private static final int MERGE_TREE_PREVIEW = 5;

    private final ProfileReport report;
    private final String narrative;
    private final Map<String, Path> charts;
    private final LocalDateTime timestamp;
    private final ObjectMapper objectMapper;

    public AnalysisReport(ProfileReport report, String narrative, Map<String, Path> charts) {
        this.report = report;
        this.narrative = narrative;
        this.charts = charts != null ? new LinkedHashMap<>(charts) : new LinkedHashMap<>();
        this.timestamp = LocalDateTime.now();

        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    /**
     * Writes the requested formats into the output directory and returns the written files.
     */
    public List<Path> write(Path outputDirectory, OutputFormat format) throws IOException {
        Files.createDirectories(outputDirectory);
        List<Path> written = new ArrayList<>();

        if (format == OutputFormat.MARKDOWN || format == OutputFormat.BOTH) {
            Path markdown = outputDirectory.resolve(MARKDOWN_FILE);
            Files.writeString(markdown, toMarkdown(), StandardCharsets.UTF_8);
            written.add(markdown);
        }
        if (format == OutputFormat.JSON || format == OutputFormat.BOTH) {
            Path json = outputDirectory.resolve(JSON_FILE);
            Files.writeString(json, toJson(), StandardCharsets.UTF_8);
            written.add(json);
        }

        log.info("Report written to {}", written);
        return written;
    }

    public String toJson() {
        try {
            return objectMapper.writeValueAsString(buildReportData());
        } catch (Exception e) {
            log.error("Error generating JSON report", e);
            throw new IllegalStateException("Failed to generate JSON report", e);
        }
    }

    public String toMarkdown() {
        StringBuilder md = new StringBuilder();

        md.append("# Dataset Analysis: ").append(report.tableName()).append("\n\n");
        md.append("**Generated:** ").append(timestamp.format(DateTimeFormatter.ISO_LOCAL_DATE_TIME)).append("  \n");
        md.append("**Rows:** ").append(report.rowCount()).append("  \n");
        md.append("**Columns:** ").append(report.columnCount()).append("  \n\n");

        if (narrative != null && !narrative.isBlank()) {
            md.append("## Narrative\n\n");
            md.append(narrative.trim()).append("\n\n");
        }

        appendColumnSummary(md);
        appendOutliers(md);
        appendCorrelation(md);
        appendClusters(md);
        appendMergeTree(md);

        if (!charts.isEmpty()) {
            md.append("## Visualizations\n\n");
            charts.forEach((name, path) -> md.append("![").append(name).append("](")
                    .append(path.getFileName()).append(")\n\n"));
        }

        if (!report.absentSections().isEmpty()) {
            md.append("## Unavailable Sections\n\n");
            report.absentSections().forEach((section, reason) ->
                    md.append("- **").append(section.getDisplayName()).append("**: ").append(reason).append("\n"));
            md.append("\n");
        }

        if (!report.warnings().isEmpty()) {
            md.append("## Warnings\n\n");
            for (ProfileWarning warning : report.warnings()) {
                md.append("- ").append(warning.getDescription()).append("\n");
            }
            md.append("\n");
        }

        return md.toString();
    }

    private void appendColumnSummary(StringBuilder md) {
        if (report.columnProfiles() == null) {
            return;
        }
        md.append("## Column Summary\n\n");
        md.append("| Column | Type | Count | Missing | Mean | Std | Min | Median | Max | Unique | Top |\n");
        md.append("|--------|------|-------|---------|------|-----|-----|--------|-----|--------|-----|\n");
        for (ColumnProfile p : report.columnProfiles().values()) {
            md.append("| ").append(p.name())
                    .append(" | ").append(p.kind().getDisplayName())
                    .append(" | ").append(p.count())
                    .append(" | ").append(p.missing())
                    .append(" | ").append(format(p.mean()))
                    .append(" | ").append(format(p.std()))
                    .append(" | ").append(format(p.min()))
                    .append(" | ").append(format(p.median()))
                    .append(" | ").append(format(p.max()))
                    .append(" | ").append(p.unique() != null ? p.unique() : "")
                    .append(" | ").append(p.top() != null ? p.top() : "")
                    .append(" |\n");
        }
        md.append("\n");
    }

    private void appendOutliers(StringBuilder md) {
        if (report.outliers() == null) {
            return;
        }
        md.append("## Outliers\n\n");
        if (report.outliers().counts().isEmpty()) {
            md.append("No numeric columns to screen.\n\n");
            return;
        }
        md.append("| Column | Outliers | Lower Fence | Upper Fence |\n");
        md.append("|--------|----------|-------------|-------------|\n");
        report.outliers().counts().forEach((column, count) -> {
            OutlierBounds bounds = report.outliers().boundsFor(column).orElse(null);
            md.append("| ").append(column)
                    .append(" | ").append(count)
                    .append(" | ").append(bounds != null ? format(bounds.lower()) : "")
                    .append(" | ").append(bounds != null ? format(bounds.upper()) : "")
                    .append(" |\n");
        });
        md.append("\n");
    }

    private void appendCorrelation(StringBuilder md) {
        CorrelationMatrix matrix = report.correlation();
        if (matrix == null || matrix.size() < 2) {
            return;
        }
        md.append("## Correlation\n\n");
        md.append("| |");
        matrix.columnNames().forEach(name -> md.append(" ").append(name).append(" |"));
        md.append("\n|---|");
        matrix.columnNames().forEach(name -> md.append("---|"));
        md.append("\n");
        for (int i = 0; i < matrix.size(); i++) {
            md.append("| ").append(matrix.columnNames().get(i)).append(" |");
            for (int j = 0; j < matrix.size(); j++) {
                md.append(" ").append(format(matrix.coefficient(i, j))).append(" |");
            }
            md.append("\n");
        }
        md.append("\n");
    }

    private void appendClusters(StringBuilder md) {
        ClusterAssignment clusters = report.clusters();
        if (clusters == null) {
            return;
        }
        md.append("## Density Clusters (DBSCAN)\n\n");
        if (clusters.insufficientData()) {
            md.append("Not enough complete rows to form a dense neighbourhood; all ")
                    .append(clusters.size()).append(" rows are noise.\n\n");
            return;
        }
        md.append("| Cluster | Rows |\n");
        md.append("|---------|------|\n");
        clusters.clusterSizes().forEach((label, size) -> md.append("| ")
                .append(label == ClusterAssignment.NOISE ? "noise" : label.toString())
                .append(" | ").append(size).append(" |\n"));
        md.append("\n");
    }

    private void appendMergeTree(StringBuilder md) {
        MergeTree tree = report.mergeTree();
        if (tree == null) {
            return;
        }
        md.append("## Hierarchical Clustering (Ward)\n\n");
        if (tree.insufficientData()) {
            md.append("Fewer than two complete rows; no merges were made.\n\n");
            return;
        }
        md.append(String.format("%d rows joined in %d merges; the final merge is at distance %s.%n%n",
                tree.leafCount(), tree.size(), format(tree.maxDistance())));
        md.append("| Step | Left | Right | Distance | Size |\n");
        md.append("|------|------|-------|----------|------|\n");
        int from = Math.max(0, tree.size() - MERGE_TREE_PREVIEW);
        for (int i = from; i < tree.size(); i++) {
            MergeEvent event = tree.event(i);
            md.append("| ").append(i + 1)
                    .append(" | ").append(event.left())
                    .append(" | ").append(event.right())
                    .append(" | ").append(format(event.distance()))
                    .append(" | ").append(event.size())
                    .append(" |\n");
        }
        md.append("\n");
    }

    private static String format(Double value) {
        if (value == null) {
            return "";
        }
        if (value.isNaN()) {
            return "NaN";
        }
        return String.format("%.4f", value);
    }

    private static Double finite(Double value) {
        return value == null || value.isNaN() || value.isInfinite() ? null : value;
    }

    private ReportData buildReportData() {
        ReportData data = new ReportData();

        DatasetMetadata metadata = new DatasetMetadata();
        metadata.setTimestamp(timestamp);
        metadata.setDataset(report.tableName());
        metadata.setRows(report.rowCount());
        metadata.setColumns(report.columnCount());
        data.setMetadata(metadata);
        data.setNarrative(narrative);

        if (report.columnProfiles() != null) {
            List<ColumnSummary> columns = new ArrayList<>();
            for (ColumnProfile p : report.columnProfiles().values()) {
                ColumnSummary summary = new ColumnSummary();
                summary.setName(p.name());
                summary.setType(p.kind().getDisplayName());
                summary.setCount(p.count());
                summary.setMissing(p.missing());
                summary.setMean(finite(p.mean()));
                summary.setStd(finite(p.std()));
                summary.setMin(finite(p.min()));
                summary.setQ1(finite(p.q1()));
                summary.setMedian(finite(p.median()));
                summary.setQ3(finite(p.q3()));
                summary.setMax(finite(p.max()));
                summary.setUnique(p.unique());
                summary.setTop(p.top());
                summary.setFreq(p.freq());
                columns.add(summary);
            }
            data.setColumns(columns);
        }

        if (report.outliers() != null) {
            data.setOutliers(new LinkedHashMap<>(report.outliers().counts()));
        }

        if (report.clusters() != null) {
            ClusterSummary clusters = new ClusterSummary();
            clusters.setRowsClustered(report.clusters().size());
            clusters.setClusterCount(report.clusters().clusterCount());
            clusters.setNoiseCount(report.clusters().noiseCount());
            clusters.setInsufficientData(report.clusters().insufficientData());
            Map<String, Integer> sizes = new LinkedHashMap<>();
            report.clusters().clusterSizes().forEach((label, size) ->
                    sizes.put(label == ClusterAssignment.NOISE ? "noise" : label.toString(), size));
            clusters.setSizes(sizes);
            data.setDensityClusters(clusters);
        }

        if (report.mergeTree() != null) {
            MergeTreeSummary tree = new MergeTreeSummary();
            tree.setLeafCount(report.mergeTree().leafCount());
            tree.setMerges(report.mergeTree().events());
            tree.setInsufficientData(report.mergeTree().insufficientData());
            data.setMergeTree(tree);
        }

        Map<String, String> chartFiles = new LinkedHashMap<>();
        charts.forEach((name, path) -> chartFiles.put(name, path.getFileName().toString()));
        data.setCharts(chartFiles);

        Map<String, String> absent = new LinkedHashMap<>();
        for (Map.Entry<ReportSection, String> entry : report.absentSections().entrySet()) {
            absent.put(entry.getKey().name(), entry.getValue());
        }
        data.setAbsentSections(absent);
        data.setWarnings(report.warnings().stream().map(ProfileWarning::name).toList());

        return data;
    }

    // Inner classes for JSON structure
    @lombok.Data
    private static class ReportData {
        private DatasetMetadata metadata;
        private String narrative;
        private List<ColumnSummary> columns;
        private Map<String, Integer> outliers;
        private ClusterSummary densityClusters;
        private MergeTreeSummary mergeTree;
        private Map<String, String> charts;
        private Map<String, String> absentSections;
        private List<String> warnings;
    }

    @lombok.Data
    private static class DatasetMetadata {
        private LocalDateTime timestamp;
        private String dataset;
        private int rows;
        private int columns;
    }

    @lombok.Data
    private static class ColumnSummary {
        private String name;
        private String type;
        private int count;
        private int missing;
        private Double mean;
        private Double std;
        private Double min;
        private Double q1;
        private Double median;
        private Double q3;
        private Double max;
        private Integer unique;
        private String top;
        private Integer freq;
    }

    @lombok.Data
    private static class ClusterSummary {
        private int rowsClustered;
        private int clusterCount;
        private int noiseCount;
        private boolean insufficientData;
        private Map<String, Integer> sizes;
    }

    @lombok.Data
    private static class MergeTreeSummary {
        private int leafCount;
        private List<MergeEvent> merges;
        private boolean insufficientData;
    }
}
