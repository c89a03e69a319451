package org.carball.autolysis.ai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import org.carball.autolysis.model.analysis.ColumnProfile;
import org.carball.autolysis.model.analysis.CorrelationMatrix;
import org.carball.autolysis.model.analysis.ProfileWarning;
import org.carball.autolysis.model.cluster.ClusterAssignment;
import org.carball.autolysis.model.cluster.MergeTree;
import org.carball.autolysis.model.report.ProfileReport;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds the user prompt sent to the narrative service. The prompt asks for four parts (the
 * data received, the analysis carried out, the insights discovered and their implications) and
 * carries the report summary as JSON.
 */
@Slf4j
public class NarrativePromptBuilder {

    static final String SYSTEM_PROMPT = """
        You are a data analyst and a creative storyteller. You explain the results of
        automated dataset profiling to readers who have not seen the data, in clear
        markdown with short sections.
        """;

    private final ObjectMapper objectMapper;

    public NarrativePromptBuilder() {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    public String buildPrompt(ProfileReport report, Map<String, Path> charts) {
        StringBuilder prompt = new StringBuilder();

        prompt.append("Below is a detailed summary and analysis of a dataset. ");
        prompt.append("Please generate a rich and engaging narrative about this dataset analysis, including:\n\n");
        prompt.append("1. **The Data Received**: Describe the dataset. What does the data represent? What are its features?\n");
        prompt.append("2. **The Analysis Carried Out**: Explain the methods used, such as missing value handling, ");
        prompt.append("outlier detection, correlation and clustering.\n");
        prompt.append("3. **The Insights Discovered**: What were the key findings? What trends or patterns emerged?\n");
        prompt.append("4. **The Implications of Findings**: How do these insights influence decisions? ");
        prompt.append("What actions would you recommend?\n\n");

        prompt.append("## Dataset Summary:\n");
        prompt.append(toJson(summarize(report)));
        prompt.append("\n\n");

        if (charts != null && !charts.isEmpty()) {
            prompt.append("## Visualizations:\n");
            charts.forEach((name, path) ->
                    prompt.append("- ").append(name).append(": ").append(path.getFileName()).append("\n"));
            prompt.append("\n");
        }

        if (!report.absentSections().isEmpty()) {
            prompt.append("## Sections Not Available:\n");
            report.absentSections().forEach((section, reason) ->
                    prompt.append("- ").append(section.getDisplayName()).append(": ").append(reason).append("\n"));
        }

        log.debug("Built narrative prompt of {} characters", prompt.length());
        return prompt.toString();
    }

    /**
     * Plain map view of the report, safe to hand to any serializer.
     */
    Map<String, Object> summarize(ProfileReport report) {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("dataset", report.tableName());
        summary.put("rows", report.rowCount());
        summary.put("columns", report.columnCount());

        if (report.columnProfiles() != null) {
            Map<String, Object> columns = new LinkedHashMap<>();
            for (ColumnProfile profile : report.columnProfiles().values()) {
                columns.put(profile.name(), describeColumn(profile));
            }
            summary.put("column_summary", columns);
            summary.put("missing_values", report.missingValues());
        }

        if (report.outliers() != null) {
            Map<String, Object> outliers = new LinkedHashMap<>();
            report.outliers().counts().forEach((column, count) -> {
                Map<String, Object> entry = new LinkedHashMap<>();
                entry.put("count", count);
                report.outliers().boundsFor(column).ifPresent(bounds -> {
                    entry.put("lower_fence", round(bounds.lower()));
                    entry.put("upper_fence", round(bounds.upper()));
                });
                outliers.put(column, entry);
            });
            summary.put("outliers", outliers);
        }

        if (report.correlation() != null && report.correlation().size() > 1) {
            summary.put("strongest_correlations", strongestCorrelations(report));
        }

        ClusterAssignment clusters = report.clusters();
        if (clusters != null) {
            Map<String, Object> density = new LinkedHashMap<>();
            density.put("rows_clustered", clusters.size());
            density.put("clusters", clusters.clusterCount());
            density.put("noise_points", clusters.noiseCount());
            density.put("insufficient_data", clusters.insufficientData());
            summary.put("dbscan", density);
        }

        MergeTree tree = report.mergeTree();
        if (tree != null) {
            Map<String, Object> hierarchy = new LinkedHashMap<>();
            hierarchy.put("leaves", tree.leafCount());
            hierarchy.put("merges", tree.size());
            hierarchy.put("final_merge_distance", round(tree.maxDistance()));
            summary.put("hierarchical_clustering", hierarchy);
        }

        if (!report.warnings().isEmpty()) {
            summary.put("warnings", report.warnings().stream().map(ProfileWarning::getDescription).toList());
        }
        return summary;
    }

    private static Map<String, Object> describeColumn(ColumnProfile profile) {
        Map<String, Object> column = new LinkedHashMap<>();
        column.put("type", profile.kind().getDisplayName());
        column.put("count", profile.count());
        column.put("missing", profile.missing());
        if (profile.isNumeric()) {
            column.put("mean", round(profile.mean()));
            column.put("std", round(profile.std()));
            column.put("min", round(profile.min()));
            column.put("median", round(profile.median()));
            column.put("max", round(profile.max()));
        } else {
            column.put("unique", profile.unique());
            column.put("top", profile.top());
            column.put("freq", profile.freq());
        }
        return column;
    }

    private static Map<String, Double> strongestCorrelations(ProfileReport report) {
        CorrelationMatrix matrix = report.correlation();
        Map<String, Double> pairs = new LinkedHashMap<>();
        for (int i = 0; i < matrix.size(); i++) {
            for (int j = i + 1; j < matrix.size(); j++) {
                double r = matrix.coefficient(i, j);
                if (!Double.isNaN(r)) {
                    pairs.put(matrix.columnNames().get(i) + " ~ " + matrix.columnNames().get(j), round(r));
                }
            }
        }
        Map<String, Double> top = new LinkedHashMap<>();
        pairs.entrySet().stream()
                .sorted((a, b) -> Double.compare(Math.abs(b.getValue()), Math.abs(a.getValue())))
                .limit(5)
                .forEach(e -> top.put(e.getKey(), e.getValue()));
        return top;
    }

    static Double round(Double value) {
        if (value == null || value.isNaN() || value.isInfinite()) {
            return null;
        }
        return Math.round(value * 10000.0) / 10000.0;
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize report summary: {}", e.getMessage());
            return String.valueOf(value);
        }
    }
}
