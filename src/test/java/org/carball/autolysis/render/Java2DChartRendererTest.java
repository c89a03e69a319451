package org.carball.autolysis.render;

import org.carball.autolysis.analyzer.DatasetProfiler;
import org.carball.autolysis.config.ClusteringSettings;
import org.carball.autolysis.model.report.ProfileReport;
import org.carball.autolysis.model.report.ReportSection;
import org.carball.autolysis.model.table.Column;
import org.carball.autolysis.model.table.Table;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

public class Java2DChartRendererTest {

    private Java2DChartRenderer renderer;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        renderer = new Java2DChartRenderer();
    }

    @Test
    void shouldRenderAllThreeCharts() throws IOException {
        // Given
        Table table = Table.of("groups",
                Column.numeric("x", 0.0, 0.0, 1.0, 10.0, 10.0, 11.0, 30.0),
                Column.numeric("y", 0.0, 1.0, 0.0, 10.0, 11.0, 10.0, -5.0));
        ProfileReport report = new DatasetProfiler(ClusteringSettings.of(0.5, 3)).profile(table);

        // When
        Map<String, Path> charts = renderer.render(table, report, tempDir);

        // Then
        assertThat(charts).containsOnlyKeys(
                ChartRenderer.CORRELATION_CHART, ChartRenderer.DENSITY_CHART, ChartRenderer.HIERARCHY_CHART);
        assertThat(charts.get(ChartRenderer.DENSITY_CHART)).isEqualTo(tempDir.resolve("dbscan_clusters.png"));
        for (Path chart : charts.values()) {
            assertThat(Files.exists(chart)).isTrue();
            BufferedImage image = ImageIO.read(chart.toFile());
            assertThat(image).isNotNull();
            assertThat(image.getWidth()).isPositive();
        }
    }

    @Test
    void shouldSkipChartsWithoutData() throws IOException {
        // Given
        Table table = Table.of("labels", Column.categorical("name", "a", "b", "c"));
        ProfileReport report = new DatasetProfiler(ClusteringSettings.defaults()).profile(table);

        // When
        Map<String, Path> charts = renderer.render(table, report, tempDir);

        // Then
        assertThat(charts).isEmpty();
    }

    @Test
    void shouldSkipScatterForSingleNumericColumn() throws IOException {
        // Given
        Table table = Table.of("line", Column.numeric("x", 1.0, 1.1, 1.2, 5.0, 5.1, 5.2));
        ProfileReport report = new DatasetProfiler(ClusteringSettings.of(0.5, 2)).profile(table,
                EnumSet.of(ReportSection.STANDARDIZATION, ReportSection.DENSITY_CLUSTERS, ReportSection.MERGE_TREE));

        // When
        Map<String, Path> charts = renderer.render(table, report, tempDir);

        // Then
        assertThat(charts).containsOnlyKeys(ChartRenderer.HIERARCHY_CHART);
    }

    @Test
    void shouldMapCoefficientsToDivergingColours() {
        assertThat(Java2DChartRenderer.coolWarm(0.0)).isEqualTo(Color.WHITE);
        assertThat(Java2DChartRenderer.coolWarm(1.0).getRed()).isGreaterThan(Java2DChartRenderer.coolWarm(1.0).getBlue());
        assertThat(Java2DChartRenderer.coolWarm(-1.0).getBlue()).isGreaterThan(Java2DChartRenderer.coolWarm(-1.0).getRed());
        assertThat(Java2DChartRenderer.coolWarm(Double.NaN)).isEqualTo(new Color(220, 220, 220));
    }
}
