package org.carball.autolysis.analyzer;

import org.carball.autolysis.config.ClusteringSettings;
import org.carball.autolysis.model.analysis.ProfileWarning;
import org.carball.autolysis.model.report.ProfileReport;
import org.carball.autolysis.model.report.ReportSection;
import org.carball.autolysis.model.table.Column;
import org.carball.autolysis.model.table.Table;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

public class DatasetProfilerTest {

    @Test
    void shouldAssembleCompleteReport() {
        // Given
        DatasetProfiler profiler = new DatasetProfiler(ClusteringSettings.of(0.5, 3));

        // When
        ProfileReport report = profiler.profile(TestTables.twoGroups());

        // Then
        assertThat(report.isComplete()).isTrue();
        assertThat(report.tableName()).isEqualTo("groups");
        assertThat(report.rowCount()).isEqualTo(6);
        assertThat(report.columnCount()).isEqualTo(3);
        assertThat(report.columnProfiles()).containsOnlyKeys("x", "y", "name");
        assertThat(report.outliers().counts()).containsOnlyKeys("x", "y");
        assertThat(report.correlation().size()).isEqualTo(2);
        assertThat(report.standardizedRows()).containsExactly(0, 1, 2, 3, 4, 5);
        assertThat(report.clusters().clusterCount()).isEqualTo(2);
        assertThat(report.mergeTree().size()).isEqualTo(5);
        assertThat(report.warnings()).isEmpty();
    }

    @Test
    void shouldKeepReportUnchangedWhenConsumersMutateReturnedArrays() {
        // Given
        ProfileReport report = new DatasetProfiler(ClusteringSettings.of(0.5, 3)).profile(TestTables.twoGroups());
        Set<Set<Integer>> partition = report.clusters().partition();

        // When
        report.clusters().labels()[0] = 1;
        report.clusters().rowIndices()[0] = 5;
        report.standardizedRows()[0] = 9;
        report.correlation().coefficients()[0][1] = 0.0;

        // Then
        assertThat(report.clusters().partition()).isEqualTo(partition);
        assertThat(report.standardizedRows()).containsExactly(0, 1, 2, 3, 4, 5);
        assertThat(report.correlation().coefficient(0, 1)).isEqualTo(report.correlation().get("x", "y"))
                .isNotZero();
    }

    @Test
    void shouldProfileAgeAndScoreExample() {
        // Given
        DatasetProfiler profiler = new DatasetProfiler(ClusteringSettings.defaults());

        // When
        ProfileReport report = profiler.profile(TestTables.ageAndScore());

        // Then - five rows cannot satisfy the default min_samples of 5
        assertThat(report.outliers().countFor("age")).isEqualTo(1);
        assertThat(report.outliers().countFor("score")).isZero();
        assertThat(report.clusters().insufficientData()).isTrue();
        assertThat(report.clusters().noiseCount()).isEqualTo(5);
        assertThat(report.hasWarning(ProfileWarning.INSUFFICIENT_ROWS_FOR_DENSITY)).isTrue();
        assertThat(report.mergeTree().size()).isEqualTo(4);
        assertThat(report.isComplete()).isTrue();
    }

    @Test
    void shouldKeepOtherSectionsWhenDensitySettingsAreInvalid() {
        // Given
        ClusteringSettings settings = ClusteringSettings.of(-1.0, 3);
        DatasetProfiler profiler = new DatasetProfiler(settings);

        // When
        ProfileReport report = profiler.profile(TestTables.twoGroups());

        // Then
        assertThat(report.isPresent(ReportSection.DENSITY_CLUSTERS)).isFalse();
        assertThat(report.clusters()).isNull();
        assertThat(report.absentSections().get(ReportSection.DENSITY_CLUSTERS))
                .startsWith("Configuration error")
                .contains("eps");
        assertThat(report.absentSections()).containsOnlyKeys(ReportSection.DENSITY_CLUSTERS);
        assertThat(report.columnProfiles()).isNotNull();
        assertThat(report.outliers()).isNotNull();
        assertThat(report.mergeTree()).isNotNull();
    }

    @Test
    void shouldReportEmptyInputAsAbsentSections() {
        // Given
        Table empty = new Table("empty", List.of());

        // When
        ProfileReport report = new DatasetProfiler(null).profile(empty);

        // Then
        assertThat(report.absentSections()).containsKeys(ReportSection.COLUMN_PROFILES, ReportSection.OUTLIERS);
        assertThat(report.absentSections().get(ReportSection.COLUMN_PROFILES)).startsWith("Nothing to profile");
        assertThat(report.hasWarning(ProfileWarning.NO_NUMERIC_COLUMNS)).isTrue();
        assertThat(report.hasWarning(ProfileWarning.INSUFFICIENT_ROWS_FOR_HIERARCHY)).isTrue();
        assertThat(report.missingValues()).isEmpty();
    }

    @Test
    void shouldWarnAboutInsufficientValuesForStd() {
        // Given
        Table table = Table.of("t",
                Column.numeric("x", 1.0, 2.0, 3.0),
                Column.numeric("sparse", null, 4.0, null));

        // When
        ProfileReport report = new DatasetProfiler(ClusteringSettings.of(0.5, 1)).profile(table);

        // Then
        assertThat(report.hasWarning(ProfileWarning.INSUFFICIENT_VALUES_FOR_STD)).isTrue();
        assertThat(report.columnProfiles().get("sparse").std()).isNaN();
        assertThat(report.standardizedRows()).containsExactly(1);
        assertThat(report.hasWarning(ProfileWarning.INSUFFICIENT_ROWS_FOR_HIERARCHY)).isTrue();
        assertThat(report.missingValues()).containsEntry("sparse", 2).containsEntry("x", 0);
    }

    @Test
    void shouldRunOnlyRequestedSections() {
        // Given
        DatasetProfiler profiler = new DatasetProfiler(ClusteringSettings.of(0.5, 3));

        // When
        ProfileReport report = profiler.profile(TestTables.twoGroups(),
                EnumSet.of(ReportSection.COLUMN_PROFILES, ReportSection.STANDARDIZATION, ReportSection.DENSITY_CLUSTERS));

        // Then
        assertThat(report.columnProfiles()).isNotNull();
        assertThat(report.clusters()).isNotNull();
        assertThat(report.mergeTree()).isNull();
        assertThat(report.absentSections())
                .containsOnlyKeys(ReportSection.OUTLIERS, ReportSection.CORRELATION, ReportSection.MERGE_TREE)
                .containsValue(DatasetProfiler.SKIPPED);
    }

    @Test
    void shouldSkipClusteringWithoutStandardization() {
        // When
        ProfileReport report = new DatasetProfiler(ClusteringSettings.defaults())
                .profile(TestTables.twoGroups(), EnumSet.of(ReportSection.DENSITY_CLUSTERS, ReportSection.MERGE_TREE));

        // Then
        assertThat(report.clusters()).isNull();
        assertThat(report.mergeTree()).isNull();
        assertThat(report.isPresent(ReportSection.DENSITY_CLUSTERS)).isFalse();
    }
}
