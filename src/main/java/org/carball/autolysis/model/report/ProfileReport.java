package org.carball.autolysis.model.report;

import org.carball.autolysis.model.analysis.ColumnProfile;
import org.carball.autolysis.model.analysis.CorrelationMatrix;
import org.carball.autolysis.model.analysis.OutlierReport;
import org.carball.autolysis.model.analysis.ProfileWarning;
import org.carball.autolysis.model.cluster.ClusterAssignment;
import org.carball.autolysis.model.cluster.MergeTree;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Result of one profiling run. A section that could not be computed is {@code null} and is
 * listed in {@code absentSections} together with the reason.
 */
public record ProfileReport(
        String tableName,
        int rowCount,
        int columnCount,
        Map<String, ColumnProfile> columnProfiles,
        OutlierReport outliers,
        CorrelationMatrix correlation,
        int[] standardizedRows,
        ClusterAssignment clusters,
        MergeTree mergeTree,
        Set<ProfileWarning> warnings,
        Map<ReportSection, String> absentSections
) {

    public ProfileReport {
        standardizedRows = standardizedRows == null ? null : standardizedRows.clone();
        columnProfiles = columnProfiles == null ? null
                : Collections.unmodifiableMap(new LinkedHashMap<>(columnProfiles));
        warnings = warnings.isEmpty() ? Collections.unmodifiableSet(EnumSet.noneOf(ProfileWarning.class))
                : Collections.unmodifiableSet(EnumSet.copyOf(warnings));
        absentSections = absentSections.isEmpty()
                ? Collections.unmodifiableMap(new EnumMap<>(ReportSection.class))
                : Collections.unmodifiableMap(new EnumMap<>(absentSections));
    }

    @Override
    public int[] standardizedRows() {
        return standardizedRows == null ? null : standardizedRows.clone();
    }

    public boolean isPresent(ReportSection section) {
        return !absentSections.containsKey(section);
    }

    public boolean isComplete() {
        return absentSections.isEmpty();
    }

    public boolean hasWarning(ProfileWarning warning) {
        return warnings.contains(warning);
    }

    /**
     * Missing-cell count per column, in column order.
     */
    public Map<String, Integer> missingValues() {
        Map<String, Integer> missing = new LinkedHashMap<>();
        if (columnProfiles != null) {
            columnProfiles.forEach((name, profile) -> missing.put(name, profile.missing()));
        }
        return missing;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ProfileReport other)) {
            return false;
        }
        return rowCount == other.rowCount
                && columnCount == other.columnCount
                && Objects.equals(tableName, other.tableName)
                && Objects.equals(columnProfiles, other.columnProfiles)
                && Objects.equals(outliers, other.outliers)
                && Objects.equals(correlation, other.correlation)
                && Arrays.equals(standardizedRows, other.standardizedRows)
                && Objects.equals(clusters, other.clusters)
                && Objects.equals(mergeTree, other.mergeTree)
                && warnings.equals(other.warnings)
                && absentSections.equals(other.absentSections);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(tableName, rowCount, columnCount, columnProfiles, outliers, correlation,
                clusters, mergeTree, warnings, absentSections);
        return 31 * result + Arrays.hashCode(standardizedRows);
    }

    @Override
    public String toString() {
        return "ProfileReport[table=" + tableName + ", rows=" + rowCount + ", columns=" + columnCount
                + ", standardizedRows=" + Arrays.toString(standardizedRows)
                + ", clusters=" + clusters + ", mergeTree=" + mergeTree
                + ", warnings=" + warnings + ", absentSections=" + absentSections + "]";
    }
}
