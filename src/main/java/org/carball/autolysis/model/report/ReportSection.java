package org.carball.autolysis.model.report;

public enum ReportSection {
    COLUMN_PROFILES("Column profiles"),
    OUTLIERS("Outlier detection"),
    CORRELATION("Correlation matrix"),
    STANDARDIZATION("Standardization"),
    DENSITY_CLUSTERS("Density clustering"),
    MERGE_TREE("Hierarchical clustering");

    private final String displayName;

    ReportSection(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
