package org.carball.autolysis.model.analysis;

/**
 * Non-fatal conditions under which a component degraded to a defined but trivial output.
 */
public enum ProfileWarning {
    INSUFFICIENT_VALUES_FOR_STD("Fewer than 2 non-missing values; standard deviation is NaN"),
    NO_NUMERIC_COLUMNS("No numeric columns available for standardization or clustering"),
    INSUFFICIENT_ROWS_FOR_DENSITY("Too few complete rows for density clustering; all rows are noise"),
    INSUFFICIENT_ROWS_FOR_HIERARCHY("Fewer than 2 complete rows; merge tree is empty");

    private final String description;

    ProfileWarning(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
