package org.carball.autolysis.model.table;

public enum ColumnKind {
    NUMERIC("numeric"),
    CATEGORICAL("categorical");

    private final String displayName;

    ColumnKind(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
