package org.carball.autolysis.model.analysis;

import org.carball.autolysis.model.table.ColumnKind;

/**
 * Descriptive summary of one column. Numeric columns fill the moment and quantile fields
 * (NaN where undefined), categorical columns fill {@code unique}, {@code top} and {@code freq}.
 * Fields that do not apply to the column's kind are {@code null}.
 */
public record ColumnProfile(
        String name,
        ColumnKind kind,
        int count,
        int missing,
        Double mean,
        Double std,
        Double min,
        Double q1,
        Double median,
        Double q3,
        Double max,
        Integer unique,
        String top,
        Integer freq
) {

    public static ColumnProfile numeric(String name, int count, int missing,
                                        double mean, double std, double min,
                                        double q1, double median, double q3, double max) {
        return new ColumnProfile(name, ColumnKind.NUMERIC, count, missing,
                mean, std, min, q1, median, q3, max, null, null, null);
    }

    public static ColumnProfile categorical(String name, int count, int missing,
                                            int unique, String top, int freq) {
        return new ColumnProfile(name, ColumnKind.CATEGORICAL, count, missing,
                null, null, null, null, null, null, null, unique, top, freq);
    }

    public int rowCount() {
        return count + missing;
    }

    public boolean isNumeric() {
        return kind == ColumnKind.NUMERIC;
    }
}
