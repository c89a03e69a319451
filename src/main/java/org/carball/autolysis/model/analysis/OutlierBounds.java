package org.carball.autolysis.model.analysis;

/**
 * Quartiles and fences of one numeric column. A value is an outlier iff it lies strictly
 * outside {@code [lower, upper]}.
 */
public record OutlierBounds(double q1, double q3, double iqr, double lower, double upper) {

    public static OutlierBounds of(double q1, double q3, double multiplier) {
        double iqr = q3 - q1;
        return new OutlierBounds(q1, q3, iqr, q1 - multiplier * iqr, q3 + multiplier * iqr);
    }

    public boolean isOutlier(double value) {
        return value < lower || value > upper;
    }
}
