package org.carball.autolysis.model.analysis;

import java.util.Arrays;
import java.util.List;

/**
 * Symmetric Pearson correlation matrix over the numeric columns.
 */
public record CorrelationMatrix(List<String> columnNames, double[][] coefficients) {

    public CorrelationMatrix {
        columnNames = List.copyOf(columnNames);
        coefficients = copyOf(coefficients);
    }

    @Override
    public double[][] coefficients() {
        return copyOf(coefficients);
    }

    public int size() {
        return columnNames.size();
    }

    public double coefficient(int i, int j) {
        return coefficients[i][j];
    }

    public double get(String first, String second) {
        int i = columnNames.indexOf(first);
        int j = columnNames.indexOf(second);
        if (i < 0 || j < 0) {
            throw new IllegalArgumentException("Unknown column pair: " + first + ", " + second);
        }
        return coefficients[i][j];
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof CorrelationMatrix other
                && columnNames.equals(other.columnNames)
                && Arrays.deepEquals(coefficients, other.coefficients);
    }

    @Override
    public int hashCode() {
        return 31 * columnNames.hashCode() + Arrays.deepHashCode(coefficients);
    }

    @Override
    public String toString() {
        return "CorrelationMatrix[columns=" + columnNames + ", coefficients=" + Arrays.deepToString(coefficients) + "]";
    }

    private static double[][] copyOf(double[][] source) {
        double[][] copy = new double[source.length][];
        for (int i = 0; i < source.length; i++) {
            copy[i] = source[i].clone();
        }
        return copy;
    }
}
