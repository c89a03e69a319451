package org.carball.autolysis.model.analysis;

import java.util.Arrays;
import java.util.List;

/**
 * Numeric subspace of a table after dropping incomplete rows, each column rescaled to zero mean
 * and unit variance. {@code rowIndices[i]} is the source-table row of {@code values[i]}.
 * Arrays are copied on the way in and out.
 */
public record StandardizedMatrix(
        List<String> columnNames,
        double[][] values,
        int[] rowIndices,
        double[] means,
        double[] stds
) {

    public StandardizedMatrix {
        columnNames = List.copyOf(columnNames);
        values = deepCopy(values);
        rowIndices = rowIndices.clone();
        means = means.clone();
        stds = stds.clone();
    }

    @Override
    public double[][] values() {
        return deepCopy(values);
    }

    @Override
    public int[] rowIndices() {
        return rowIndices.clone();
    }

    @Override
    public double[] means() {
        return means.clone();
    }

    @Override
    public double[] stds() {
        return stds.clone();
    }

    public int rowCount() {
        return values.length;
    }

    public int columnCount() {
        return columnNames.size();
    }

    public int rowIndex(int i) {
        return rowIndices[i];
    }

    public double[] row(int i) {
        return values[i].clone();
    }

    public double value(int row, int column) {
        return values[row][column];
    }

    /**
     * Squared Euclidean distance between two rows of the matrix.
     */
    public double squaredDistance(int a, int b) {
        double[] first = values[a];
        double[] second = values[b];
        double sum = 0.0;
        for (int k = 0; k < first.length; k++) {
            double diff = first[k] - second[k];
            sum += diff * diff;
        }
        return sum;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof StandardizedMatrix other)) {
            return false;
        }
        return columnNames.equals(other.columnNames)
                && Arrays.deepEquals(values, other.values)
                && Arrays.equals(rowIndices, other.rowIndices)
                && Arrays.equals(means, other.means)
                && Arrays.equals(stds, other.stds);
    }

    @Override
    public int hashCode() {
        int result = columnNames.hashCode();
        result = 31 * result + Arrays.deepHashCode(values);
        result = 31 * result + Arrays.hashCode(rowIndices);
        result = 31 * result + Arrays.hashCode(means);
        return 31 * result + Arrays.hashCode(stds);
    }

    @Override
    public String toString() {
        return "StandardizedMatrix[columns=" + columnNames + ", rows=" + values.length
                + ", rowIndices=" + Arrays.toString(rowIndices) + "]";
    }

    private static double[][] deepCopy(double[][] source) {
        double[][] copy = new double[source.length][];
        for (int i = 0; i < source.length; i++) {
            copy[i] = source[i].clone();
        }
        return copy;
    }
}
