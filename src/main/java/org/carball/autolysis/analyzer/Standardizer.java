package org.carball.autolysis.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.autolysis.model.analysis.StandardizedMatrix;
import org.carball.autolysis.model.table.Column;
import org.carball.autolysis.model.table.Table;

import java.util.ArrayList;
import java.util.List;

/**
 * Z-score standardization of the numeric subspace. Rows with a missing value in any numeric
 * column are dropped; each remaining column is centred on its mean and divided by its sample
 * standard deviation over the retained rows. A column whose retained values are all equal maps
 * to 0 and reports a standard deviation of 0.
 */
@Slf4j
public class Standardizer {

    public StandardizedMatrix standardize(Table table) {
        List<Column> numeric = table.numericColumns();
        List<String> names = numeric.stream().map(Column::getName).toList();

        if (numeric.isEmpty()) {
            log.debug("No numeric columns in {}, nothing to standardize", table.getName());
            return new StandardizedMatrix(names, new double[0][0], new int[0], new double[0], new double[0]);
        }

        List<Integer> retained = new ArrayList<>();
        for (int row = 0; row < table.getRowCount(); row++) {
            if (isComplete(numeric, row)) {
                retained.add(row);
            }
        }

        int rows = retained.size();
        int cols = numeric.size();
        double[][] values = new double[rows][cols];
        double[] means = new double[cols];
        double[] stds = new double[cols];
        int[] rowIndices = retained.stream().mapToInt(Integer::intValue).toArray();

        for (int c = 0; c < cols; c++) {
            Column column = numeric.get(c);
            double[] raw = new double[rows];
            for (int r = 0; r < rows; r++) {
                raw[r] = column.numericValue(rowIndices[r]);
            }

            if (rows > 0 && isConstant(raw)) {
                // summation rounding would leave a tiny nonzero spread
                means[c] = raw[0];
                stds[c] = rows > 1 ? 0.0 : Double.NaN;
                continue;
            }

            means[c] = Percentiles.mean(raw);
            stds[c] = Percentiles.sampleStd(raw, means[c]);
            for (int r = 0; r < rows; r++) {
                values[r][c] = (raw[r] - means[c]) / stds[c];
            }
        }

        log.debug("Standardized {} columns, retained {} of {} rows", cols, rows, table.getRowCount());
        return new StandardizedMatrix(names, values, rowIndices, means, stds);
    }

    static boolean isConstant(double[] values) {
        for (int i = 1; i < values.length; i++) {
            if (Double.compare(values[i], values[0]) != 0) {
                return false;
            }
        }
        return true;
    }

    private static boolean isComplete(List<Column> columns, int row) {
        for (Column column : columns) {
            if (column.isMissing(row)) {
                return false;
            }
        }
        return true;
    }
}
