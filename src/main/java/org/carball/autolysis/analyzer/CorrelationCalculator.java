package org.carball.autolysis.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.autolysis.model.analysis.CorrelationMatrix;
import org.carball.autolysis.model.table.Column;
import org.carball.autolysis.model.table.Table;

import java.util.List;

/**
 * Pearson correlation between every pair of numeric columns, each pair computed over the rows
 * where both values are present. A coefficient is NaN when fewer than two such rows exist or
 * either side has no spread.
 */
@Slf4j
public class CorrelationCalculator {

    public CorrelationMatrix compute(Table table) {
        List<Column> numeric = table.numericColumns();
        int size = numeric.size();
        double[][] coefficients = new double[size][size];

        for (int i = 0; i < size; i++) {
            for (int j = i; j < size; j++) {
                double r = pearson(numeric.get(i), numeric.get(j));
                coefficients[i][j] = r;
                coefficients[j][i] = r;
            }
        }

        log.debug("Computed {}x{} correlation matrix", size, size);
        return new CorrelationMatrix(numeric.stream().map(Column::getName).toList(), coefficients);
    }

    static double pearson(Column x, Column y) {
        int rows = x.size();
        int n = 0;
        double sumX = 0.0;
        double sumY = 0.0;
        double firstX = Double.NaN;
        double firstY = Double.NaN;
        boolean spreadX = false;
        boolean spreadY = false;
        for (int r = 0; r < rows; r++) {
            if (x.isMissing(r) || y.isMissing(r)) {
                continue;
            }
            double vx = x.numericValue(r);
            double vy = y.numericValue(r);
            if (n == 0) {
                firstX = vx;
                firstY = vy;
            } else {
                spreadX |= Double.compare(vx, firstX) != 0;
                spreadY |= Double.compare(vy, firstY) != 0;
            }
            sumX += vx;
            sumY += vy;
            n++;
        }
        if (n < 2 || !spreadX || !spreadY) {
            return Double.NaN;
        }

        double meanX = sumX / n;
        double meanY = sumY / n;
        double covariance = 0.0;
        double varX = 0.0;
        double varY = 0.0;
        for (int r = 0; r < rows; r++) {
            if (x.isMissing(r) || y.isMissing(r)) {
                continue;
            }
            double dx = x.numericValue(r) - meanX;
            double dy = y.numericValue(r) - meanY;
            covariance += dx * dy;
            varX += dx * dx;
            varY += dy * dy;
        }
        if (varX == 0.0 || varY == 0.0) {
            return Double.NaN;
        }

        double r = covariance / Math.sqrt(varX * varY);
        return Math.max(-1.0, Math.min(1.0, r));
    }
}
