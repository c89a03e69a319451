package org.carball.autolysis.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.autolysis.config.ConfigurationException;
import org.carball.autolysis.model.analysis.OutlierBounds;
import org.carball.autolysis.model.analysis.OutlierReport;
import org.carball.autolysis.model.table.Column;
import org.carball.autolysis.model.table.Table;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Univariate outlier counts using Tukey fences: a value is an outlier iff it lies strictly
 * below {@code Q1 - m * IQR} or strictly above {@code Q3 + m * IQR}. Missing values never count.
 */
@Slf4j
public class OutlierDetector {

    public static final double DEFAULT_MULTIPLIER = 1.5;

    private final double multiplier;

    public OutlierDetector() {
        this(DEFAULT_MULTIPLIER);
    }

    public OutlierDetector(double multiplier) {
        if (!(multiplier > 0) || Double.isInfinite(multiplier)) {
            throw new ConfigurationException("IQR multiplier must be a positive finite number, got " + multiplier);
        }
        this.multiplier = multiplier;
    }

    /**
     * @throws EmptyInputException if the table has no columns or no rows
     */
    public OutlierReport detect(Table table) {
        if (table.getColumnCount() == 0) {
            throw new EmptyInputException("Table " + table.getName() + " has no columns");
        }
        if (table.getRowCount() == 0) {
            throw new EmptyInputException("Table " + table.getName() + " has no rows");
        }

        Map<String, Integer> counts = new LinkedHashMap<>();
        Map<String, OutlierBounds> bounds = new LinkedHashMap<>();

        for (Column column : table.numericColumns()) {
            double[] values = column.presentValues();
            if (values.length == 0) {
                counts.put(column.getName(), 0);
                continue;
            }

            double[] sorted = Percentiles.sortedCopy(values);
            OutlierBounds fences = OutlierBounds.of(
                    Percentiles.percentile(sorted, 0.25),
                    Percentiles.percentile(sorted, 0.75),
                    multiplier);

            int outliers = 0;
            for (double value : values) {
                if (fences.isOutlier(value)) {
                    outliers++;
                }
            }

            counts.put(column.getName(), outliers);
            bounds.put(column.getName(), fences);
            log.trace("Column {}: fences [{}, {}], {} outliers", column.getName(),
                    fences.lower(), fences.upper(), outliers);
        }

        OutlierReport report = new OutlierReport(counts, bounds);
        log.debug("Detected {} outliers across {} numeric columns", report.totalOutliers(), counts.size());
        return report;
    }
}
