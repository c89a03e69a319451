package org.carball.autolysis.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.autolysis.model.analysis.ColumnProfile;
import org.carball.autolysis.model.table.Column;
import org.carball.autolysis.model.table.Table;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Descriptive statistics for every column of a table. Numeric columns get count, mean, sample
 * standard deviation, min, quartiles and max over their non-missing values; categorical columns
 * get count, number of distinct values and the most frequent value.
 */
@Slf4j
public class ColumnProfiler {

    /**
     * @return one profile per column, in column order
     * @throws EmptyInputException if the table has no columns or no rows
     */
    public Map<String, ColumnProfile> profile(Table table) {
        if (table.getColumnCount() == 0) {
            throw new EmptyInputException("Table " + table.getName() + " has no columns");
        }
        if (table.getRowCount() == 0) {
            throw new EmptyInputException("Table " + table.getName() + " has no rows");
        }

        Map<String, ColumnProfile> profiles = new LinkedHashMap<>();
        for (Column column : table.getColumns()) {
            profiles.put(column.getName(), profileColumn(column));
        }

        log.debug("Profiled {} columns over {} rows", profiles.size(), table.getRowCount());
        return profiles;
    }

    public ColumnProfile profileColumn(Column column) {
        return column.isNumeric() ? profileNumeric(column) : profileCategorical(column);
    }

    private ColumnProfile profileNumeric(Column column) {
        double[] values = column.presentValues();
        int missing = column.size() - values.length;

        if (values.length == 0) {
            return ColumnProfile.numeric(column.getName(), 0, missing,
                    Double.NaN, Double.NaN, Double.NaN, Double.NaN, Double.NaN, Double.NaN, Double.NaN);
        }

        double[] sorted = Percentiles.sortedCopy(values);
        double mean = Percentiles.mean(values);

        return ColumnProfile.numeric(
                column.getName(),
                values.length,
                missing,
                mean,
                Percentiles.sampleStd(values, mean),
                sorted[0],
                Percentiles.percentile(sorted, 0.25),
                Percentiles.percentile(sorted, 0.50),
                Percentiles.percentile(sorted, 0.75),
                sorted[sorted.length - 1]);
    }

    private ColumnProfile profileCategorical(Column column) {
        // insertion order keeps the first occurrence ahead on ties
        Map<String, Integer> frequencies = new LinkedHashMap<>();
        int count = 0;
        for (int row = 0; row < column.size(); row++) {
            String value = column.textValue(row);
            if (value != null) {
                frequencies.merge(value, 1, Integer::sum);
                count++;
            }
        }

        String top = null;
        int freq = 0;
        for (Map.Entry<String, Integer> entry : frequencies.entrySet()) {
            if (entry.getValue() > freq) {
                top = entry.getKey();
                freq = entry.getValue();
            }
        }

        return ColumnProfile.categorical(column.getName(), count, column.size() - count,
                frequencies.size(), top, freq);
    }
}
