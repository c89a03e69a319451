package org.carball.autolysis.model.analysis;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Outlier counts per numeric column, in column order. Columns without any non-missing value
 * have a count of 0 and no bounds.
 */
public record OutlierReport(Map<String, Integer> counts, Map<String, OutlierBounds> bounds) {

    public OutlierReport {
        counts = Collections.unmodifiableMap(new LinkedHashMap<>(counts));
        bounds = Collections.unmodifiableMap(new LinkedHashMap<>(bounds));
    }

    public int countFor(String column) {
        return counts.getOrDefault(column, 0);
    }

    public Optional<OutlierBounds> boundsFor(String column) {
        return Optional.ofNullable(bounds.get(column));
    }

    public int totalOutliers() {
        return counts.values().stream().mapToInt(Integer::intValue).sum();
    }
}
