package org.carball.autolysis.render;

import org.carball.autolysis.model.report.ProfileReport;
import org.carball.autolysis.model.table.Table;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

public interface ChartRenderer {

    String CORRELATION_CHART = "correlation_matrix";
    String DENSITY_CHART = "dbscan_clusters";
    String HIERARCHY_CHART = "hierarchical_clustering";

    /**
     * Draws every chart the report has data for.
     *
     * @return chart name to written file, in drawing order; charts without data are left out
     */
    Map<String, Path> render(Table table, ProfileReport report, Path outputDirectory) throws IOException;
}
