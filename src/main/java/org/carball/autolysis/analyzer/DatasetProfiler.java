package org.carball.autolysis.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.autolysis.config.ClusteringSettings;
import org.carball.autolysis.model.analysis.ColumnProfile;
import org.carball.autolysis.model.analysis.CorrelationMatrix;
import org.carball.autolysis.model.analysis.OutlierReport;
import org.carball.autolysis.model.analysis.ProfileWarning;
import org.carball.autolysis.model.analysis.StandardizedMatrix;
import org.carball.autolysis.model.cluster.ClusterAssignment;
import org.carball.autolysis.model.cluster.MergeTree;
import org.carball.autolysis.model.report.ProfileReport;
import org.carball.autolysis.model.report.ReportSection;
import org.carball.autolysis.model.table.Table;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Supplier;

/**
 * Runs the profiling components over one table and assembles a {@link ProfileReport}.
 *
 * <p>Column profiles, outliers, correlation and standardization start in parallel on a worker
 * pool; both clusterers start once the standardized matrix is ready. A component that fails
 * leaves its section absent, with the reason recorded, and never fails the run.
 */
@Slf4j
public class DatasetProfiler {

    static final String SKIPPED = "Skipped by caller";

    private final ClusteringSettings settings;

    public DatasetProfiler(ClusteringSettings settings) {
        this.settings = settings != null ? settings : ClusteringSettings.defaults();
        log.info("Initialized DatasetProfiler with settings: {}", this.settings.getDescription());
    }

    public ProfileReport profile(Table table) {
        return profile(table, EnumSet.allOf(ReportSection.class));
    }

    /**
     * Profiles the table, launching only the requested sections. Sections left out are reported
     * as absent. Density and hierarchical clustering also need {@link ReportSection#STANDARDIZATION}.
     */
    public ProfileReport profile(Table table, Set<ReportSection> sections) {
        log.info("Starting profiling of {} ({} rows, {} columns)",
                table.getName(), table.getRowCount(), table.getColumnCount());
        long start = System.currentTimeMillis();

        Map<ReportSection, String> absent = new EnumMap<>(ReportSection.class);
        ExecutorService pool = Executors.newFixedThreadPool(settings.effectiveThreads());

        try {
            CompletableFuture<Map<String, ColumnProfile>> profiles = launch(sections, ReportSection.COLUMN_PROFILES,
                    () -> new ColumnProfiler().profile(table), pool);
            CompletableFuture<OutlierReport> outliers = launch(sections, ReportSection.OUTLIERS,
                    () -> new OutlierDetector(settings.getIqrMultiplier()).detect(table), pool);
            CompletableFuture<CorrelationMatrix> correlation = launch(sections, ReportSection.CORRELATION,
                    () -> new CorrelationCalculator().compute(table), pool);
            CompletableFuture<StandardizedMatrix> standardized = launch(sections, ReportSection.STANDARDIZATION,
                    () -> new Standardizer().standardize(table), pool);

            CompletableFuture<ClusterAssignment> clusters = standardized != null && sections.contains(ReportSection.DENSITY_CLUSTERS)
                    ? standardized.thenApplyAsync(
                            matrix -> new DensityClusterer(settings.getEps(), settings.getMinSamples()).cluster(matrix), pool)
                    : null;
            CompletableFuture<MergeTree> mergeTree = standardized != null && sections.contains(ReportSection.MERGE_TREE)
                    ? standardized.thenApplyAsync(matrix -> new HierarchicalClusterer().cluster(matrix), pool)
                    : null;

            Map<String, ColumnProfile> profileResult = await(profiles, ReportSection.COLUMN_PROFILES, absent);
            OutlierReport outlierResult = await(outliers, ReportSection.OUTLIERS, absent);
            CorrelationMatrix correlationResult = await(correlation, ReportSection.CORRELATION, absent);
            StandardizedMatrix matrix = await(standardized, ReportSection.STANDARDIZATION, absent);
            ClusterAssignment clusterResult = await(clusters, ReportSection.DENSITY_CLUSTERS, absent);
            MergeTree treeResult = await(mergeTree, ReportSection.MERGE_TREE, absent);

            Set<ProfileWarning> warnings = collectWarnings(profileResult, matrix, clusterResult, treeResult);

            ProfileReport report = new ProfileReport(
                    table.getName(),
                    table.getRowCount(),
                    table.getColumnCount(),
                    profileResult,
                    outlierResult,
                    correlationResult,
                    matrix != null ? matrix.rowIndices() : null,
                    clusterResult,
                    treeResult,
                    warnings,
                    absent);

            log.info("Profiling of {} complete in {} ms ({} sections absent, {} warnings)",
                    table.getName(), System.currentTimeMillis() - start, absent.size(), warnings.size());
            return report;
        } finally {
            pool.shutdownNow();
        }
    }

    private static <T> CompletableFuture<T> launch(Set<ReportSection> sections, ReportSection section,
                                                   Supplier<T> task, ExecutorService pool) {
        if (!sections.contains(section)) {
            return null;
        }
        return CompletableFuture.supplyAsync(task, pool);
    }

    private static <T> T await(CompletableFuture<T> future, ReportSection section, Map<ReportSection, String> absent) {
        if (future == null) {
            absent.put(section, SKIPPED);
            return null;
        }
        try {
            return future.get();
        } catch (ExecutionException | CompletionException e) {
            Throwable cause = unwrap(e);
            log.warn("{} unavailable: {}", section.getDisplayName(), cause.getMessage());
            log.debug("{} failure details", section.getDisplayName(), cause);
            absent.put(section, describe(cause));
            return null;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            absent.put(section, "Interrupted");
            return null;
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable cause = error;
        while ((cause instanceof ExecutionException || cause instanceof CompletionException)
                && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }

    private static String describe(Throwable cause) {
        if (cause instanceof EmptyInputException) {
            return "Nothing to profile: " + cause.getMessage();
        }
        if (cause instanceof IllegalArgumentException) {
            return "Configuration error: " + cause.getMessage();
        }
        return cause.getClass().getSimpleName() + ": " + cause.getMessage();
    }

    private static Set<ProfileWarning> collectWarnings(Map<String, ColumnProfile> profiles,
                                                       StandardizedMatrix matrix,
                                                       ClusterAssignment clusters,
                                                       MergeTree mergeTree) {
        Set<ProfileWarning> warnings = EnumSet.noneOf(ProfileWarning.class);
        if (profiles != null && profiles.values().stream()
                .anyMatch(p -> p.isNumeric() && p.count() < 2)) {
            warnings.add(ProfileWarning.INSUFFICIENT_VALUES_FOR_STD);
        }
        if (matrix != null && matrix.columnCount() == 0) {
            warnings.add(ProfileWarning.NO_NUMERIC_COLUMNS);
        }
        if (clusters != null && clusters.insufficientData()) {
            warnings.add(ProfileWarning.INSUFFICIENT_ROWS_FOR_DENSITY);
        }
        if (mergeTree != null && mergeTree.insufficientData()) {
            warnings.add(ProfileWarning.INSUFFICIENT_ROWS_FOR_HIERARCHY);
        }
        return warnings;
    }
}
