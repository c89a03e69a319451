package org.carball.autolysis.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.autolysis.config.ConfigurationException;
import org.carball.autolysis.model.analysis.StandardizedMatrix;
import org.carball.autolysis.model.cluster.ClusterAssignment;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;

/**
 * DBSCAN over the rows of a standardized matrix with Euclidean distance.
 *
 * <p>A row is a core point when at least {@code minSamples} rows, itself included, lie within
 * {@code eps}. Clusters grow breadth-first from core points taken in ascending row order, so
 * labels are numbered in discovery order and membership depends only on the input order and
 * the parameters. A border row joins the first cluster that reaches it. Rows reachable from
 * no core point are labelled {@link ClusterAssignment#NOISE}.
 *
 * <p>Neighbourhoods are found by brute force, which is quadratic in the row count.
 */
@Slf4j
public class DensityClusterer {

    public static final double DEFAULT_EPS = 0.5;
    public static final int DEFAULT_MIN_SAMPLES = 5;

    private final double eps;
    private final int minSamples;

    public DensityClusterer() {
        this(DEFAULT_EPS, DEFAULT_MIN_SAMPLES);
    }

    public DensityClusterer(double eps, int minSamples) {
        if (!(eps > 0) || Double.isInfinite(eps)) {
            throw new ConfigurationException("DBSCAN eps must be a positive finite number, got " + eps);
        }
        if (minSamples < 1) {
            throw new ConfigurationException("DBSCAN min_samples must be at least 1, got " + minSamples);
        }
        this.eps = eps;
        this.minSamples = minSamples;
    }

    public ClusterAssignment cluster(StandardizedMatrix matrix) {
        int n = matrix.rowCount();
        if (n < minSamples + 1) {
            log.info("Only {} complete rows for min_samples={}, labelling all rows as noise", n, minSamples);
            return ClusterAssignment.allNoise(matrix.rowIndices());
        }

        int[][] neighbours = neighbourhoods(matrix);
        boolean[] core = new boolean[n];
        for (int i = 0; i < n; i++) {
            core[i] = neighbours[i].length >= minSamples;
        }

        int[] labels = new int[n];
        Arrays.fill(labels, ClusterAssignment.NOISE);
        boolean[] assigned = new boolean[n];
        int nextLabel = 0;

        for (int seed = 0; seed < n; seed++) {
            if (assigned[seed] || !core[seed]) {
                continue;
            }

            int label = nextLabel++;
            Deque<Integer> queue = new ArrayDeque<>();
            labels[seed] = label;
            assigned[seed] = true;
            queue.add(seed);

            while (!queue.isEmpty()) {
                int point = queue.poll();
                for (int neighbour : neighbours[point]) {
                    if (assigned[neighbour]) {
                        continue;
                    }
                    labels[neighbour] = label;
                    assigned[neighbour] = true;
                    if (core[neighbour]) {
                        queue.add(neighbour);
                    }
                }
            }
        }

        ClusterAssignment assignment = new ClusterAssignment(labels, matrix.rowIndices(), false);
        log.debug("DBSCAN (eps={}, min_samples={}) found {} clusters and {} noise rows",
                eps, minSamples, assignment.clusterCount(), assignment.noiseCount());
        return assignment;
    }

    private int[][] neighbourhoods(StandardizedMatrix matrix) {
        int n = matrix.rowCount();
        double epsSquared = eps * eps;
        int[][] neighbours = new int[n][];
        int[] buffer = new int[n];

        for (int i = 0; i < n; i++) {
            int found = 0;
            for (int j = 0; j < n; j++) {
                if (matrix.squaredDistance(i, j) <= epsSquared) {
                    buffer[found++] = j;
                }
            }
            neighbours[i] = Arrays.copyOf(buffer, found);
        }
        return neighbours;
    }

    public double getEps() {
        return eps;
    }

    public int getMinSamples() {
        return minSamples;
    }
}
