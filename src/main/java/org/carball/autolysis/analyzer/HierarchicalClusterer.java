package org.carball.autolysis.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.autolysis.model.analysis.StandardizedMatrix;
import org.carball.autolysis.model.cluster.MergeEvent;
import org.carball.autolysis.model.cluster.MergeTree;

import java.util.ArrayList;
import java.util.List;

/**
 * Agglomerative clustering with Ward linkage. Every step merges the pair of clusters whose
 * union increases the total within-cluster variance the least, and records the Ward distance
 * {@code sqrt(2 |u| |v| / (|u| + |v|)) * ||c_u - c_v||} of that merge. Distances to a merged
 * cluster follow the Lance-Williams update, so merge heights are non-decreasing.
 *
 * <p>Ties between equally distant pairs go to the pair with the smallest
 * {@code (min id, max id)} in lexicographic order.
 *
 * <p>Memory is quadratic and time at least quadratic in the row count.
 */
@Slf4j
public class HierarchicalClusterer {

    public MergeTree cluster(StandardizedMatrix matrix) {
        int n = matrix.rowCount();
        if (n < 2) {
            log.info("Only {} complete rows, merge tree is empty", n);
            return MergeTree.empty(n);
        }

        long start = System.currentTimeMillis();
        double[][] distance = pairwiseDistances(matrix);

        int[] ids = new int[n];
        int[] sizes = new int[n];
        boolean[] active = new boolean[n];
        for (int i = 0; i < n; i++) {
            ids[i] = i;
            sizes[i] = 1;
            active[i] = true;
        }

        // nearest[i] is the best merge partner of slot i under the tie-break order
        int[] nearest = new int[n];
        for (int i = 0; i < n; i++) {
            nearest[i] = findNearest(i, distance, ids, active);
        }

        List<MergeEvent> events = new ArrayList<>(n - 1);
        for (int step = 0; step < n - 1; step++) {
            int a = -1;
            for (int i = 0; i < n; i++) {
                if (!active[i]) {
                    continue;
                }
                if (a < 0 || precedes(distance, ids, i, nearest[i], a, nearest[a])) {
                    a = i;
                }
            }
            int b = nearest[a];

            double height = distance[a][b];
            int newSize = sizes[a] + sizes[b];
            events.add(new MergeEvent(Math.min(ids[a], ids[b]), Math.max(ids[a], ids[b]), height, newSize));

            // merged cluster takes slot a, slot b retires
            for (int k = 0; k < n; k++) {
                if (!active[k] || k == a || k == b) {
                    continue;
                }
                double updated = wardUpdate(distance[k][a], distance[k][b], height, sizes[k], sizes[a], sizes[b]);
                distance[k][a] = updated;
                distance[a][k] = updated;
            }
            active[b] = false;
            ids[a] = n + step;
            sizes[a] = newSize;

            for (int k = 0; k < n; k++) {
                if (!active[k] || k == a) {
                    continue;
                }
                if (nearest[k] == a || nearest[k] == b) {
                    nearest[k] = findNearest(k, distance, ids, active);
                } else if (precedesPair(distance[k][a], ids[k], ids[a], distance[k][nearest[k]], ids[k], ids[nearest[k]])) {
                    nearest[k] = a;
                }
            }
            if (step < n - 2) {
                nearest[a] = findNearest(a, distance, ids, active);
            }
        }

        log.debug("Ward linkage over {} rows finished in {} ms", n, System.currentTimeMillis() - start);
        return new MergeTree(n, events, false);
    }

    /**
     * Lance-Williams recurrence for Ward linkage on Euclidean distances.
     */
    static double wardUpdate(double dKa, double dKb, double dAb, int sizeK, int sizeA, int sizeB) {
        double total = sizeK + sizeA + sizeB;
        double squared = ((sizeK + sizeA) * dKa * dKa
                + (sizeK + sizeB) * dKb * dKb
                - sizeK * dAb * dAb) / total;
        return Math.sqrt(Math.max(squared, 0.0));
    }

    private static double[][] pairwiseDistances(StandardizedMatrix matrix) {
        int n = matrix.rowCount();
        double[][] distance = new double[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                double d = Math.sqrt(matrix.squaredDistance(i, j));
                distance[i][j] = d;
                distance[j][i] = d;
            }
        }
        return distance;
    }

    private static int findNearest(int slot, double[][] distance, int[] ids, boolean[] active) {
        int best = -1;
        for (int k = 0; k < distance.length; k++) {
            if (!active[k] || k == slot) {
                continue;
            }
            if (best < 0 || precedesPair(distance[slot][k], ids[slot], ids[k],
                    distance[slot][best], ids[slot], ids[best])) {
                best = k;
            }
        }
        return best;
    }

    private static boolean precedes(double[][] distance, int[] ids, int i, int j, int a, int b) {
        return precedesPair(distance[i][j], ids[i], ids[j], distance[a][b], ids[a], ids[b]);
    }

    /**
     * Orders candidate merges by distance, then by {@code (min id, max id)}.
     */
    private static boolean precedesPair(double d1, int x1, int y1, double d2, int x2, int y2) {
        if (d1 != d2) {
            return d1 < d2;
        }
        int lo1 = Math.min(x1, y1);
        int lo2 = Math.min(x2, y2);
        if (lo1 != lo2) {
            return lo1 < lo2;
        }
        return Math.max(x1, y1) < Math.max(x2, y2);
    }
}
