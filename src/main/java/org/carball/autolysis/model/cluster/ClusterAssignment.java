package org.carball.autolysis.model.cluster;

import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Density cluster label per retained row. Labels {@code >= 0} name a cluster, {@link #NOISE}
 * marks a row without a dense neighbourhood. Label values carry no order, only equality.
 * Arrays are copied on the way in and out.
 */
public record ClusterAssignment(int[] labels, int[] rowIndices, boolean insufficientData) {

    public static final int NOISE = -1;

    public ClusterAssignment {
        if (labels.length != rowIndices.length) {
            throw new IllegalArgumentException("Labels and row indices differ in length: "
                    + labels.length + " vs " + rowIndices.length);
        }
        labels = labels.clone();
        rowIndices = rowIndices.clone();
    }

    public static ClusterAssignment allNoise(int[] rowIndices) {
        int[] labels = new int[rowIndices.length];
        Arrays.fill(labels, NOISE);
        return new ClusterAssignment(labels, rowIndices, true);
    }

    @Override
    public int[] labels() {
        return labels.clone();
    }

    @Override
    public int[] rowIndices() {
        return rowIndices.clone();
    }

    public int rowIndex(int i) {
        return rowIndices[i];
    }

    public int size() {
        return labels.length;
    }

    public int label(int i) {
        return labels[i];
    }

    public int clusterCount() {
        return (int) Arrays.stream(labels).filter(l -> l != NOISE).distinct().count();
    }

    public int noiseCount() {
        return (int) Arrays.stream(labels).filter(l -> l == NOISE).count();
    }

    /**
     * Number of rows per label, noise included, in ascending label order.
     */
    public Map<Integer, Integer> clusterSizes() {
        Map<Integer, Integer> sizes = new LinkedHashMap<>();
        Arrays.stream(labels).sorted().forEach(l -> sizes.merge(l, 1, Integer::sum));
        return sizes;
    }

    /**
     * Label-independent view: groups of source rows sharing a cluster. Noise rows are excluded.
     */
    public Set<Set<Integer>> partition() {
        Map<Integer, Set<Integer>> groups = new LinkedHashMap<>();
        for (int i = 0; i < labels.length; i++) {
            if (labels[i] != NOISE) {
                groups.computeIfAbsent(labels[i], k -> new HashSet<>()).add(rowIndices[i]);
            }
        }
        return new HashSet<>(groups.values());
    }

    public Set<Integer> noiseRows() {
        Set<Integer> noise = new HashSet<>();
        for (int i = 0; i < labels.length; i++) {
            if (labels[i] == NOISE) {
                noise.add(rowIndices[i]);
            }
        }
        return noise;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof ClusterAssignment other
                && insufficientData == other.insufficientData
                && Arrays.equals(labels, other.labels)
                && Arrays.equals(rowIndices, other.rowIndices);
    }

    @Override
    public int hashCode() {
        int result = Arrays.hashCode(labels);
        result = 31 * result + Arrays.hashCode(rowIndices);
        return 31 * result + Boolean.hashCode(insufficientData);
    }

    @Override
    public String toString() {
        return "ClusterAssignment[labels=" + Arrays.toString(labels) + ", rowIndices="
                + Arrays.toString(rowIndices) + ", insufficientData=" + insufficientData + "]";
    }
}
