package org.carball.autolysis.model.cluster;

/**
 * One agglomeration step. {@code left} and {@code right} are cluster ids: ids below the leaf
 * count are original rows, larger ids refer to earlier merges. {@code size} is the number of
 * rows in the merged cluster.
 */
public record MergeEvent(int left, int right, double distance, int size) {
}
