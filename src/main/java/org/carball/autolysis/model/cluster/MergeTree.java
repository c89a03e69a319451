package org.carball.autolysis.model.cluster;

import java.util.List;

/**
 * Binary merge tree over {@code leafCount} rows. The i-th event creates cluster id
 * {@code leafCount + i}; a complete tree has exactly {@code leafCount - 1} events.
 */
public record MergeTree(int leafCount, List<MergeEvent> events, boolean insufficientData) {

    public MergeTree {
        events = List.copyOf(events);
    }

    public static MergeTree empty(int leafCount) {
        return new MergeTree(leafCount, List.of(), true);
    }

    public int size() {
        return events.size();
    }

    public MergeEvent event(int i) {
        return events.get(i);
    }

    public int rootId() {
        return events.isEmpty() ? (leafCount == 1 ? 0 : -1) : leafCount + events.size() - 1;
    }

    public boolean isLeaf(int clusterId) {
        return clusterId < leafCount;
    }

    /**
     * Event that created the given non-leaf cluster id.
     */
    public MergeEvent mergeOf(int clusterId) {
        if (isLeaf(clusterId)) {
            throw new IllegalArgumentException("Cluster " + clusterId + " is a leaf");
        }
        return events.get(clusterId - leafCount);
    }

    public double maxDistance() {
        return events.stream().mapToDouble(MergeEvent::distance).max().orElse(0.0);
    }
}
