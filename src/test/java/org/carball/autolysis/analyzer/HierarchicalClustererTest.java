package org.carball.autolysis.analyzer;

import org.carball.autolysis.model.analysis.StandardizedMatrix;
import org.carball.autolysis.model.cluster.MergeEvent;
import org.carball.autolysis.model.cluster.MergeTree;
import org.carball.autolysis.model.table.Column;
import org.carball.autolysis.model.table.Table;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

public class HierarchicalClustererTest {

    private HierarchicalClusterer clusterer;

    @BeforeEach
    void setUp() {
        clusterer = new HierarchicalClusterer();
    }

    @Test
    void shouldMergeWithinGroupsBeforeAcrossGroups() {
        // Given
        StandardizedMatrix matrix = new Standardizer().standardize(TestTables.twoGroups());

        // When
        MergeTree tree = clusterer.cluster(matrix);

        // Then
        assertThat(tree.size()).isEqualTo(5);
        MergeEvent last = tree.event(4);
        assertThat(last.size()).isEqualTo(6);
        assertThat(last.distance()).isEqualTo(tree.maxDistance());
        assertThat(tree.mergeOf(last.left()).size()).isEqualTo(3);
        assertThat(tree.mergeOf(last.right()).size()).isEqualTo(3);
        assertThat(leavesUnder(tree, last.left())).isIn(Set.of(0, 1, 2), Set.of(3, 4, 5));
        for (int i = 0; i < 4; i++) {
            assertThat(tree.event(i).distance()).isLessThan(last.distance());
        }
    }

    @Test
    void shouldComputeWardDistancesForSmallExample() {
        // Given
        StandardizedMatrix matrix = line(0.0, 1.0, 3.0);

        // When
        MergeTree tree = clusterer.cluster(matrix);

        // Then - sqrt(2 * 1 * 2 / 3) * |3 - 0.5|
        assertThat(tree.event(0)).isEqualTo(new MergeEvent(0, 1, 1.0, 2));
        MergeEvent root = tree.event(1);
        assertThat(root.left()).isEqualTo(2);
        assertThat(root.right()).isEqualTo(3);
        assertThat(root.size()).isEqualTo(3);
        assertThat(root.distance()).isCloseTo(Math.sqrt(4.0 / 3.0) * 2.5, within(1e-12));
        assertThat(tree.rootId()).isEqualTo(4);
    }

    @Test
    void shouldBreakTiesBySmallestClusterIds() {
        // Given - three equally distant neighbour pairs
        StandardizedMatrix matrix = line(0.0, 1.0, 2.0, 3.0);

        // When
        MergeTree tree = clusterer.cluster(matrix);

        // Then
        assertThat(tree.event(0)).isEqualTo(new MergeEvent(0, 1, 1.0, 2));
        assertThat(tree.event(1)).isEqualTo(new MergeEvent(2, 3, 1.0, 2));
        assertThat(tree.event(2).left()).isEqualTo(4);
        assertThat(tree.event(2).right()).isEqualTo(5);
        assertThat(tree.event(2).size()).isEqualTo(4);
    }

    @Test
    void shouldProduceNMinusOneMonotoneMerges() {
        // Given
        Random random = new Random(11);
        List<Double> xs = new ArrayList<>();
        List<Double> ys = new ArrayList<>();
        List<Double> zs = new ArrayList<>();
        for (int i = 0; i < 120; i++) {
            xs.add(random.nextGaussian());
            ys.add(random.nextGaussian() * 3);
            zs.add((double) random.nextInt(4));
        }
        Table table = new Table("random", List.of(
                Column.numeric("x", xs), Column.numeric("y", ys), Column.numeric("z", zs)));
        StandardizedMatrix matrix = new Standardizer().standardize(table);

        // When
        MergeTree tree = clusterer.cluster(matrix);

        // Then
        assertThat(tree.size()).isEqualTo(119);
        assertThat(tree.insufficientData()).isFalse();
        for (int i = 1; i < tree.size(); i++) {
            assertThat(tree.event(i).distance()).isGreaterThanOrEqualTo(tree.event(i - 1).distance() - 1e-12);
        }
        assertThat(tree.event(tree.size() - 1).size()).isEqualTo(120);
    }

    @Test
    void shouldUseEveryClusterIdExactlyOnce() {
        // Given
        StandardizedMatrix matrix = line(0.0, 0.5, 4.0, 4.2, 9.0, 13.0);

        // When
        MergeTree tree = clusterer.cluster(matrix);

        // Then
        Set<Integer> children = new HashSet<>();
        for (int i = 0; i < tree.size(); i++) {
            MergeEvent event = tree.event(i);
            assertThat(event.left()).isLessThan(event.right());
            assertThat(event.right()).isLessThan(tree.leafCount() + i);
            assertThat(children.add(event.left())).isTrue();
            assertThat(children.add(event.right())).isTrue();
        }
        assertThat(children).hasSize(2 * tree.leafCount() - 2);
    }

    @Test
    void shouldMergeDuplicatePointsAtZeroDistance() {
        // Given
        StandardizedMatrix matrix = line(1.0, 1.0, 5.0);

        // When
        MergeTree tree = clusterer.cluster(matrix);

        // Then
        assertThat(tree.event(0)).isEqualTo(new MergeEvent(0, 1, 0.0, 2));
    }

    @Test
    void shouldReturnEmptyTreeForFewerThanTwoRows() {
        // When
        MergeTree single = clusterer.cluster(line(1.0));
        MergeTree none = clusterer.cluster(line());

        // Then
        assertThat(single.size()).isZero();
        assertThat(single.insufficientData()).isTrue();
        assertThat(single.rootId()).isZero();
        assertThat(none.size()).isZero();
        assertThat(none.insufficientData()).isTrue();
    }

    @Test
    void shouldApplyLanceWilliamsWardUpdate() {
        // Given - singletons at 0, 1 merged, third point at 3
        double updated = HierarchicalClusterer.wardUpdate(3.0, 2.0, 1.0, 1, 1, 1);

        // Then
        assertThat(updated).isCloseTo(Math.sqrt(25.0 / 3.0), within(1e-12));
    }

    private static Set<Integer> leavesUnder(MergeTree tree, int id) {
        Set<Integer> leaves = new HashSet<>();
        if (tree.isLeaf(id)) {
            leaves.add(id);
            return leaves;
        }
        MergeEvent merge = tree.mergeOf(id);
        leaves.addAll(leavesUnder(tree, merge.left()));
        leaves.addAll(leavesUnder(tree, merge.right()));
        return leaves;
    }

    private static StandardizedMatrix line(double... points) {
        double[][] values = new double[points.length][1];
        int[] rows = new int[points.length];
        for (int i = 0; i < points.length; i++) {
            values[i][0] = points[i];
            rows[i] = i;
        }
        return new StandardizedMatrix(List.of("x"), values, rows, new double[]{0.0}, new double[]{1.0});
    }
}
