package com.commandcenter.layout_service.engine;

import com.commandcenter.layout_service.model.domain.LayoutNode;
import com.commandcenter.layout_service.model.domain.NodeId;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;

/**
 * Barycenter crossing reduction.
 *
 * Each sweep orders a rank by the mean index of its neighbours in the adjacent, already
 * ordered rank: a forward pass top to bottom against the rank above, then a backward pass
 * bottom to top against the rank below. Nodes with no neighbour in the reference rank
 * sort to the end. Sorting is stable, so ties keep their previous relative order and the
 * result depends only on the input order.
 *
 * This is a heuristic and does not look for the minimum number of crossings.
 */
public class CrossingReducer {

    private final int sweeps;

    public CrossingReducer(int sweeps) {
        if (sweeps < 1) {
            throw new IllegalArgumentException("crossingSweeps must be >= 1, got " + sweeps);
        }
        this.sweeps = sweeps;
    }

    /** Reorders the lists in {@code rankGroups} in place. Keys must be the rank numbers. */
    public void reduce(SortedMap<Integer, List<LayoutNode>> rankGroups, LayoutGraph graph) {
        List<List<LayoutNode>> ranks = new ArrayList<>(rankGroups.values());
        if (ranks.size() < 2) return;

        for (int sweep = 0; sweep < sweeps; sweep++) {
            boolean changed = false;

            for (int i = 1; i < ranks.size(); i++) {
                changed |= orderAgainst(ranks.get(i), ranks.get(i - 1), graph);
            }
            for (int i = ranks.size() - 2; i >= 0; i--) {
                changed |= orderAgainst(ranks.get(i), ranks.get(i + 1), graph);
            }

            if (!changed) break;
        }
    }

    private boolean orderAgainst(List<LayoutNode> current, List<LayoutNode> reference, LayoutGraph graph) {
        Map<NodeId, Integer> referenceIndex = indexOf(reference);

        Map<NodeId, Double> barycenters = new HashMap<>();
        for (LayoutNode node : current) {
            barycenters.put(node.id(), barycenter(node.id(), referenceIndex, graph));
        }

        List<LayoutNode> before = new ArrayList<>(current);
        current.sort(Comparator.comparingDouble(n -> barycenters.get(n.id())));
        return !before.equals(current);
    }

    private static double barycenter(NodeId id, Map<NodeId, Integer> referenceIndex, LayoutGraph graph) {
        double sum = 0;
        int count = 0;
        for (NodeId neighbour : graph.neighbours(id)) {
            Integer idx = referenceIndex.get(neighbour);
            if (idx != null) {
                sum += idx;
                count++;
            }
        }
        return count > 0 ? sum / count : Double.POSITIVE_INFINITY;
    }

    /**
     * Number of pairwise edge crossings between consecutive ranks for the current order.
     * Edges spanning more than one rank are not counted.
     */
    public static int countCrossings(SortedMap<Integer, List<LayoutNode>> rankGroups, LayoutGraph graph) {
        List<List<LayoutNode>> ranks = new ArrayList<>(rankGroups.values());
        int crossings = 0;

        for (int i = 0; i + 1 < ranks.size(); i++) {
            Map<NodeId, Integer> upper = indexOf(ranks.get(i));
            Map<NodeId, Integer> lower = indexOf(ranks.get(i + 1));

            List<int[]> segments = new ArrayList<>();
            for (LayoutNode node : ranks.get(i)) {
                for (NodeId neighbour : graph.neighbours(node.id())) {
                    Integer to = lower.get(neighbour);
                    if (to != null) {
                        segments.add(new int[]{upper.get(node.id()), to});
                    }
                }
            }

            for (int a = 0; a < segments.size(); a++) {
                for (int b = a + 1; b < segments.size(); b++) {
                    int[] s = segments.get(a);
                    int[] t = segments.get(b);
                    if ((long) (s[0] - t[0]) * (s[1] - t[1]) < 0) {
                        crossings++;
                    }
                }
            }
        }
        return crossings;
    }

    private static Map<NodeId, Integer> indexOf(List<LayoutNode> rank) {
        Map<NodeId, Integer> index = new HashMap<>();
        for (int i = 0; i < rank.size(); i++) {
            index.put(rank.get(i).id(), i);
        }
        return index;
    }
}
