package com.commandcenter.layout_service.engine;

import com.commandcenter.layout_service.model.domain.NodeDimensions;
import com.commandcenter.layout_service.model.domain.NodeKind;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Every tunable the engine reads. Passed explicitly into {@link LayeredLayoutEngine};
 * the engine keeps no other configuration.
 *
 * @param rankGap         vertical gap between the bottom of a rank and the top of the next
 * @param nodeGap         horizontal gap between neighbours in the same rank
 * @param dimensions      box per kind; kinds missing here use {@code defaultDimensions}
 * @param maxNodes        ceiling on nodes per call
 * @param maxEdges        ceiling on edges per call
 * @param crossingSweeps  number of forward+backward barycenter passes
 */
public record LayoutSettings(double rankGap,
                             double nodeGap,
                             Map<NodeKind, NodeDimensions> dimensions,
                             NodeDimensions defaultDimensions,
                             int maxNodes,
                             int maxEdges,
                             CyclePolicy cyclePolicy,
                             int crossingSweeps) {

    public static final double DEFAULT_RANK_GAP = 120;
    public static final double DEFAULT_NODE_GAP = 150;
    public static final NodeDimensions DEFAULT_NODE_DIMENSIONS = new NodeDimensions(280, 100);
    public static final NodeDimensions FILE_GROUP_DIMENSIONS = new NodeDimensions(240, 80);
    public static final int DEFAULT_MAX_NODES = 500;
    public static final int DEFAULT_MAX_EDGES = 5_000;

    public LayoutSettings {
        if (!(rankGap >= 0)) {
            throw new IllegalArgumentException("rankGap must be >= 0, got " + rankGap);
        }
        if (!(nodeGap > 0)) {
            throw new IllegalArgumentException("nodeGap must be > 0, got " + nodeGap);
        }
        Objects.requireNonNull(defaultDimensions, "defaultDimensions");
        Objects.requireNonNull(cyclePolicy, "cyclePolicy");
        if (maxNodes < 1 || maxEdges < 1) {
            throw new IllegalArgumentException("maxNodes and maxEdges must be >= 1, got " + maxNodes + "/" + maxEdges);
        }
        if (crossingSweeps < 1) {
            throw new IllegalArgumentException("crossingSweeps must be >= 1, got " + crossingSweeps);
        }
        EnumMap<NodeKind, NodeDimensions> table = new EnumMap<>(NodeKind.class);
        if (dimensions != null) {
            table.putAll(dimensions);
        }
        dimensions = Collections.unmodifiableMap(table);
    }

    public static LayoutSettings defaults() {
        return new LayoutSettings(
                DEFAULT_RANK_GAP,
                DEFAULT_NODE_GAP,
                Map.of(NodeKind.FILE_GROUP, FILE_GROUP_DIMENSIONS),
                DEFAULT_NODE_DIMENSIONS,
                DEFAULT_MAX_NODES,
                DEFAULT_MAX_EDGES,
                CyclePolicy.FALLBACK,
                1
        );
    }

    public LayoutSettings withCyclePolicy(CyclePolicy policy) {
        return new LayoutSettings(rankGap, nodeGap, dimensions, defaultDimensions, maxNodes, maxEdges, policy, crossingSweeps);
    }

    public LayoutSettings withCrossingSweeps(int sweeps) {
        return new LayoutSettings(rankGap, nodeGap, dimensions, defaultDimensions, maxNodes, maxEdges, cyclePolicy, sweeps);
    }

    public LayoutSettings withLimits(int nodes, int edges) {
        return new LayoutSettings(rankGap, nodeGap, dimensions, defaultDimensions, nodes, edges, cyclePolicy, crossingSweeps);
    }

    public LayoutSettings withGaps(double rank, double node) {
        return new LayoutSettings(rank, node, dimensions, defaultDimensions, maxNodes, maxEdges, cyclePolicy, crossingSweeps);
    }
}
