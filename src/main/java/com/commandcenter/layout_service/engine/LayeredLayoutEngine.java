package com.commandcenter.layout_service.engine;

import com.commandcenter.layout_service.model.domain.LayoutEdge;
import com.commandcenter.layout_service.model.domain.LayoutNode;
import com.commandcenter.layout_service.model.domain.LayoutResult;
import com.commandcenter.layout_service.model.domain.NodeDimensions;
import com.commandcenter.layout_service.model.domain.NodeId;
import com.commandcenter.layout_service.model.domain.Position;
import com.commandcenter.layout_service.model.domain.PositionedNode;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Top-to-bottom hierarchical layout (a reduced Sugiyama pipeline):
 * <ol>
 *   <li>rank assignment by longest path from the roots</li>
 *   <li>crossing reduction by barycenter sweeps</li>
 *   <li>rows centred on x = 0, stacked with a fixed gap</li>
 * </ol>
 * Layout is derived only from the edges, never from node identities, so new agent
 * instances or file groups appearing mid-run need no special handling.
 *
 * The engine holds nothing but its settings; every call works on local state only and
 * the same input (node order included) always produces the same output.
 */
@Slf4j
public class LayeredLayoutEngine {

    @Getter
    private final LayoutSettings settings;
    private final GraphValidator validator;
    private final DimensionResolver dimensionResolver;
    private final RankAssigner rankAssigner;
    private final CrossingReducer crossingReducer;
    private final PositionCalculator positionCalculator;

    public LayeredLayoutEngine(LayoutSettings settings) {
        this.settings = settings;
        this.validator = new GraphValidator(settings.maxNodes(), settings.maxEdges());
        this.dimensionResolver = DimensionResolver.from(settings);
        this.rankAssigner = new RankAssigner(settings.cyclePolicy());
        this.crossingReducer = new CrossingReducer(settings.crossingSweeps());
        this.positionCalculator = new PositionCalculator(settings.rankGap(), settings.nodeGap(), dimensionResolver);
    }

    public LayoutResult layout(List<LayoutNode> nodes, List<LayoutEdge> edges) {
        validator.validate(nodes, edges);
        if (nodes.isEmpty()) {
            return LayoutResult.empty(edges);
        }

        LayoutGraph graph = LayoutGraph.of(nodes, edges);
        Map<NodeId, Integer> ranks = rankAssigner.assign(graph);

        SortedMap<Integer, List<LayoutNode>> rankGroups = new TreeMap<>();
        for (LayoutNode node : nodes) {
            rankGroups.computeIfAbsent(ranks.get(node.id()), r -> new ArrayList<>()).add(node);
        }

        crossingReducer.reduce(rankGroups, graph);
        Map<NodeId, Position> positions = positionCalculator.place(rankGroups);

        Map<NodeId, Integer> order = new HashMap<>();
        rankGroups.values().forEach(group -> {
            for (int i = 0; i < group.size(); i++) {
                order.put(group.get(i).id(), i);
            }
        });

        List<PositionedNode> placed = new ArrayList<>(nodes.size());
        double minX = Double.POSITIVE_INFINITY;
        double maxX = Double.NEGATIVE_INFINITY;
        double maxY = 0;
        for (LayoutNode node : nodes) {
            NodeDimensions dims = dimensionResolver.dimensions(node);
            PositionedNode positioned = new PositionedNode(
                    node, ranks.get(node.id()), order.get(node.id()), dims, positions.get(node.id()));
            placed.add(positioned);
            minX = Math.min(minX, positioned.position().x());
            maxX = Math.max(maxX, positioned.right());
            maxY = Math.max(maxY, positioned.bottom());
        }

        if (log.isDebugEnabled()) {
            log.debug("Laid out {} nodes / {} edges ({} dangling, {} duplicate) into {} ranks, {} crossings",
                    graph.nodeCount(), graph.getEdgeCount(), graph.getDanglingEdges(), graph.getDuplicateEdges(),
                    rankGroups.size(), CrossingReducer.countCrossings(rankGroups, graph));
        }

        return new LayoutResult(placed, edges, rankGroups.size(), maxX - minX, maxY);
    }

    public DimensionResolver dimensionResolver() {
        return dimensionResolver;
    }
}
