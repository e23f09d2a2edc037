package com.commandcenter.layout_service.model.domain;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Output of one layout call. Nodes keep the order they were supplied in; edges are the
 * caller's list, untouched.
 *
 * @param width  horizontal extent of the bounding box of all nodes
 * @param height vertical extent of the bounding box of all nodes
 */
public record LayoutResult(List<PositionedNode> nodes,
                           List<LayoutEdge> edges,
                           int rankCount,
                           double width,
                           double height) {

    public LayoutResult {
        nodes = List.copyOf(nodes);
    }

    public static LayoutResult empty(List<LayoutEdge> edges) {
        return new LayoutResult(List.of(), edges, 0, 0, 0);
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    public Optional<PositionedNode> find(NodeId id) {
        return nodes.stream().filter(n -> n.id().equals(id)).findFirst();
    }

    public Map<NodeId, Integer> ranks() {
        Map<NodeId, Integer> ranks = new LinkedHashMap<>();
        nodes.forEach(n -> ranks.put(n.id(), n.rank()));
        return ranks;
    }
}
