package com.commandcenter.layout_service.engine;

import com.commandcenter.layout_service.model.domain.LayoutEdge;
import com.commandcenter.layout_service.model.domain.LayoutNode;
import com.commandcenter.layout_service.model.domain.NodeId;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Shape checks run before any layout work. Dangling edge endpoints are not checked here:
 * they are legal and simply ignored later.
 */
public class GraphValidator {

    private final int maxNodes;
    private final int maxEdges;

    public GraphValidator(int maxNodes, int maxEdges) {
        this.maxNodes = maxNodes;
        this.maxEdges = maxEdges;
    }

    public void validate(List<LayoutNode> nodes, List<LayoutEdge> edges) {
        if (nodes == null) {
            throw new GraphValidationException("nodes must not be null");
        }
        if (edges == null) {
            throw new GraphValidationException("edges must not be null");
        }
        if (nodes.size() > maxNodes) {
            throw new GraphValidationException("Graph has " + nodes.size() + " nodes, limit is " + maxNodes);
        }
        if (edges.size() > maxEdges) {
            throw new GraphValidationException("Graph has " + edges.size() + " edges, limit is " + maxEdges);
        }

        Set<NodeId> seen = new HashSet<>();
        for (int i = 0; i < nodes.size(); i++) {
            LayoutNode node = nodes.get(i);
            if (node == null) {
                throw new GraphValidationException("nodes[" + i + "] is null");
            }
            if (!seen.add(node.id())) {
                throw new GraphValidationException("nodes[" + i + "] has duplicate id '" + node.id() + "'");
            }
        }
        for (int i = 0; i < edges.size(); i++) {
            if (edges.get(i) == null) {
                throw new GraphValidationException("edges[" + i + "] is null");
            }
        }
    }
}
