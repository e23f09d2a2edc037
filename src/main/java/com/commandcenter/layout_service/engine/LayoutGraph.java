package com.commandcenter.layout_service.engine;

import com.commandcenter.layout_service.model.domain.LayoutEdge;
import com.commandcenter.layout_service.model.domain.LayoutNode;
import com.commandcenter.layout_service.model.domain.NodeId;
import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The graph of a single layout call, filtered at the boundary.
 *
 * Only edges whose source and target are both in the node set contribute adjacency.
 * Repeated edges are collapsed. Iteration orders follow the order nodes and edges were
 * supplied in, which keeps every later step deterministic.
 */
public final class LayoutGraph {

    private final Map<NodeId, LayoutNode> nodes = new LinkedHashMap<>();
    private final Map<NodeId, Set<NodeId>> children = new LinkedHashMap<>();
    private final Map<NodeId, Set<NodeId>> parents = new LinkedHashMap<>();
    private final Map<NodeId, Set<NodeId>> neighbours = new LinkedHashMap<>();

    @Getter
    private int edgeCount;
    @Getter
    private int danglingEdges;
    @Getter
    private int duplicateEdges;

    private LayoutGraph() {
    }

    public static LayoutGraph of(List<LayoutNode> nodes, List<LayoutEdge> edges) {
        LayoutGraph graph = new LayoutGraph();
        for (LayoutNode node : nodes) {
            graph.nodes.put(node.id(), node);
            graph.children.put(node.id(), new LinkedHashSet<>());
            graph.parents.put(node.id(), new LinkedHashSet<>());
            graph.neighbours.put(node.id(), new LinkedHashSet<>());
        }
        for (LayoutEdge edge : edges) {
            graph.addEdge(edge);
        }
        return graph;
    }

    private void addEdge(LayoutEdge edge) {
        NodeId source = edge.source();
        NodeId target = edge.target();
        if (!nodes.containsKey(source) || !nodes.containsKey(target)) {
            danglingEdges++;
            return;
        }
        if (!children.get(source).add(target)) {
            duplicateEdges++;
            return;
        }
        parents.get(target).add(source);
        neighbours.get(source).add(target);
        neighbours.get(target).add(source);
        edgeCount++;
    }

    public Set<NodeId> nodeIds() {
        return Collections.unmodifiableSet(nodes.keySet());
    }

    public int nodeCount() {
        return nodes.size();
    }

    public Set<NodeId> children(NodeId id) {
        return view(children, id);
    }

    public Set<NodeId> parents(NodeId id) {
        return view(parents, id);
    }

    /** Nodes joined to {@code id} by an edge in either direction. */
    public Set<NodeId> neighbours(NodeId id) {
        return view(neighbours, id);
    }

    public int inDegree(NodeId id) {
        return parents(id).size();
    }

    private static Set<NodeId> view(Map<NodeId, Set<NodeId>> adjacency, NodeId id) {
        Set<NodeId> set = adjacency.get(id);
        return set != null ? Collections.unmodifiableSet(set) : Set.of();
    }
}
