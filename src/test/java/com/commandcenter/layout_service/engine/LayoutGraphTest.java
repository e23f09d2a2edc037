package com.commandcenter.layout_service.engine;

import com.commandcenter.layout_service.model.domain.NodeId;
import org.junit.jupiter.api.Test;

import static com.commandcenter.layout_service.engine.GraphFixtures.edges;
import static com.commandcenter.layout_service.engine.GraphFixtures.nodes;
import static org.assertj.core.api.Assertions.assertThat;

class LayoutGraphTest {

    private static final NodeId A = NodeId.of("A");
    private static final NodeId B = NodeId.of("B");

    @Test
    void keepsOnlyEdgesBetweenKnownNodes() {
        LayoutGraph graph = LayoutGraph.of(nodes("A", "B"), edges("A->B", "A->Z", "Z->B", "Y->Z"));

        assertThat(graph.getEdgeCount()).isEqualTo(1);
        assertThat(graph.getDanglingEdges()).isEqualTo(3);
        assertThat(graph.children(A)).containsExactly(B);
        assertThat(graph.parents(B)).containsExactly(A);
        assertThat(graph.neighbours(NodeId.of("Z"))).isEmpty();
    }

    @Test
    void collapsesDuplicateEdges() {
        LayoutGraph graph = LayoutGraph.of(nodes("A", "B"), edges("A->B", "A->B", "A->B"));

        assertThat(graph.getEdgeCount()).isEqualTo(1);
        assertThat(graph.getDuplicateEdges()).isEqualTo(2);
        assertThat(graph.inDegree(B)).isEqualTo(1);
    }

    @Test
    void neighboursIgnoreDirection() {
        LayoutGraph graph = LayoutGraph.of(nodes("A", "B"), edges("B->A"));

        assertThat(graph.neighbours(A)).containsExactly(B);
        assertThat(graph.neighbours(B)).containsExactly(A);
        assertThat(graph.inDegree(A)).isEqualTo(1);
        assertThat(graph.inDegree(B)).isZero();
    }

    @Test
    void preservesNodeOrder() {
        LayoutGraph graph = LayoutGraph.of(nodes("C", "A", "B"), edges());

        assertThat(graph.nodeIds()).containsExactly(NodeId.of("C"), A, B);
    }

    @Test
    void paddedEndpointIsADifferentNode() {
        LayoutGraph graph = LayoutGraph.of(nodes("A", "B"), edges("A->B "));

        assertThat(graph.getDanglingEdges()).isEqualTo(1);
        assertThat(graph.children(A)).isEmpty();
        assertThat(graph.inDegree(B)).isZero();
    }

    @Test
    void idsDifferingOnlyInWhitespaceAreDistinct() {
        LayoutGraph graph = LayoutGraph.of(nodes("A", "A "), edges("A->A "));

        assertThat(graph.nodeCount()).isEqualTo(2);
        assertThat(graph.children(A)).containsExactly(NodeId.of("A "));
    }
}
