package com.commandcenter.layout_service.engine;

import com.commandcenter.layout_service.model.domain.NodeId;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.commandcenter.layout_service.engine.GraphFixtures.edges;
import static com.commandcenter.layout_service.engine.GraphFixtures.nodes;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RankAssignerTest {

    private final RankAssigner fallback = new RankAssigner(CyclePolicy.FALLBACK);

    private Map<NodeId, Integer> rank(List<String> ids, String... edgeSpecs) {
        return fallback.assign(LayoutGraph.of(nodes(ids.toArray(String[]::new)), edges(edgeSpecs)));
    }

    @Test
    void diamondGetsThreeRanks() {
        Map<NodeId, Integer> ranks = rank(List.of("A", "B", "C", "D"), "A->B", "A->C", "B->D", "C->D");

        assertThat(ranks).containsExactly(
                Map.entry(NodeId.of("A"), 0),
                Map.entry(NodeId.of("B"), 1),
                Map.entry(NodeId.of("C"), 1),
                Map.entry(NodeId.of("D"), 2));
    }

    @Test
    void widenedDiamondJoinsAtRankTwo() {
        Map<NodeId, Integer> ranks = rank(List.of("A", "B", "C", "D", "E"),
                "A->B", "A->C", "A->E", "B->D", "C->D", "E->D");

        assertThat(ranks.get(NodeId.of("A"))).isZero();
        assertThat(ranks.get(NodeId.of("B"))).isEqualTo(1);
        assertThat(ranks.get(NodeId.of("C"))).isEqualTo(1);
        assertThat(ranks.get(NodeId.of("E"))).isEqualTo(1);
        assertThat(ranks.get(NodeId.of("D"))).isEqualTo(2);
    }

    @Test
    void nodeTakesLongestIncomingPath() {
        // D is reachable directly from A and through A->B->C
        Map<NodeId, Integer> ranks = rank(List.of("A", "B", "C", "D"), "A->D", "A->B", "B->C", "C->D");

        assertThat(ranks.get(NodeId.of("D"))).isEqualTo(3);
    }

    @Test
    void edgeFreeNodesAllSitAtRankZero() {
        Map<NodeId, Integer> ranks = rank(List.of("X", "Y", "Z"));

        assertThat(ranks.values()).containsOnly(0);
    }

    @Test
    void everyEdgePointsDownward() {
        List<String> ids = List.of("triage", "orch", "fg1", "fg2", "fin", "legal", "strategy", "kg");
        String[] specs = {"triage->orch", "orch->fg1", "orch->fg2", "fg1->fin", "fg1->legal", "fg2->strategy",
                "fin->kg", "legal->kg", "strategy->kg", "triage->kg"};
        Map<NodeId, Integer> ranks = rank(ids, specs);

        for (var edge : edges(specs)) {
            assertThat(ranks.get(edge.target())).isGreaterThanOrEqualTo(ranks.get(edge.source()) + 1);
        }
    }

    @Test
    void danglingEdgeIsIgnored() {
        Map<NodeId, Integer> ranks = rank(List.of("A", "B"), "A->B", "A->Z", "Q->B");

        assertThat(ranks).containsExactly(Map.entry(NodeId.of("A"), 0), Map.entry(NodeId.of("B"), 1));
    }

    @Test
    void cycleFallsBackWithoutThrowing() {
        Map<NodeId, Integer> ranks = rank(List.of("A", "B", "C"), "A->B", "B->C", "C->B");

        assertThat(ranks.get(NodeId.of("A"))).isZero();
        // B was pushed down by A before the cycle blocked it; C was never touched
        assertThat(ranks.get(NodeId.of("B"))).isEqualTo(1);
        assertThat(ranks.get(NodeId.of("C"))).isZero();
    }

    @Test
    void selfLoopFallsBackToRankZero() {
        Map<NodeId, Integer> ranks = rank(List.of("A"), "A->A");

        assertThat(ranks.get(NodeId.of("A"))).isZero();
    }

    @Test
    void rejectPolicyNamesTheStuckNodes() {
        RankAssigner strict = new RankAssigner(CyclePolicy.REJECT);
        LayoutGraph graph = LayoutGraph.of(nodes("A", "B", "C"), edges("A->B", "B->C", "C->B"));

        assertThatThrownBy(() -> strict.assign(graph))
                .isInstanceOf(CyclicGraphException.class)
                .satisfies(ex -> assertThat(((CyclicGraphException) ex).getUnrankedNodes())
                        .containsExactly(NodeId.of("B"), NodeId.of("C")));
    }

    @Test
    void rejectPolicyAcceptsAcyclicGraphs() {
        RankAssigner strict = new RankAssigner(CyclePolicy.REJECT);

        Map<NodeId, Integer> ranks = strict.assign(LayoutGraph.of(nodes("A", "B"), edges("A->B")));

        assertThat(ranks.get(NodeId.of("B"))).isEqualTo(1);
    }
}
