package com.commandcenter.layout_service.engine;

import com.commandcenter.layout_service.model.domain.NodeId;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Queue;

/**
 * Longest-path layering.
 *
 * A node's rank is the length of the longest path reaching it from any root, so every
 * ancestor sits above every descendant. Roots (in-degree 0) start at rank 0 and are
 * processed in FIFO order; a child is queued only after all of its parents have been
 * processed, which is what makes its rank the longest incoming path rather than the
 * first one found. Runs in O(V + E).
 */
@Slf4j
public class RankAssigner {

    private final CyclePolicy cyclePolicy;

    public RankAssigner(CyclePolicy cyclePolicy) {
        this.cyclePolicy = cyclePolicy;
    }

    public Map<NodeId, Integer> assign(LayoutGraph graph) {
        Map<NodeId, Integer> rank = new HashMap<>();
        Map<NodeId, Integer> processedParents = new HashMap<>();
        Queue<NodeId> queue = new ArrayDeque<>();

        for (NodeId id : graph.nodeIds()) {
            processedParents.put(id, 0);
            if (graph.inDegree(id) == 0) {
                rank.put(id, 0);
                queue.add(id);
            }
        }

        int dequeued = 0;
        while (!queue.isEmpty()) {
            NodeId current = queue.poll();
            dequeued++;
            int currentRank = rank.get(current);

            for (NodeId child : graph.children(current)) {
                rank.merge(child, currentRank + 1, Integer::max);

                int processed = processedParents.merge(child, 1, Integer::sum);
                if (processed == graph.inDegree(child)) {
                    queue.add(child);
                }
            }
        }

        // Nodes never dequeued sit on or behind a cycle: their in-degree can't be satisfied.
        // They keep whatever rank a processed parent already pushed them to, otherwise 0.
        List<NodeId> unreached = new ArrayList<>();
        if (dequeued < graph.nodeCount()) {
            for (NodeId id : graph.nodeIds()) {
                if (processedParents.get(id) < graph.inDegree(id)) {
                    unreached.add(id);
                }
            }
        }
        if (!unreached.isEmpty()) {
            if (cyclePolicy == CyclePolicy.REJECT) {
                throw new CyclicGraphException(unreached);
            }
            log.warn("Layout graph has a cycle: {} node(s) could not be fully ranked: {}",
                    unreached.size(), unreached);
        }

        Map<NodeId, Integer> result = new LinkedHashMap<>();
        for (NodeId id : graph.nodeIds()) {
            result.put(id, rank.getOrDefault(id, 0));
        }
        return result;
    }
}
