package com.commandcenter.layout_service.engine;

import com.commandcenter.layout_service.model.domain.LayoutNode;
import com.commandcenter.layout_service.model.domain.NodeDimensions;
import com.commandcenter.layout_service.model.domain.NodeId;
import com.commandcenter.layout_service.model.domain.Position;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;

/**
 * Turns ordered ranks into coordinates. Ranks are stacked top to bottom, each row as tall
 * as its tallest node plus {@code rankGap}. Inside a row nodes are laid left to right with
 * {@code nodeGap} between boxes and the row is centred on x = 0.
 */
public class PositionCalculator {

    private final double rankGap;
    private final double nodeGap;
    private final DimensionResolver dimensionResolver;

    public PositionCalculator(double rankGap, double nodeGap, DimensionResolver dimensionResolver) {
        this.rankGap = rankGap;
        this.nodeGap = nodeGap;
        this.dimensionResolver = dimensionResolver;
    }

    public Map<NodeId, Position> place(SortedMap<Integer, List<LayoutNode>> rankGroups) {
        Map<NodeId, Position> positions = new LinkedHashMap<>();
        double cumulativeY = 0;

        for (List<LayoutNode> rank : rankGroups.values()) {
            if (rank.isEmpty()) continue;

            double totalWidth = 0;
            double maxHeight = 0;
            for (LayoutNode node : rank) {
                NodeDimensions dims = dimensionResolver.dimensions(node);
                totalWidth += dims.width();
                maxHeight = Math.max(maxHeight, dims.height());
            }
            totalWidth += nodeGap * (rank.size() - 1);

            double x = -totalWidth / 2;
            for (LayoutNode node : rank) {
                positions.put(node.id(), new Position(x, cumulativeY));
                x += dimensionResolver.dimensions(node).width() + nodeGap;
            }

            cumulativeY += maxHeight + rankGap;
        }
        return positions;
    }
}
