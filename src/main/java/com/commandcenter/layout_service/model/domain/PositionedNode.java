package com.commandcenter.layout_service.model.domain;

/**
 * A node after layout.
 *
 * @param rank  layer index, 0 at the top
 * @param order left-to-right index within the rank after crossing reduction
 */
public record PositionedNode(LayoutNode node, int rank, int order, NodeDimensions dimensions, Position position) {

    public NodeId id() {
        return node.id();
    }

    public double right() {
        return position.x() + dimensions.width();
    }

    public double bottom() {
        return position.y() + dimensions.height();
    }
}
