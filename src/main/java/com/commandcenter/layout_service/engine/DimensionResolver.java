package com.commandcenter.layout_service.engine;

import com.commandcenter.layout_service.model.domain.LayoutNode;
import com.commandcenter.layout_service.model.domain.NodeDimensions;
import com.commandcenter.layout_service.model.domain.NodeKind;

import java.util.EnumMap;
import java.util.Map;

/**
 * Maps a node kind to the fixed box the renderer draws for it. Every kind resolves:
 * kinds without a table entry get the default box.
 */
public class DimensionResolver {

    private final Map<NodeKind, NodeDimensions> table = new EnumMap<>(NodeKind.class);
    private final NodeDimensions defaultDimensions;

    public DimensionResolver(Map<NodeKind, NodeDimensions> table, NodeDimensions defaultDimensions) {
        this.table.putAll(table);
        this.defaultDimensions = defaultDimensions;
    }

    public static DimensionResolver from(LayoutSettings settings) {
        return new DimensionResolver(settings.dimensions(), settings.defaultDimensions());
    }

    public NodeDimensions dimensions(NodeKind kind) {
        NodeDimensions dimensions = kind != null ? table.get(kind) : null;
        return dimensions != null ? dimensions : defaultDimensions;
    }

    public NodeDimensions dimensions(LayoutNode node) {
        return dimensions(node.kind());
    }
}
