package com.commandcenter.layout_service.model.domain;

import java.util.Objects;

/**
 * Directed relation between two node ids. Endpoints are not required to exist in the
 * node set of the call; edges pointing at unknown ids are ignored by the engine.
 */
public record LayoutEdge(NodeId source, NodeId target) {

    public LayoutEdge {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(target, "target");
    }

    public static LayoutEdge of(String source, String target) {
        return new LayoutEdge(NodeId.of(source), NodeId.of(target));
    }
}
