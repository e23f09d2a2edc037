package com.commandcenter.layout_service.model.domain;

import java.util.Objects;

/** A node as the layout engine sees it: only its identity and the kind that sizes its box. */
public record LayoutNode(NodeId id, NodeKind kind) {

    public LayoutNode {
        Objects.requireNonNull(id, "id");
        kind = kind != null ? kind : NodeKind.UNKNOWN;
    }

    public static LayoutNode of(String id, NodeKind kind) {
        return new LayoutNode(NodeId.of(id), kind);
    }
}
