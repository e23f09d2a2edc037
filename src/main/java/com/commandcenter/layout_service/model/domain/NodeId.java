package com.commandcenter.layout_service.model.domain;

import com.commandcenter.layout_service.engine.GraphValidationException;

/**
 * Identifier of a node within a single layout call. Compared exactly as supplied:
 * "B" and "B " are different nodes.
 */
public record NodeId(String value) {

    public NodeId {
        if (value == null || value.isBlank()) {
            throw new GraphValidationException("Node id must not be null or blank");
        }
    }

    public static NodeId of(String value) {
        return new NodeId(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
