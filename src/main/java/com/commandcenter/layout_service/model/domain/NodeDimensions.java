package com.commandcenter.layout_service.model.domain;

public record NodeDimensions(double width, double height) {

    public NodeDimensions {
        if (!(width > 0) || !(height > 0)) {
            throw new IllegalArgumentException("Node dimensions must be positive, got " + width + "x" + height);
        }
    }
}
