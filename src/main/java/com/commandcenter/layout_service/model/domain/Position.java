package com.commandcenter.layout_service.model.domain;

// x = left edge of the box, y = top of the rank row
public record Position(double x, double y) {
}
