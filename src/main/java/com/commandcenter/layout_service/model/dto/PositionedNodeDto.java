package com.commandcenter.layout_service.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record PositionedNodeDto(
    String id,
    String kind,
    Map<String, Object> data,
    int rank,
    PositionDto position,
    double width,
    double height
) {
    public record PositionDto(double x, double y) {}
}
