package com.commandcenter.layout_service.model.dto;

import java.util.List;

/** Response for POST /api/layout: nodes in request order with positions, edges unchanged. */
public record LayoutResponseDto(
    List<PositionedNodeDto> nodes,
    List<LayoutEdgeDto> edges,
    int rankCount,
    double width,
    double height
) {}
