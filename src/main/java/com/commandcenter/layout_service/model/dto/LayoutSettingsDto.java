package com.commandcenter.layout_service.model.dto;

import java.util.Map;

/** Response for GET /api/layout/settings. */
public record LayoutSettingsDto(
    double rankGap,
    double nodeGap,
    Map<String, BoxDto> dimensions,
    BoxDto defaultDimensions,
    int maxNodes,
    int maxEdges,
    String cyclePolicy,
    int crossingSweeps
) {
    public record BoxDto(double width, double height) {}
}
