package com.commandcenter.layout_service.model.dto;

import java.util.Collections;
import java.util.List;

/**
 * Request body for POST /api/layout.
 * Null-safe: null lists are treated as empty.
 */
public record LayoutRequestDto(
    List<LayoutNodeDto> nodes,
    List<LayoutEdgeDto> edges
) {
    public List<LayoutNodeDto> nodes() {
        return nodes != null ? nodes : Collections.emptyList();
    }

    public List<LayoutEdgeDto> edges() {
        return edges != null ? edges : Collections.emptyList();
    }
}
