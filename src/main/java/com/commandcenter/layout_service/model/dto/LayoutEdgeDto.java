package com.commandcenter.layout_service.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

/** Incoming edge. Returned exactly as received; only source and target matter to layout. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LayoutEdgeDto(
    String id,
    String source,
    String target,
    Map<String, Object> data
) {}
