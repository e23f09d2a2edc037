package com.commandcenter.layout_service.model.dto;

import java.util.Map;

/**
 * Incoming node. {@code kind} is a loose string (the canvas sends "decision", "fileGroup")
 * and {@code data} is whatever the renderer attached; it is echoed back untouched.
 */
public record LayoutNodeDto(
    String id,
    String kind,
    Map<String, Object> data
) {}
