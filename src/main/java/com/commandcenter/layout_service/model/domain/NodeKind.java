package com.commandcenter.layout_service.model.domain;

import java.util.Locale;

public enum NodeKind {
    AGENT,       // plain agent instance card
    DECISION,    // agent card with routing decisions (the canvas default)
    FILE_GROUP,  // orchestrator file batch sitting between orchestrator and domain agents
    UNKNOWN;     // anything the renderer sent that we do not recognise

    /**
     * Lenient wire parsing: "fileGroup", "file-group" and "FILE_GROUP" are the same kind.
     * Null, blank or unrecognised values map to {@link #UNKNOWN}.
     */
    public static NodeKind fromWire(String value) {
        NodeKind kind = match(value);
        return kind != null ? kind : UNKNOWN;
    }

    /** Same spelling rules as {@link #fromWire} but refuses values that name no kind. */
    public static NodeKind parseStrict(String value) {
        NodeKind kind = match(value);
        if (kind == null) {
            throw new IllegalArgumentException("Unknown node kind: " + value);
        }
        return kind;
    }

    private static NodeKind match(String value) {
        if (value == null || value.isBlank()) return null;
        String wanted = normalize(value);
        for (NodeKind kind : values()) {
            if (normalize(kind.name()).equals(wanted)) {
                return kind;
            }
        }
        return null;
    }

    private static String normalize(String value) {
        return value.replaceAll("[^A-Za-z0-9]", "").toUpperCase(Locale.ROOT);
    }
}
