package com.commandcenter.layout_service.engine;

public enum CyclePolicy {
    FALLBACK,  // nodes stuck behind a cycle are placed at rank 0
    REJECT     // nodes stuck behind a cycle fail the call
}
