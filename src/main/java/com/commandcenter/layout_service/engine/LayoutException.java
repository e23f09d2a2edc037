package com.commandcenter.layout_service.engine;

/** Base type for layout failures the caller can fix by sending different input. */
public abstract class LayoutException extends RuntimeException {

    protected LayoutException(String message) {
        super(message);
    }
}
