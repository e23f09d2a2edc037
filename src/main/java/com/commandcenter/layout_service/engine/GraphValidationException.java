package com.commandcenter.layout_service.engine;

public class GraphValidationException extends LayoutException {

    public GraphValidationException(String message) {
        super(message);
    }
}
