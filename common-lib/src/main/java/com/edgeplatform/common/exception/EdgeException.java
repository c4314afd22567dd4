package com.edgeplatform.common.exception;

public class EdgeException extends RuntimeException {
    private final String component;

    public EdgeException(String component, String message) {
        super("[" + component + "] " + message);
        this.component = component;
    }

    public EdgeException(String component, String message, Throwable cause) {
        super("[" + component + "] " + message, cause);
        this.component = component;
    }

    public String getComponent() {
        return component;
    }
}
