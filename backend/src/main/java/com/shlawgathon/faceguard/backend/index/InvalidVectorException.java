package com.shlawgathon.faceguard.backend.index;

/**
 * Thrown when a vector carries a NaN or infinite component.
 */
public class InvalidVectorException extends IllegalArgumentException {

    private final int component;

    public InvalidVectorException(int component, float value) {
        super("Vector component " + component + " is not a finite number: " + value);
        this.component = component;
    }

    public int getComponent() {
        return component;
    }
}
