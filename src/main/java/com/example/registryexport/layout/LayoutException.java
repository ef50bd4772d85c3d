package com.example.registryexport.layout;

/**
 * Thrown when a {@link FieldLayout} or a codec built on it is configured
 * inconsistently. Raised at construction time only, never while records are
 * being encoded or decoded.
 */
public class LayoutException extends RuntimeException {

    public LayoutException(String message) {
        super("Invalid layout: " + message);
    }
}
