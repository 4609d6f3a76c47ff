package com.adaptivesentinel.core.window;

/**
 * Thrown when statistics are requested from a window that holds no points.
 *
 * @since 1.0.0
 */
public class EmptyWindowException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public EmptyWindowException(String message) {
        super(message);
    }
}
