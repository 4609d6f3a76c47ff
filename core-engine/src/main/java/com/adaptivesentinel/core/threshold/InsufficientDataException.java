package com.adaptivesentinel.core.threshold;

/**
 * Thrown when a candidate threshold cannot be computed because the short or
 * the long window of a metric is still empty.
 *
 * <p>
 * Recoverable: the cycle is skipped and the committed threshold stands.
 * </p>
 *
 * @since 1.0.0
 */
public class InsufficientDataException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public InsufficientDataException(String message) {
        super(message);
    }
}
