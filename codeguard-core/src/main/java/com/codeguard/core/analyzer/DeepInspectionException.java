package com.codeguard.core.analyzer;

/**
 * Raised by a {@link DeepInspector} when the deep inspection back end fails or returns
 * something that cannot be interpreted.
 *
 * @since 1.0.0
 */
public class DeepInspectionException extends Exception {

    public DeepInspectionException(String message) {
        super(message);
    }

    public DeepInspectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
