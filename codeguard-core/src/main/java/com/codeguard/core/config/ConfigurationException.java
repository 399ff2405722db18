package com.codeguard.core.config;

/**
 * Raised when a run cannot start because its configuration is unusable.
 *
 * <p>Covers an empty file catalog, an empty or entirely unknown analyzer set, and
 * out-of-range numeric settings. Always thrown before any task is scheduled.</p>
 *
 * @since 1.0.0
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
