package com.di.execmaps.error;

import org.springframework.dao.NonTransientDataAccessException;

/**
 * Thrown when a variable-length key set cannot be expanded into bound {@code IN (...)}
 * parameters. Always raised before any statement reaches the backend.
 */
public class ParameterExpansionException extends NonTransientDataAccessException {

    public ParameterExpansionException(String message) {
        super(message);
    }

    public ParameterExpansionException(String message, Throwable cause) {
        super(message, cause);
    }
}
