package com.di.execmaps.error;

import org.springframework.dao.TransientDataAccessException;

/**
 * Thrown when the caller cancelled the {@link com.di.execmaps.driver.OperationContext}
 * before its statement could run.
 */
public class OperationCancelledException extends TransientDataAccessException {

    public OperationCancelledException(String message) {
        super(message);
    }
}
