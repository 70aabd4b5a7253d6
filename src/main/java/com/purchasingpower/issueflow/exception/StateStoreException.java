package com.purchasingpower.issueflow.exception;

/**
 * A persisted workflow record could not be read or written.
 * Corrupt records surface as this error instead of resetting progress.
 */
public class StateStoreException extends RuntimeException {

    public StateStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
