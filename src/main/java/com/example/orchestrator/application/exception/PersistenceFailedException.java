package com.example.orchestrator.application.exception;

/**
 * Thrown when the pending order could not be inserted into the order store.
 * No payment has been attempted at this point.
 */
public class PersistenceFailedException extends RuntimeException {

    public PersistenceFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
