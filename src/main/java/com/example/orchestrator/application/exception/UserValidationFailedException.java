package com.example.orchestrator.application.exception;

import com.example.orchestrator.domain.model.UserId;

/**
 * Thrown when the referenced user is unknown to the user directory or the
 * directory cannot be reached. No order has been persisted at this point.
 */
public class UserValidationFailedException extends RuntimeException {

    private final UserId userId;

    public UserValidationFailedException(UserId userId, String message) {
        super(message);
        this.userId = userId;
    }

    public UserValidationFailedException(UserId userId, String message, Throwable cause) {
        super(message, cause);
        this.userId = userId;
    }

    public UserId getUserId() {
        return userId;
    }
}
