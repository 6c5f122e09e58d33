package com.mergington.activities.exception;

/**
 * Exception thrown when attempting to sign up for an activity
 * that has reached its maximum number of participants.
 * Mapped to 409 Conflict by BaseController.
 */
public class CapacityExceededException extends RuntimeException {

    public CapacityExceededException(String message) {
        super(message);
    }

    public CapacityExceededException(String message, Throwable cause) {
        super(message, cause);
    }
}
