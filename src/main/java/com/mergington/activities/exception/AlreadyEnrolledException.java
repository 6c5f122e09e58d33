package com.mergington.activities.exception;

/**
 * Exception thrown when a participant tries to sign up for an activity they are already on.
 */
public class AlreadyEnrolledException extends RuntimeException {

    public AlreadyEnrolledException(String message) {
        super(message);
    }

    public AlreadyEnrolledException(String message, Throwable cause) {
        super(message, cause);
    }
}
