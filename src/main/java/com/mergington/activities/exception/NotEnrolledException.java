package com.mergington.activities.exception;

/**
 * Exception thrown when removing a participant who is not on the activity roster.
 */
public class NotEnrolledException extends RuntimeException {

    public NotEnrolledException(String message) {
        super(message);
    }

    public NotEnrolledException(String message, Throwable cause) {
        super(message, cause);
    }
}
