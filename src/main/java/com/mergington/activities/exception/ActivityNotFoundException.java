package com.mergington.activities.exception;

/**
 * Exception thrown when the named activity is not in the catalog.
 */
public class ActivityNotFoundException extends RuntimeException {

    public ActivityNotFoundException(String message) {
        super(message);
    }

    public ActivityNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
