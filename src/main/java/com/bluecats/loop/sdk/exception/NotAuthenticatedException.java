package com.bluecats.loop.sdk.exception;

/** Thrown when an API call is made before a successful login. */
public class NotAuthenticatedException extends LoopException {
    public NotAuthenticatedException(String message) {
        super(message, 0, "NOT_AUTHENTICATED");
    }
    public NotAuthenticatedException() {
        this("Must login before API request");
    }
}
