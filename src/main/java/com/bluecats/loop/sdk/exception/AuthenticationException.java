package com.bluecats.loop.sdk.exception;

/**
 * Thrown when the login request succeeded at the HTTP level but the
 * response did not carry a usable auth token.
 */
public class AuthenticationException extends LoopException {
    public AuthenticationException(String message, int status) {
        super(message, status, "AUTHENTICATION_ERROR");
    }
    public AuthenticationException(int status) {
        this("Received an empty auth token", status);
    }
}
