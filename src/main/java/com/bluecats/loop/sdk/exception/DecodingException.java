package com.bluecats.loop.sdk.exception;

/** Thrown when a successful response body cannot be parsed. */
public class DecodingException extends LoopException {
    public DecodingException(String message, Throwable cause, int status) {
        super(message, cause, status, "DECODING_ERROR");
    }
}
