package com.bluecats.loop.sdk.exception;

/**
 * Thrown when no response was received: connection refused, timeout,
 * DNS failure or an interrupted send. The transport error is the cause.
 */
public class TransportException extends LoopException {
    public TransportException(String message, Throwable cause) {
        super(message, cause, 0, "TRANSPORT_ERROR");
    }
}
