package com.bluecats.loop.sdk.exception;

/**
 * Base exception for all Loop SDK errors.
 */
public class LoopException extends RuntimeException {
    private final int status;
    private final String code;

    public LoopException(String message, int status, String code) {
        super(message);
        this.status = status;
        this.code = code;
    }

    public LoopException(String message, Throwable cause, int status, String code) {
        super(message, cause);
        this.status = status;
        this.code = code;
    }

    /** HTTP status associated with the failure, or 0 when no response was involved. */
    public int getStatus() { return status; }
    public String getCode() { return code; }
}
