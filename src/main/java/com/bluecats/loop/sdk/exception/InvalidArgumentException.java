package com.bluecats.loop.sdk.exception;

/** Thrown when a required argument is missing or unusable. No request is sent. */
public class InvalidArgumentException extends LoopException {
    private final String argument;

    public InvalidArgumentException(String argument) {
        super(argument + " must not be null", 0, "INVALID_ARGUMENT");
        this.argument = argument;
    }

    public InvalidArgumentException(String argument, String message, Throwable cause) {
        super(message, cause, 0, "INVALID_ARGUMENT");
        this.argument = argument;
    }

    public String getArgument() { return argument; }

    /** Returns {@code value} or throws if it is null. */
    public static <T> T requireNonNull(T value, String argument) {
        if (value == null) throw new InvalidArgumentException(argument);
        return value;
    }
}
