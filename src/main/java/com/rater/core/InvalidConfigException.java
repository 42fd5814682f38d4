package com.rater.core;

/**
 * Rate limit parameters that cannot be decided on: out of range, or too
 * large to represent in nanoseconds without overflow.
 */
public class InvalidConfigException extends IllegalArgumentException {

    public InvalidConfigException(String message) {
        super(message);
    }

    public InvalidConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
