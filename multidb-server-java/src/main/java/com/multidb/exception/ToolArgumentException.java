package com.multidb.exception;

/**
 * A tool was invoked with a missing or malformed argument.
 */
public class ToolArgumentException extends RuntimeException {

    public ToolArgumentException(String message) {
        super(message);
    }
}
