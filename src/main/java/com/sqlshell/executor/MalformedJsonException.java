package com.sqlshell.executor;

/**
 * MalformedJsonException - JSON模式下首列不是合法JSON
 */
public class MalformedJsonException extends RuntimeException {

    public MalformedJsonException(String message) {
        super(message);
    }

    public MalformedJsonException(String message, Throwable cause) {
        super(message, cause);
    }
}
