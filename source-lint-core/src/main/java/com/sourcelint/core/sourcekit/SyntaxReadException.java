package com.sourcelint.core.sourcekit;

/**
 * Thrown when a structure or syntax-map dump cannot be read.
 */
public class SyntaxReadException extends Exception {

    public SyntaxReadException(String message) {
        super(message);
    }

    public SyntaxReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
