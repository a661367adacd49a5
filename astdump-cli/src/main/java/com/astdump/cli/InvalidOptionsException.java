package com.astdump.cli;

import com.astdump.AstDumpException;

/**
 * Thrown when configuration values or command-line options cannot be used.
 */
public class InvalidOptionsException extends AstDumpException {

    public InvalidOptionsException(String message) {
        super(message);
    }

    public InvalidOptionsException(String message, Throwable cause) {
        super(message, cause);
    }
}
