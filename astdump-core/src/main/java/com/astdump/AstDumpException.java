package com.astdump;

/**
 * Base class for failures raised while turning a syntax tree into a document.
 */
public class AstDumpException extends RuntimeException {

    public AstDumpException(String message) {
        super(message);
    }

    public AstDumpException(String message, Throwable cause) {
        super(message, cause);
    }
}
