package com.astdump.json;

/**
 * Exception thrown when a document tree cannot be rendered or written as JSON.
 */
public class DocumentJsonException extends RuntimeException {

    public DocumentJsonException(String message) {
        super(message);
    }

    public DocumentJsonException(String message, Throwable cause) {
        super(message, cause);
    }
}
