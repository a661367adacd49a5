package com.astdump.json;

import java.io.IOException;

/**
 * Thrown when rendered JSON cannot be written to its sink. Whatever reached the sink before the failure
 * must not be treated as a complete document.
 */
public class SerializationIOException extends DocumentJsonException {

    public SerializationIOException(String message, IOException cause) {
        super(message, cause);
    }

    @Override
    public synchronized IOException getCause() {
        return (IOException) super.getCause();
    }
}
