package com.astdump.syntax;

import com.astdump.AstDumpException;

/**
 * Thrown when a source span does not address a valid range of its source text.
 * Callers extracting literal values treat this the same as a span without tokens.
 */
public class InvalidSpanException extends AstDumpException {

    private final SourceSpan span;

    public InvalidSpanException(SourceSpan span, String message) {
        super(message);
        this.span = span;
    }

    public SourceSpan getSpan() {
        return span;
    }
}
