package com.astdump.token;

import com.astdump.syntax.SourceSpan;

/**
 * A lexical unit read from a source span, with its exact source spelling.
 */
public record Token(TokenKind kind, String spelling, SourceSpan span) {
}
