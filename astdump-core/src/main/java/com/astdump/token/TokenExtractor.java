package com.astdump.token;

import com.astdump.syntax.InvalidSpanException;
import com.astdump.syntax.SourceSpan;

import java.util.Optional;

/**
 * Reads the literal spelling of the first token inside a node's source span.
 */
@FunctionalInterface
public interface TokenExtractor {

    /**
     * Tokenizes only {@code span} and returns the spelling of its first token.
     *
     * @param span the span of a single syntax node
     * @return the first token's spelling, or empty if the span holds no tokens
     * @throws InvalidSpanException if the span does not address the source text
     */
    Optional<String> extractFirstTokenSpelling(SourceSpan span) throws InvalidSpanException;

    /**
     * Extractor for trees that carry no source text. Never yields a token.
     */
    static TokenExtractor none() {
        return span -> Optional.empty();
    }
}
