package com.astdump.token;

import com.astdump.syntax.InvalidSpanException;
import com.astdump.syntax.SourceSpan;
import com.astdump.syntax.SourceText;

import java.util.Optional;

/**
 * Token extractor over an in-memory source text. Each call lexes only the requested span.
 */
public class SourceTokenExtractor implements TokenExtractor {

    private final SourceText source;

    public SourceTokenExtractor(SourceText source) {
        this.source = source;
    }

    @Override
    public Optional<String> extractFirstTokenSpelling(SourceSpan span) throws InvalidSpanException {
        try (SpanTokenizer tokenizer = SpanTokenizer.open(source, span)) {
            return tokenizer.next().map(Token::spelling);
        }
    }
}
