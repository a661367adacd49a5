package com.astdump.javaparser;

import com.astdump.syntax.SourceText;
import com.astdump.token.SourceTokenExtractor;
import com.astdump.token.TokenExtractor;

/**
 * A successfully parsed compilation unit together with the text it came from.
 */
public record ParsedUnit(SourceText source, JavaSyntaxNode root) {

    /**
     * Extractor reading literal tokens from this unit's source text.
     */
    public TokenExtractor tokenExtractor() {
        return new SourceTokenExtractor(source);
    }
}
