package com.astdump.walk;

import java.util.Set;

/**
 * Settings for one serialization run.
 *
 * @param literalKinds node kinds whose first source token is copied into the {@code value} field
 * @param maxDepth     deepest nesting the walker accepts; the root is at depth 1
 */
public record SerializationOptions(Set<String> literalKinds, int maxDepth) {

    public static final String INTEGER_LITERAL = "IntegerLiteral";
    public static final int DEFAULT_MAX_DEPTH = 100_000;

    public SerializationOptions {
        literalKinds = Set.copyOf(literalKinds);
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be at least 1, got " + maxDepth);
        }
    }

    public static SerializationOptions defaults() {
        return new SerializationOptions(Set.of(INTEGER_LITERAL), DEFAULT_MAX_DEPTH);
    }

    public SerializationOptions withLiteralKinds(Set<String> kinds) {
        return new SerializationOptions(kinds, maxDepth);
    }

    public SerializationOptions withMaxDepth(int depth) {
        return new SerializationOptions(literalKinds, depth);
    }

    public boolean isLiteralKind(String kind) {
        return literalKinds.contains(kind);
    }
}
