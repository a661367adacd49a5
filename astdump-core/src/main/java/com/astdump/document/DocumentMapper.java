package com.astdump.document;

import java.util.List;
import java.util.Optional;

/**
 * Builds the document for a single syntax node once all of its children have been built.
 */
public final class DocumentMapper {

    private DocumentMapper() {
        // Utility class
    }

    /**
     * Maps one node. {@code kind} and {@code name} are copied verbatim, the value is set only when a
     * literal was extracted, and children are kept only when there is at least one, in the given order.
     */
    public static DocumentNode buildDocument(String kind, String name, Optional<String> literalValue,
                                             List<DocumentNode> children) {
        return new DocumentNode(kind, name, literalValue.orElse(null), children);
    }
}
