package com.astdump.jackson;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.StreamWriteConstraints;
import com.fasterxml.jackson.core.StreamWriteFeature;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Factory for creating properly configured ObjectMapper instances for document serialization.
 *
 * Usage:
 * <pre>
 * ObjectMapper mapper = DocumentJackson.createObjectMapper();
 * String json = mapper.writeValueAsString(document);
 * </pre>
 */
public final class DocumentJackson {

    private static final DefaultIndenter INDENTER = new DefaultIndenter("  ", "\n");

    private DocumentJackson() {
        // Utility class
    }

    /**
     * Creates a new ObjectMapper configured for document serialization.
     *
     * The returned mapper:
     * - Writes DocumentNode trees in kind, name, value, children order, omitting absent fields
     * - Accepts any nesting depth; the tree walker already bounds it
     * - Leaves writers it is given open, so callers keep ownership of their sinks
     * - Pretty prints with two-space indentation and LF line endings on every platform
     *
     * @return A new configured ObjectMapper instance
     */
    public static ObjectMapper createObjectMapper() {
        JsonFactory factory = JsonFactory.builder()
            .streamWriteConstraints(StreamWriteConstraints.builder()
                .maxNestingDepth(Integer.MAX_VALUE)
                .build())
            .disable(StreamWriteFeature.AUTO_CLOSE_TARGET)
            .build();

        ObjectMapper mapper = new ObjectMapper(factory);
        mapper.registerModule(new DocumentModule());
        mapper.setDefaultPrettyPrinter(createPrettyPrinter());
        return mapper;
    }

    /**
     * Pretty printer placing every object field and array element on its own line.
     */
    public static DefaultPrettyPrinter createPrettyPrinter() {
        DefaultPrettyPrinter printer = new DefaultPrettyPrinter();
        printer.indentObjectsWith(INDENTER);
        printer.indentArraysWith(INDENTER);
        return printer;
    }
}
