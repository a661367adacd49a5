package com.astdump.jackson;

import com.astdump.document.DocumentNode;
import com.astdump.json.DocumentJsonException;
import com.astdump.json.DocumentJsonProvider;
import com.astdump.json.DocumentRenderer;
import com.astdump.json.SerializationIOException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;

import java.io.IOException;
import java.io.Writer;

/**
 * Jackson-based implementation of DocumentJsonProvider.
 */
public class JacksonDocumentJsonProvider implements DocumentJsonProvider {

    public static final String NAME = "Jackson";

    private final DocumentRenderer renderer;

    public JacksonDocumentJsonProvider() {
        this(DocumentJackson.createObjectMapper());
    }

    public JacksonDocumentJsonProvider(ObjectMapper mapper) {
        this.renderer = new JacksonRenderer(mapper);
    }

    @Override
    public DocumentRenderer getRenderer() {
        return renderer;
    }

    @Override
    public String getName() {
        return NAME;
    }

    private static class JacksonRenderer implements DocumentRenderer {
        private final ObjectWriter compact;
        private final ObjectWriter pretty;

        JacksonRenderer(ObjectMapper mapper) {
            this.compact = mapper.writer();
            this.pretty = mapper.writerWithDefaultPrettyPrinter();
        }

        @Override
        public String render(DocumentNode root, boolean prettyPrint) throws DocumentJsonException {
            try {
                return writerFor(prettyPrint).writeValueAsString(root);
            } catch (JsonProcessingException e) {
                throw new DocumentJsonException("Failed to render document " + root.kind(), e);
            }
        }

        @Override
        public void write(DocumentNode root, boolean prettyPrint, Writer sink) throws DocumentJsonException {
            try {
                writerFor(prettyPrint).writeValue(sink, root);
                sink.flush();
            } catch (JsonProcessingException e) {
                throw new DocumentJsonException("Failed to render document " + root.kind(), e);
            } catch (IOException e) {
                throw new SerializationIOException("Failed to write document " + root.kind(), e);
            }
        }

        private ObjectWriter writerFor(boolean prettyPrint) {
            return prettyPrint ? pretty : compact;
        }
    }
}
