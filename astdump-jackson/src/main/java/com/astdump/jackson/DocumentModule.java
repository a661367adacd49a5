package com.astdump.jackson;

import com.astdump.document.DocumentNode;
import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.module.SimpleModule;

/**
 * Jackson module that registers the document tree serializer.
 */
public class DocumentModule extends SimpleModule {

    public DocumentModule() {
        super("DocumentModule", new Version(1, 0, 0, null, "com.astdump", "astdump-jackson"));
        addSerializer(DocumentNode.class, new DocumentNodeSerializer());
    }
}
