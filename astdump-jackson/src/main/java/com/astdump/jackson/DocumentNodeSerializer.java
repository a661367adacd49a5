package com.astdump.jackson;

import com.astdump.document.DocumentNode;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;

/**
 * Writes a document tree as nested JSON objects.
 *
 * <p>Target format, fields in this order:
 * {@code {"kind": ..., "name": ..., "value": ..., "children": [...]}} where {@code value} and
 * {@code children} are only written when present.</p>
 *
 * <p>The tree is written with an explicit stack of open child lists instead of recursing into
 * {@link JsonGenerator#writeObject(Object)}, so depth is not limited by the thread stack.</p>
 */
public class DocumentNodeSerializer extends StdSerializer<DocumentNode> {

    public static final String KIND = "kind";
    public static final String NAME = "name";
    public static final String VALUE = "value";
    public static final String CHILDREN = "children";

    public DocumentNodeSerializer() {
        super(DocumentNode.class);
    }

    @Override
    public void serialize(DocumentNode root, JsonGenerator gen, SerializerProvider provider) throws IOException {
        Deque<Iterator<DocumentNode>> openChildren = new ArrayDeque<>();
        writeNode(root, gen, openChildren);

        while (!openChildren.isEmpty()) {
            Iterator<DocumentNode> siblings = openChildren.peek();
            if (siblings.hasNext()) {
                writeNode(siblings.next(), gen, openChildren);
            } else {
                openChildren.pop();
                gen.writeEndArray();
                gen.writeEndObject();
            }
        }
    }

    // Writes the node's scalar fields; a node with children is left open with its children array started
    private static void writeNode(DocumentNode node, JsonGenerator gen, Deque<Iterator<DocumentNode>> openChildren)
        throws IOException {
        gen.writeStartObject();
        gen.writeStringField(KIND, node.kind());
        gen.writeStringField(NAME, node.name());
        if (node.hasValue()) {
            // literal spelling stays a string: 0x1F, 10UL etc. are not JSON numbers
            gen.writeStringField(VALUE, node.value());
        }
        if (node.hasChildren()) {
            gen.writeArrayFieldStart(CHILDREN);
            openChildren.push(node.children().iterator());
        } else {
            gen.writeEndObject();
        }
    }
}
