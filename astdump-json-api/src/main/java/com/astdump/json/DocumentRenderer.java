package com.astdump.json;

import com.astdump.document.DocumentNode;

import java.io.Writer;
import java.nio.file.Path;

/**
 * Interface for rendering document trees as JSON.
 *
 * <p>The root document is the only top-level value. Fields appear in the order {@code kind},
 * {@code name}, {@code value}, {@code children}; absent fields are left out entirely and literal
 * values are always JSON strings.</p>
 */
public interface DocumentRenderer {

    /**
     * Renders a document tree to a JSON string.
     *
     * <p>Pretty output indents every level, so its size grows with the square of the tree depth and a
     * very deep tree does not fit in one string. Use compact mode, or stream with {@link #write} or
     * {@link #writeFile}, for trees thousands of levels deep.</p>
     *
     * @param root   the root document
     * @param pretty whether to indent the output
     * @return the JSON text
     * @throws DocumentJsonException if rendering fails
     */
    String render(DocumentNode root, boolean pretty) throws DocumentJsonException;

    /**
     * Streams a document tree to a caller-owned sink. The sink is flushed but not closed.
     *
     * @throws SerializationIOException if the sink fails
     */
    void write(DocumentNode root, boolean pretty, Writer sink) throws DocumentJsonException;

    /**
     * Writes a document tree to {@code target}. The file only appears, or is only replaced, once the
     * whole document has been written.
     *
     * @throws SerializationIOException if the file cannot be written
     */
    default void writeFile(DocumentNode root, boolean pretty, Path target) throws DocumentJsonException {
        DocumentFiles.writeAtomically(target, writer -> write(root, pretty, writer));
    }
}
