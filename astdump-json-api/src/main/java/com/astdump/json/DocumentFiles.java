package com.astdump.json;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Writes output files through a temporary sibling so a failed run never leaves a truncated document
 * at the target path.
 */
public final class DocumentFiles {

    private DocumentFiles() {
        // Utility class
    }

    @FunctionalInterface
    public interface WriterAction {
        void writeTo(Writer writer) throws IOException;
    }

    /**
     * Runs {@code action} against a temporary file next to {@code target}, then moves it into place.
     *
     * @throws SerializationIOException if writing or moving fails; the target is left untouched
     */
    public static void writeAtomically(Path target, WriterAction action) {
        Path absolute = target.toAbsolutePath();
        Path directory = absolute.getParent();
        Path temp = null;
        try {
            if (directory != null) {
                Files.createDirectories(directory);
            }
            temp = Files.createTempFile(directory, absolute.getFileName() + ".", ".tmp");
            try (Writer writer = Files.newBufferedWriter(temp, StandardCharsets.UTF_8)) {
                action.writeTo(writer);
            }
            moveIntoPlace(temp, absolute);
        } catch (IOException e) {
            deleteQuietly(temp, e);
            throw new SerializationIOException("Failed to write " + target, e);
        } catch (RuntimeException e) {
            deleteQuietly(temp, e);
            throw e;
        }
    }

    private static void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path temp, Exception failure) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            failure.addSuppressed(e);
        }
    }
}
