package com.astdump.json;

import java.util.List;
import java.util.Optional;
import java.util.ServiceLoader;

/**
 * Source of {@link DocumentRenderer} implementations, discovered with {@link ServiceLoader}.
 *
 * <p>Putting a provider module such as astdump-jackson on the classpath is enough to make it
 * available:</p>
 * <pre>{@code
 * DocumentRenderer renderer = DocumentJsonProvider.getProvider().getRenderer();
 * String json = renderer.render(document, true);
 * }</pre>
 */
public interface DocumentJsonProvider {

    DocumentRenderer getRenderer();

    /**
     * Short provider name used for lookups, e.g. "Jackson".
     */
    String getName();

    /**
     * Returns the first provider on the classpath.
     *
     * @throws IllegalStateException if there is none
     */
    static DocumentJsonProvider getProvider() {
        return ServiceLoader.load(DocumentJsonProvider.class).findFirst()
            .orElseThrow(() -> new IllegalStateException(
                "No DocumentJsonProvider found on the classpath; add astdump-jackson to the dependencies"));
    }

    /**
     * Returns the provider called {@code name}, ignoring case.
     *
     * @throws IllegalStateException if no provider has that name
     */
    static DocumentJsonProvider getProvider(String name) {
        return findProvider(name)
            .orElseThrow(() -> new IllegalStateException(
                "No DocumentJsonProvider named '" + name + "'; available: " + availableNames()));
    }

    static Optional<DocumentJsonProvider> findProvider(String name) {
        return ServiceLoader.load(DocumentJsonProvider.class).stream()
            .map(ServiceLoader.Provider::get)
            .filter(provider -> provider.getName().equalsIgnoreCase(name))
            .findFirst();
    }

    static List<String> availableNames() {
        return ServiceLoader.load(DocumentJsonProvider.class).stream()
            .map(ServiceLoader.Provider::get)
            .map(DocumentJsonProvider::getName)
            .toList();
    }
}
