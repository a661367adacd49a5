package com.astdump.json;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class DocumentJsonProviderTest {

    @Test
    void testNoProviderWithoutImplementationOnClasspath() {
        assertTrue(DocumentJsonProvider.availableNames().isEmpty());
        assertTrue(DocumentJsonProvider.findProvider("Jackson").isEmpty());

        IllegalStateException e = assertThrows(IllegalStateException.class, DocumentJsonProvider::getProvider);
        assertTrue(e.getMessage().contains("astdump-jackson"), e.getMessage());
        assertThrows(IllegalStateException.class, () -> DocumentJsonProvider.getProvider("Jackson"));
    }
}
