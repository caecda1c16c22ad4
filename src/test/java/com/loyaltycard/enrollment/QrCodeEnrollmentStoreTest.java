package com.loyaltycard.enrollment;

import com.loyaltycard.common.exception.EnrollmentCodeException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class QrCodeEnrollmentStoreTest {

    private static final byte[] PNG_MAGIC = {(byte) 0x89, 'P', 'N', 'G'};

    @TempDir
    Path tempDir;

    private QrCodeEnrollmentStore store;

    @BeforeEach
    void setUp() {
        store = new QrCodeEnrollmentStore(tempDir.resolve("qrcodes").toString(), 120);
    }

    @Test
    void testStoreWritesPngNamedAfterCustomer() throws IOException {
        String reference = store.store("c-123", "c-123:v-456");

        Path file = Path.of(reference);
        assertTrue(Files.exists(file));
        assertEquals("customer_c-123.png", file.getFileName().toString());
        assertTrue(file.startsWith(store.getDirectory()));

        byte[] header = new byte[PNG_MAGIC.length];
        System.arraycopy(Files.readAllBytes(file), 0, header, 0, header.length);
        assertArrayEquals(PNG_MAGIC, header);
    }

    @Test
    void testRemoveDeletesStoredCode() {
        String reference = store.store("c-1", "c-1:v-1");

        store.remove(reference);

        assertFalse(Files.exists(Path.of(reference)));
        // removing twice is harmless
        assertDoesNotThrow(() -> store.remove(reference));
    }

    @Test
    void testRemoveIgnoresMissingReference() {
        assertDoesNotThrow(() -> store.remove(null));
        assertDoesNotThrow(() -> store.remove(" "));
    }

    @Test
    void testRemoveRefusesPathsOutsideDirectory() throws IOException {
        Path outside = Files.createFile(tempDir.resolve("keep-me.png"));

        assertThrows(EnrollmentCodeException.class, () -> store.remove(outside.toString()));
        assertThrows(EnrollmentCodeException.class,
            () -> store.remove(store.getDirectory().resolve("../keep-me.png").toString()));
        assertTrue(Files.exists(outside));
    }
}
