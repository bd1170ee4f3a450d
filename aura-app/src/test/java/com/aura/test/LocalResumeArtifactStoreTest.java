package com.aura.test;

import com.aura.infrastructure.document.LocalResumeArtifactStore;
import com.aura.infrastructure.document.ScreeningStorageProperties;
import com.aura.types.enums.ResponseCode;
import com.aura.types.exception.AppException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

public class LocalResumeArtifactStoreTest {

    @TempDir
    Path tempDir;

    private LocalResumeArtifactStore store;

    @BeforeEach
    public void setUp() {
        ScreeningStorageProperties properties = new ScreeningStorageProperties();
        properties.setDirectory(tempDir.resolve("uploads").toString());
        this.store = new LocalResumeArtifactStore(properties);
    }

    @Test
    public void shouldStoreUnderUniqueName() throws IOException {
        byte[] content = "%PDF-1.4".getBytes(StandardCharsets.UTF_8);

        String first = store.store(content, "cv.pdf");
        String second = store.store(content, "cv.pdf");

        Assertions.assertNotEquals(first, second);
        Assertions.assertTrue(first.startsWith("resume_"));
        Assertions.assertTrue(first.endsWith(".pdf"));
        Path path = store.resolve(first);
        Assertions.assertTrue(path.startsWith(store.getRoot()));
        Assertions.assertArrayEquals(content, Files.readAllBytes(path));
    }

    @Test
    public void shouldRejectEmptyContent() {
        AppException ex = Assertions.assertThrows(AppException.class, () -> store.store(new byte[0], "cv.pdf"));
        Assertions.assertTrue(ex.is(ResponseCode.ILLEGAL_PARAMETER));
    }

    @Test
    public void shouldRejectReferenceEscapingRoot() {
        AppException ex = Assertions.assertThrows(AppException.class, () -> store.resolve("../secret.pdf"));
        Assertions.assertTrue(ex.is(ResponseCode.ILLEGAL_PARAMETER));
    }

    @Test
    public void shouldReleaseFileAndTolerateMissingFile() {
        String ref = store.store("%PDF-1.4".getBytes(StandardCharsets.UTF_8), "cv.pdf");
        Path path = store.resolve(ref);

        store.release(ref);
        Assertions.assertFalse(Files.exists(path));

        Assertions.assertDoesNotThrow(() -> store.release(ref));
        Assertions.assertDoesNotThrow(() -> store.release("../outside.pdf"));
        Assertions.assertDoesNotThrow(() -> store.release(null));
    }
}
