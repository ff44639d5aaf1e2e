package work.lcod.converter.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AccessDeniedException;
import org.junit.jupiter.api.Test;

class ShortErrorHandlerTest {
    @Test
    void tagsRejectedSettings() {
        assertEquals(
            "Configuration error: Unsupported log level: verbose",
            ShortErrorHandler.describe(new IllegalArgumentException("Unsupported log level: verbose"))
        );
    }

    @Test
    void tagsFileSystemFailures() {
        assertEquals(
            "I/O error: /tmp/out.py (AccessDeniedException)",
            ShortErrorHandler.describe(new AccessDeniedException("/tmp/out.py"))
        );
        assertEquals(
            "I/O error: disk full (IOException)",
            ShortErrorHandler.describe(new UncheckedIOException("write failed", new IOException("disk full")))
        );
        assertEquals(
            "I/O error: Failed to read settings: a.toml (IOException)",
            ShortErrorHandler.describe(new IllegalStateException("Failed to read settings: a.toml", new IOException()))
        );
    }

    @Test
    void fallsBackToExceptionName() {
        assertEquals("IllegalStateException", ShortErrorHandler.describe(new IllegalStateException()));
        assertEquals("No workflow parsed", ShortErrorHandler.describe(new IllegalStateException("No workflow parsed")));
    }
}
