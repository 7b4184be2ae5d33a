package org.suiteflow.hooks;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.suiteflow.browser.BrowserSession;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TakeScreenshotsTest {

    @Mock
    private BrowserSession session;

    @TempDir
    Path tempDir;

    @Test
    void captureScreenshot_WritesPngIntoDirectory() throws Exception {
        byte[] png = {(byte) 0x89, 'P', 'N', 'G'};
        when(session.screenshot()).thenReturn(png);
        Path dir = tempDir.resolve("run-1").resolve("screenshots");

        Optional<Path> path = TakeScreenshots.captureScreenshot(session, "Open chat / send", dir);

        assertTrue(path.isPresent());
        assertTrue(path.get().startsWith(dir));
        assertTrue(path.get().getFileName().toString().startsWith("failure-Open_chat_send_"));
        assertTrue(path.get().getFileName().toString().endsWith(".png"));
        assertArrayEquals(png, Files.readAllBytes(path.get()));
    }

    @Test
    void captureScreenshot_ClosedPage_ReturnsEmpty() {
        when(session.isClosed()).thenReturn(true);

        assertTrue(TakeScreenshots.captureScreenshot(session, "a", tempDir).isEmpty());
        verify(session, never()).screenshot();
    }

    @Test
    void captureScreenshot_NoSession_ReturnsEmpty() {
        assertTrue(TakeScreenshots.captureScreenshot(null, "a", tempDir).isEmpty());
    }

    @Test
    void captureScreenshot_Failure_IsSwallowedAsEmpty() {
        when(session.screenshot()).thenThrow(new IllegalStateException("Target closed"));

        assertTrue(TakeScreenshots.captureScreenshot(session, "a", tempDir).isEmpty());
    }

    @Test
    void sanitize_ReplacesUnsafeCharacters() {
        assertEquals("login_as_admin", TakeScreenshots.sanitize("login as admin"));
        assertEquals("a_b.c-d", TakeScreenshots.sanitize("a/b.c-d"));
        assertEquals("test", TakeScreenshots.sanitize(""));
        assertEquals("test", TakeScreenshots.sanitize(null));
    }
}
