package org.suiteflow.browser;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class BrowserKindTest {

    @Test
    void fromName_KnownNamesIgnoringCase() {
        assertEquals(BrowserKind.FIREFOX, BrowserKind.fromName("Firefox"));
        assertEquals(BrowserKind.WEBKIT, BrowserKind.fromName(" webkit "));
        assertEquals(BrowserKind.CHROMIUM, BrowserKind.fromName("CHROME"));
        assertEquals(BrowserKind.CHROMIUM, BrowserKind.fromName("chromium"));
    }

    @Test
    void fromName_MissingName_DefaultsToChromium() {
        assertEquals(BrowserKind.CHROMIUM, BrowserKind.fromName(null));
        assertEquals(BrowserKind.CHROMIUM, BrowserKind.fromName(""));
    }

    @Test
    void fromName_Unknown_Throws() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> BrowserKind.fromName("opera"));
        assertTrue(e.getMessage().contains("opera"));
    }
}
