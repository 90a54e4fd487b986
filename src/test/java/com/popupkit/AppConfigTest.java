package com.popupkit;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AppConfigTest {

    @Test
    void parsesFlags() {
        AppConfig.Builder builder = new AppConfig.Builder()
            .parseArgs(new String[]{"--port", "9100", "--dev", "--inject-other"});
        assertEquals(9100, builder.getPreferredPort());
        assertTrue(builder.isDevMode());
        assertTrue(builder.isInjectOther());
    }

    @Test
    void equalsFormAndBadValues() {
        AppConfig.Builder builder = new AppConfig.Builder().parseArgs(new String[]{"--port=9200"});
        assertEquals(9200, builder.getPreferredPort());
        assertFalse(builder.isDevMode());

        builder = new AppConfig.Builder().port(9300).parseArgs(new String[]{"--port=abc"});
        assertEquals(9300, builder.getPreferredPort());

        builder = new AppConfig.Builder().port(9300).parseArgs(new String[]{"--port", "70000"});
        assertEquals(9300, builder.getPreferredPort());
    }

    @Test
    void logDirectoryIsNamedAfterApp() {
        assertTrue(AppConfig.getLogDirectory().toString().contains("popup-kit"));
        assertEquals("popup-kit.log", AppConfig.getLogFilePath().getFileName().toString());
    }
}
