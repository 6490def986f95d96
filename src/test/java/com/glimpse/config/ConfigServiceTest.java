package com.glimpse.config;

import com.glimpse.core.image.ResampleFilter;
import org.json.JSONObject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.awt.Dimension;
import java.nio.file.Path;
import java.util.UUID;
import java.util.prefs.BackingStoreException;
import java.util.prefs.Preferences;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConfigServiceTest {

    private Preferences node;
    private PreferencesStore preferences;

    @BeforeEach
    void createNode() {
        node = Preferences.userRoot().node("glimpse-test-" + UUID.randomUUID());
        preferences = new PreferencesStore(node);
    }

    @AfterEach
    void removeNode() throws BackingStoreException {
        node.removeNode();
        System.clearProperty("glimpse.undo.limit");
    }

    @Test
    void fallsBackToBuiltInValuesWithoutDefaults() {
        ConfigService config = new ConfigService(preferences, new ViewerDefaults(new JSONObject()));

        assertEquals(16, config.cacheMaxEntries());
        assertEquals(512L * 1024 * 1024, config.cacheMaxBytes());
        assertEquals(64, config.undoLimit());
        assertEquals(ResampleFilter.CATMULL_ROM, config.defaultResampleFilter());
        assertEquals(new Dimension(1024, 768), config.windowSize());
        assertTrue(config.lastOpenDirectory().isEmpty());
    }

    @Test
    void bundledDefaultsAreReadFromTheClasspath() {
        ViewerDefaults defaults = ViewerDefaults.bundled();
        assertEquals("64", defaults.get("undo.limit").orElseThrow());
        assertEquals("16", defaults.get("cache.maxEntries").orElseThrow());
        assertTrue(defaults.get("cache").isEmpty(), "objects are not leaf values");
        assertTrue(defaults.get("missing.key").isEmpty());
    }

    @Test
    void missingResourceYieldsEmptyDefaults() {
        assertTrue(ViewerDefaults.fromResource("no-such-file.json").get("undo.limit").isEmpty());
    }

    @Test
    void preferencesOverrideDefaultsAndPropertiesOverrideBoth() {
        JSONObject json = new JSONObject().put("undo", new JSONObject().put("limit", 10));
        ConfigService config = new ConfigService(preferences, new ViewerDefaults(json));
        assertEquals(10, config.undoLimit());

        preferences.putString("undo.limit", "20");
        assertEquals(20, config.undoLimit());

        System.setProperty("glimpse.undo.limit", "30");
        assertEquals(30, config.undoLimit());
    }

    @Test
    void malformedNumbersUseTheFallback() {
        preferences.putString("cache.maxEntries", "lots");
        preferences.putString("window.width", "-5");
        ConfigService config = new ConfigService(preferences, new ViewerDefaults(new JSONObject()));

        assertEquals(16, config.cacheMaxEntries());
        assertEquals(1024, config.windowSize().width);
    }

    @Test
    void persistsDirectoriesFilterAndWindowSize() {
        ConfigService config = new ConfigService(preferences, new ViewerDefaults(new JSONObject()));
        Path dir = Path.of("photos").toAbsolutePath();

        config.setLastOpenDirectory(dir);
        config.setLastSaveDirectory(dir.resolve("out"));
        config.setDefaultResampleFilter(ResampleFilter.LANCZOS3);
        config.setWindowSize(new Dimension(640, 480));

        ConfigService reloaded = new ConfigService(new PreferencesStore(node), new ViewerDefaults(new JSONObject()));
        assertEquals(dir, reloaded.lastOpenDirectory().orElseThrow());
        assertEquals(dir.resolve("out"), reloaded.lastSaveDirectory().orElseThrow());
        assertEquals(ResampleFilter.LANCZOS3, reloaded.defaultResampleFilter());
        assertEquals(new Dimension(640, 480), reloaded.windowSize());
    }
}
