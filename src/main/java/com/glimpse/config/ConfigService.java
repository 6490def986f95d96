package com.glimpse.config;

import com.glimpse.core.image.ResampleFilter;

import java.awt.Dimension;
import java.nio.file.Path;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Resolves viewer settings. Lookup order: JVM system property {@code glimpse.<key>}, then the
 * user's persisted preferences, then bundled JSON defaults, then the constant given by the caller.
 */
public final class ConfigService {
    private static final Logger LOGGER = Logger.getLogger(ConfigService.class.getName());

    static final String CACHE_MAX_ENTRIES = "cache.maxEntries";
    static final String CACHE_MAX_MIB = "cache.maxMiB";
    static final String UNDO_LIMIT = "undo.limit";
    static final String RESAMPLE_FILTER = "resize.filter";
    static final String WINDOW_WIDTH = "window.width";
    static final String WINDOW_HEIGHT = "window.height";
    static final String LAST_OPEN_DIR = "dir.lastOpen";
    static final String LAST_SAVE_DIR = "dir.lastSave";

    private static final String PROPERTY_PREFIX = "glimpse.";

    private final PreferencesStore preferences;
    private final ViewerDefaults defaults;

    public ConfigService(PreferencesStore preferences, ViewerDefaults defaults) {
        this.preferences = preferences;
        this.defaults = defaults;
    }

    public static ConfigService standard() {
        return new ConfigService(PreferencesStore.user(), ViewerDefaults.bundled());
    }

    public int cacheMaxEntries() {
        return positiveInt(CACHE_MAX_ENTRIES, 16);
    }

    public long cacheMaxBytes() {
        return positiveInt(CACHE_MAX_MIB, 512) * 1024L * 1024L;
    }

    /** Zero means unlimited. */
    public int undoLimit() {
        return Math.max(0, intValue(UNDO_LIMIT, 64));
    }

    public ResampleFilter defaultResampleFilter() {
        return ResampleFilter.fromName(resolve(RESAMPLE_FILTER).orElse(null), ResampleFilter.CATMULL_ROM);
    }

    public void setDefaultResampleFilter(ResampleFilter filter) {
        preferences.putString(RESAMPLE_FILTER, filter.name());
    }

    public Dimension windowSize() {
        return new Dimension(positiveInt(WINDOW_WIDTH, 1024), positiveInt(WINDOW_HEIGHT, 768));
    }

    public void setWindowSize(Dimension size) {
        preferences.putString(WINDOW_WIDTH, Integer.toString(size.width));
        preferences.putString(WINDOW_HEIGHT, Integer.toString(size.height));
    }

    public Optional<Path> lastOpenDirectory() {
        return resolve(LAST_OPEN_DIR).map(Path::of);
    }

    public void setLastOpenDirectory(Path dir) {
        preferences.putPath(LAST_OPEN_DIR, dir);
    }

    public Optional<Path> lastSaveDirectory() {
        return resolve(LAST_SAVE_DIR).map(Path::of);
    }

    public void setLastSaveDirectory(Path dir) {
        preferences.putPath(LAST_SAVE_DIR, dir);
    }

    Optional<String> resolve(String key) {
        String override = System.getProperty(PROPERTY_PREFIX + key);
        if (override != null && !override.isBlank()) {
            return Optional.of(override.trim());
        }
        Optional<String> stored = preferences.getString(key);
        if (stored.isPresent()) {
            return stored;
        }
        return defaults.get(key);
    }

    private int intValue(String key, int fallback) {
        Optional<String> raw = resolve(key);
        if (raw.isEmpty()) {
            return fallback;
        }
        try {
            return Integer.parseInt(raw.get());
        } catch (NumberFormatException ex) {
            LOGGER.warning(() -> "Setting " + key + "=" + raw.get() + " is not a number; using " + fallback);
            return fallback;
        }
    }

    private int positiveInt(String key, int fallback) {
        int value = intValue(key, fallback);
        return value > 0 ? value : fallback;
    }
}
