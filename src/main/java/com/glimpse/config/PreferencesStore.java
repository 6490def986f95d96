package com.glimpse.config;

import java.nio.file.Path;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.prefs.BackingStoreException;
import java.util.prefs.Preferences;

/**
 * Persists viewer state that outlives a session: last directories, window size and any value the
 * user changed from its bundled default.
 */
public final class PreferencesStore {
    private static final Logger LOGGER = Logger.getLogger(PreferencesStore.class.getName());
    private static final String ROOT_NODE = "com/glimpse/viewer";

    private final Preferences node;

    PreferencesStore(Preferences node) {
        this.node = node;
    }

    public static PreferencesStore user() {
        return new PreferencesStore(Preferences.userRoot().node(ROOT_NODE));
    }

    public Optional<String> getString(String key) {
        String value = node.get(key, null);
        return value == null || value.isBlank() ? Optional.empty() : Optional.of(value.trim());
    }

    public Optional<Path> getPath(String key) {
        return getString(key).map(Path::of);
    }

    public void putString(String key, String value) {
        if (key == null || key.isBlank() || value == null) {
            return;
        }
        node.put(key, value);
        flush();
    }

    public void putPath(String key, Path path) {
        if (path != null) {
            putString(key, path.toAbsolutePath().toString());
        }
    }

    public void remove(String key) {
        node.remove(key);
        flush();
    }

    private void flush() {
        try {
            node.flush();
        } catch (BackingStoreException ex) {
            LOGGER.log(Level.FINE, "Preferences not flushed; they stay in memory for this session", ex);
        }
    }
}
