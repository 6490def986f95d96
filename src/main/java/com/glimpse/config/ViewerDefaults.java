package com.glimpse.config;

import org.json.JSONException;
import org.json.JSONObject;
import org.json.JSONTokener;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Read-only defaults bundled with the application as {@code glimpse-defaults.json}. A missing or
 * malformed file yields an empty set so callers fall through to their built-in constants.
 */
public final class ViewerDefaults {
    private static final Logger LOGGER = Logger.getLogger(ViewerDefaults.class.getName());
    static final String RESOURCE = "glimpse-defaults.json";

    private final JSONObject values;

    ViewerDefaults(JSONObject values) {
        this.values = values;
    }

    public static ViewerDefaults bundled() {
        return fromResource(RESOURCE);
    }

    static ViewerDefaults fromResource(String resource) {
        try (InputStream stream = ViewerDefaults.class.getClassLoader().getResourceAsStream(resource)) {
            if (stream == null) {
                LOGGER.fine(() -> "No bundled defaults at " + resource);
                return new ViewerDefaults(new JSONObject());
            }
            try (Reader reader = new InputStreamReader(stream, StandardCharsets.UTF_8)) {
                return new ViewerDefaults(new JSONObject(new JSONTokener(reader)));
            }
        } catch (IOException | JSONException ex) {
            LOGGER.log(Level.WARNING, "Ignoring unreadable defaults " + resource, ex);
            return new ViewerDefaults(new JSONObject());
        }
    }

    /** Looks up a dotted key such as {@code cache.maxEntries} through nested objects. */
    public Optional<String> get(String dottedKey) {
        String[] parts = dottedKey.split("\\.");
        JSONObject node = values;
        for (int i = 0; i < parts.length - 1; i++) {
            node = node.optJSONObject(parts[i]);
            if (node == null) {
                return Optional.empty();
            }
        }
        Object leaf = node.opt(parts[parts.length - 1]);
        if (leaf == null || leaf == JSONObject.NULL || leaf instanceof JSONObject) {
            return Optional.empty();
        }
        return Optional.of(String.valueOf(leaf));
    }
}
