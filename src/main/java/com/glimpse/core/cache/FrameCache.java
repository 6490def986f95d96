package com.glimpse.core.cache;

import com.glimpse.core.image.Frame;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * LRU store of decoded frame sets keyed by canonical path, bounded by entry count and resident
 * bytes. The entry for the displayed document is never evicted. Not thread-safe: only the UI
 * thread touches it.
 */
public final class FrameCache {

    private static final Logger LOGGER = Logger.getLogger(FrameCache.class.getName());

    private final LinkedHashMap<Path, Entry> entries = new LinkedHashMap<>(16, 0.75f, true);
    private final int maxEntries;
    private final long maxBytes;
    private long residentBytes;
    private Path current;

    public FrameCache(int maxEntries, long maxBytes) {
        if (maxEntries < 1) {
            throw new IllegalArgumentException("Cache must hold at least one entry");
        }
        if (maxBytes < 1) {
            throw new IllegalArgumentException("Cache byte budget must be positive");
        }
        this.maxEntries = maxEntries;
        this.maxBytes = maxBytes;
    }

    public Optional<List<Frame>> get(Path path) {
        Entry entry = entries.get(canonical(path));
        return entry == null ? Optional.empty() : Optional.of(entry.frames());
    }

    public boolean contains(Path path) {
        return entries.containsKey(canonical(path));
    }

    public void insert(Path path, List<Frame> frames) {
        Path key = canonical(path);
        Entry entry = new Entry(List.copyOf(frames), Frame.byteSize(frames));
        Entry replaced = entries.put(key, entry);
        if (replaced != null) {
            residentBytes -= replaced.bytes();
        }
        residentBytes += entry.bytes();
        evict();
    }

    /** Marks the displayed document; {@code null} when nothing is displayed. */
    public void setCurrent(Path path) {
        current = path == null ? null : canonical(path);
    }

    public Optional<Path> current() {
        return Optional.ofNullable(current);
    }

    public void remove(Path path) {
        Entry removed = entries.remove(canonical(path));
        if (removed != null) {
            residentBytes -= removed.bytes();
        }
    }

    public void clear() {
        entries.clear();
        residentBytes = 0;
        current = null;
    }

    public int size() {
        return entries.size();
    }

    public long residentBytes() {
        return residentBytes;
    }

    public int maxEntries() {
        return maxEntries;
    }

    public long maxBytes() {
        return maxBytes;
    }

    private void evict() {
        Iterator<Map.Entry<Path, Entry>> it = entries.entrySet().iterator();
        while (overBudget() && it.hasNext()) {
            Map.Entry<Path, Entry> eldest = it.next();
            if (Objects.equals(eldest.getKey(), current)) {
                continue;
            }
            it.remove();
            residentBytes -= eldest.getValue().bytes();
            LOGGER.fine(() -> "Evicted " + eldest.getKey().getFileName() + " from frame cache");
        }
    }

    private boolean overBudget() {
        return entries.size() > maxEntries || residentBytes > maxBytes;
    }

    static Path canonical(Path path) {
        Objects.requireNonNull(path, "path");
        try {
            return path.toRealPath();
        } catch (IOException ex) {
            return path.toAbsolutePath().normalize();
        }
    }

    private record Entry(List<Frame> frames, long bytes) {
    }
}
