package com.placeguide.recommend.cache;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.function.Supplier;

public class TtlCache<V> {
    private final ConcurrentHashMap<String, Entry<V>> entries = new ConcurrentHashMap<>();
    private final ConcurrentLinkedQueue<String> insertionOrder = new ConcurrentLinkedQueue<>();
    private final int maxEntries;

    public TtlCache(int maxEntries) {
        this.maxEntries = Math.max(1, maxEntries);
    }

    public Optional<V> get(String key) {
        if (key == null) {
            return Optional.empty();
        }
        Entry<V> entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.expiresAt < System.currentTimeMillis()) {
            entries.remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry.value);
    }

    public void put(String key, V value, long ttlMs) {
        if (key == null || value == null || ttlMs <= 0) {
            return;
        }
        entries.put(key, new Entry<>(value, System.currentTimeMillis() + ttlMs));
        insertionOrder.add(key);
        while (entries.size() > maxEntries) {
            String oldest = insertionOrder.poll();
            if (oldest == null) {
                break;
            }
            entries.remove(oldest);
        }
    }

    public V getOrLoad(String key, long ttlMs, Supplier<V> loader) {
        Optional<V> cached = get(key);
        if (cached.isPresent()) {
            return cached.get();
        }
        V loaded = loader.get();
        put(key, loaded, ttlMs);
        return loaded;
    }

    public void invalidate(String key) {
        if (key != null) {
            entries.remove(key);
        }
    }

    public int size() {
        return entries.size();
    }

    private static final class Entry<V> {
        private final V value;
        private final long expiresAt;

        private Entry(V value, long expiresAt) {
            this.value = value;
            this.expiresAt = expiresAt;
        }
    }
}
