package com.cryptofolio.backend.marketdata;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory key/value store whose entries expire a fixed time after they were written.
 * Expired entries are evicted on read and on every write. Thread-safe.
 */
public class TtlCache<K, V> {

    private final ConcurrentHashMap<K, Entry<V>> store = new ConcurrentHashMap<>();
    private final Duration ttl;
    private final Clock clock;

    public TtlCache(Duration ttl, Clock clock) {
        this.ttl = Objects.requireNonNull(ttl, "ttl");
        this.clock = Objects.requireNonNull(clock, "clock");
        if (ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must not be negative: " + ttl);
        }
    }

    public Optional<V> get(K key) {
        Entry<V> entry = store.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (!clock.instant().isBefore(entry.expiresAt())) {
            store.remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry.value());
    }

    /**
     * Stores {@code value} and drops every entry that has already expired, so keys that are
     * never read again do not accumulate.
     */
    public void put(K key, V value) {
        Objects.requireNonNull(value, "value");
        Instant now = clock.instant();
        store.values().removeIf(entry -> !now.isBefore(entry.expiresAt()));
        store.put(key, new Entry<>(value, now.plus(ttl)));
    }

    public void invalidate(K key) {
        store.remove(key);
    }

    public void invalidateAll() {
        store.clear();
    }

    public int size() {
        return store.size();
    }

    private record Entry<V>(V value, Instant expiresAt) {}
}
