package com.finlens.insights.services.insights;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;

import lombok.extern.slf4j.Slf4j;

/**
 * Bounded LRU cache with a fixed time-to-live, safe for concurrent use.
 * <p>
 * Recency is kept by an access-ordered {@link LinkedHashMap}: a read moves the entry to the tail,
 * the head is always the least recently used key. A single lock guards the map; the lock is never
 * held while callers compute values.
 *
 * @param <V> cached value type
 */
@Slf4j
public class ResultCache<V> {

    public static final int DEFAULT_CAPACITY = 20;
    public static final Duration DEFAULT_TTL = Duration.ofMinutes(5);

    private record CacheEntry<V>(V value, Instant insertedAt) {
    }

    private final int capacity;
    private final Duration ttl;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private final LinkedHashMap<String, CacheEntry<V>> entries;

    public ResultCache(Clock clock) {
        this(DEFAULT_CAPACITY, DEFAULT_TTL, clock);
    }

    public ResultCache(int capacity, Duration ttl, Clock clock) {
        this.capacity = Math.max(1, capacity);
        this.ttl = ttl != null ? ttl : DEFAULT_TTL;
        this.clock = clock;
        this.entries = new LinkedHashMap<>(16, 0.75f, true);
    }

    public Optional<V> get(String key) {
        lock.lock();
        try {
            CacheEntry<V> entry = entries.get(key);
            if (entry == null) {
                return Optional.empty();
            }
            if (isExpired(entry)) {
                entries.remove(key);
                log.debug("[ResultCache] Expired key={}", key);
                return Optional.empty();
            }
            return Optional.of(entry.value());
        } finally {
            lock.unlock();
        }
    }

    public void put(String key, V value) {
        lock.lock();
        try {
            CacheEntry<V> entry = new CacheEntry<>(value, clock.instant());
            if (entries.containsKey(key)) {
                // put() on an access-ordered map also moves the key to the tail
                entries.put(key, entry);
                return;
            }
            if (entries.size() >= capacity) {
                Iterator<String> eldest = entries.keySet().iterator();
                String evicted = eldest.next();
                eldest.remove();
                log.debug("[ResultCache] Evicted key={}", evicted);
            }
            entries.put(key, entry);
        } finally {
            lock.unlock();
        }
    }

    public void invalidateAll() {
        lock.lock();
        try {
            entries.clear();
        } finally {
            lock.unlock();
        }
    }

    /** Removes every key matching {@code keyPredicate}. */
    public int invalidate(Predicate<String> keyPredicate) {
        lock.lock();
        try {
            int before = entries.size();
            entries.keySet().removeIf(keyPredicate);
            return before - entries.size();
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    public int capacity() {
        return capacity;
    }

    private boolean isExpired(CacheEntry<V> entry) {
        Duration age = Duration.between(entry.insertedAt(), clock.instant());
        return age.compareTo(ttl) > 0;
    }
}
