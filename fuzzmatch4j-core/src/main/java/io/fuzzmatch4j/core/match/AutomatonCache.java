/*
 * Copyright (c) 2025 Fuzzmatch4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.fuzzmatch4j.core.match;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounded LRU of built automata keyed by {@code (pattern, clamp)}.
 *
 * <p>Entries are immutable, so a cached automaton can be scanned by many threads at once; only the
 * map bookkeeping is synchronized. Two threads missing on the same key may both build; the first
 * stored result wins. Capacity 0 disables caching.
 */
public final class AutomatonCache {
    private static final Logger log = LoggerFactory.getLogger(AutomatonCache.class);

    public static final int DEFAULT_CAPACITY = 64;

    private final int capacity;
    private final Map<Key, Automaton> entries;

    public AutomatonCache() {
        this(DEFAULT_CAPACITY);
    }

    public AutomatonCache(int capacity) {
        if (capacity < 0) throw new IllegalArgumentException("capacity must be >= 0, got " + capacity);
        this.capacity = capacity;
        this.entries = new LinkedHashMap<>(16, 0.75f, true) {
            private static final long serialVersionUID = 1L;

            @Override
            protected boolean removeEldestEntry(Map.Entry<Key, Automaton> eldest) {
                boolean evict = size() > AutomatonCache.this.capacity;
                if (evict && log.isDebugEnabled()) {
                    log.debug("evicting automaton: patternLength={} clamp={}", eldest.getKey().pattern.length,
                            eldest.getKey().clamp);
                }
                return evict;
            }
        };
    }

    /** Returns the cached automaton for {@code (pattern, clamp)}, building it on a miss. */
    public Automaton get(byte[] pattern, int clamp) {
        if (capacity == 0) return Automaton.build(pattern, clamp);

        Key key = new Key(pattern.clone(), clamp);
        synchronized (entries) {
            Automaton hit = entries.get(key);
            if (hit != null) return hit;
        }
        Automaton built = Automaton.build(pattern, clamp);
        synchronized (entries) {
            Automaton raced = entries.putIfAbsent(key, built);
            return raced != null ? raced : built;
        }
    }

    public int size() {
        synchronized (entries) {
            return entries.size();
        }
    }

    public int capacity() {
        return capacity;
    }

    public void clear() {
        synchronized (entries) {
            entries.clear();
        }
    }

    private static final class Key {
        private final byte[] pattern;
        private final int clamp;
        private final int hash;

        Key(byte[] pattern, int clamp) {
            this.pattern = pattern;
            this.clamp = clamp;
            this.hash = 31 * Arrays.hashCode(pattern) + clamp;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Key other && clamp == other.clamp && Arrays.equals(pattern, other.pattern);
        }

        @Override
        public int hashCode() {
            return hash;
        }
    }
}
