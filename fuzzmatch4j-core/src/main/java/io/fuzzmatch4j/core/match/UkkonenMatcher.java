/*
 * Copyright (c) 2025 Fuzzmatch4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.fuzzmatch4j.core.match;

import io.fuzzmatch4j.core.api.Bounds;
import io.fuzzmatch4j.core.api.Matcher;
import io.fuzzmatch4j.core.api.model.MatcherType;
import io.fuzzmatch4j.core.api.model.Occurrence;
import java.util.List;

/**
 * Ukkonen's automaton search. Compiles the pattern into an {@link Automaton} whose states are the
 * distinct reachable distance columns, then scans the text in {@code O(n)}.
 *
 * <p>The build explores up to {@code states * 256} transitions, so it pays off for repeated
 * searches with the same pattern; pass an {@link AutomatonCache} to keep built automata.
 */
public final class UkkonenMatcher implements Matcher {
    private final AutomatonCache cache; // null = build per call

    public UkkonenMatcher() {
        this(null);
    }

    public UkkonenMatcher(AutomatonCache cache) {
        this.cache = cache;
    }

    @Override
    public MatcherType type() {
        return MatcherType.UKKONEN;
    }

    @Override
    public List<Occurrence> find(byte[] text, byte[] pattern, int maxDistance) {
        Bounds.require(text, pattern);
        int clamp = Bounds.clamp(maxDistance, pattern.length);
        Automaton automaton = cache == null ? Automaton.build(pattern, clamp) : cache.get(pattern, clamp);
        return automaton.scan(text);
    }
}
