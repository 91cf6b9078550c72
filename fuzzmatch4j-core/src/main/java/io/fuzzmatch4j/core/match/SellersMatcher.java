/*
 * Copyright (c) 2025 Fuzzmatch4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.fuzzmatch4j.core.match;

import io.fuzzmatch4j.core.api.Bounds;
import io.fuzzmatch4j.core.api.Matcher;
import io.fuzzmatch4j.core.api.model.MatcherType;
import io.fuzzmatch4j.core.api.model.Occurrence;
import io.fuzzmatch4j.core.distance.DistanceColumns;
import java.util.ArrayList;
import java.util.List;

/**
 * Sellers' dynamic-programming search: Wagner-Fischer over two alternating columns, with the first
 * entry reset to 0 at every text position so a match may start anywhere.
 *
 * <p>{@code O(n*p)} time, {@code O(p)} space, independent of the distance bound. This is the
 * reference the other matchers are checked against.
 */
public final class SellersMatcher implements Matcher {

    @Override
    public MatcherType type() {
        return MatcherType.SELLERS;
    }

    @Override
    public List<Occurrence> find(byte[] text, byte[] pattern, int maxDistance) {
        Bounds.require(text, pattern);
        final int p = pattern.length;
        final int clamp = Bounds.clamp(maxDistance, p);

        List<Occurrence> out = new ArrayList<>();
        int[] prev = DistanceColumns.initial(p);
        int[] next = new int[p + 1];
        for (int i = 0; i < text.length; i++) {
            DistanceColumns.advance(prev, next, text[i], pattern, DistanceColumns.UNBOUNDED);
            if (next[p] <= clamp) out.add(new Occurrence(i, next[p]));
            int[] t = prev;
            prev = next;
            next = t;
        }
        return out;
    }
}
