/*
 * Copyright (c) 2025 Fuzzmatch4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.fuzzmatch4j.core.match;

import io.fuzzmatch4j.core.api.model.Occurrence;
import io.fuzzmatch4j.core.distance.DistanceColumns;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Deterministic automaton over distance columns for one {@code (pattern, clamp)} pair.
 *
 * <p>States are dense indices; state {@value #START} is the column {@code [0, 1, ..., p]}.
 * Transitions live in a flat table of {@code stateCount * 256} entries. Instances are immutable
 * and may be shared between threads.
 */
public final class Automaton {
    private static final Logger log = LoggerFactory.getLogger(Automaton.class);

    static final int ALPHABET = 256;
    static final int START = 0;
    private static final int NOT_A_GOAL = -1;

    private final int[] transitions;
    private final int[] goals;
    private final int stateCount;

    private Automaton(int[] transitions, int[] goals, int stateCount) {
        this.transitions = transitions;
        this.goals = goals;
        this.stateCount = stateCount;
    }

    /**
     * Breadth-first construction. Column entries saturate at {@code clamp + 1} so that the set of
     * reachable columns is finite; structurally equal columns become the same state.
     */
    public static Automaton build(byte[] pattern, int clamp) {
        final int p = pattern.length;
        final int ceiling = clamp + 1;

        List<int[]> columns = new ArrayList<>();
        Map<ColumnKey, Integer> index = new HashMap<>();
        int[] goals = new int[16];
        int[] transitions = new int[16 * ALPHABET];

        int[] start = DistanceColumns.initial(p);
        columns.add(start);
        index.put(new ColumnKey(start), START);
        goals[START] = goalOf(start, clamp);

        ArrayDeque<Integer> queue = new ArrayDeque<>();
        queue.add(START);
        int[] scratch = new int[p + 1];
        while (!queue.isEmpty()) {
            int source = queue.poll();
            int[] column = columns.get(source);
            for (int b = 0; b < ALPHABET; b++) {
                DistanceColumns.advance(column, scratch, (byte) b, pattern, ceiling);
                Integer target = index.get(new ColumnKey(scratch));
                if (target == null) {
                    int[] copy = scratch.clone();
                    target = columns.size();
                    columns.add(copy);
                    index.put(new ColumnKey(copy), target);
                    if (target == goals.length) {
                        goals = Arrays.copyOf(goals, goals.length * 2);
                        transitions = Arrays.copyOf(transitions, goals.length * ALPHABET);
                    }
                    goals[target] = goalOf(copy, clamp);
                    queue.add(target);
                }
                transitions[source * ALPHABET + b] = target;
            }
        }

        int n = columns.size();
        if (log.isDebugEnabled()) {
            log.debug("built automaton: patternLength={} clamp={} states={}", p, clamp, n);
        }
        return new Automaton(Arrays.copyOf(transitions, n * ALPHABET), Arrays.copyOf(goals, n), n);
    }

    private static int goalOf(int[] column, int clamp) {
        int last = column[column.length - 1];
        return last <= clamp ? last : NOT_A_GOAL;
    }

    /** Walks {@code text} from the start state, emitting an occurrence at every goal state. */
    public List<Occurrence> scan(byte[] text) {
        List<Occurrence> out = new ArrayList<>();
        int state = START;
        for (int i = 0; i < text.length; i++) {
            state = transitions[state * ALPHABET + (text[i] & 0xff)];
            int d = goals[state];
            if (d != NOT_A_GOAL) out.add(new Occurrence(i, d));
        }
        return out;
    }

    public int stateCount() {
        return stateCount;
    }

    /** Target of {@code state} on byte {@code b}. */
    public int next(int state, byte b) {
        return transitions[state * ALPHABET + (b & 0xff)];
    }

    /** Distance reported when the scan sits on {@code state}, or -1 if it is not a goal. */
    public int goalDistance(int state) {
        return goals[state];
    }

    /** Structural key for a column; only used while building. */
    private static final class ColumnKey {
        private final int[] column;
        private final int hash;

        ColumnKey(int[] column) {
            this.column = column;
            this.hash = Arrays.hashCode(column);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof ColumnKey other && hash == other.hash && Arrays.equals(column, other.column);
        }

        @Override
        public int hashCode() {
            return hash;
        }
    }
}
