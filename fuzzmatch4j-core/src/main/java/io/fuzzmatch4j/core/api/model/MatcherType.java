/*
 * Copyright (c) 2025 Fuzzmatch4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.fuzzmatch4j.core.api.model;

/** Algorithms users can pick in configuration. */
public enum MatcherType {
    SELLERS, // dynamic programming, O(n*p)
    UKKONEN, // column automaton, O(n) scan after build
    WU_MANBER // bit-parallel, O(n*k) per word
}
