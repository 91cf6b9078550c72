/*
 * Copyright (c) 2025 Fuzzmatch4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.fuzzmatch4j.core.api.model;

/**
 * One approximate match: {@code endIndex} is the offset of the last text byte of the matching
 * substring, {@code distance} the smallest edit distance of any substring ending there.
 */
public record Occurrence(int endIndex, int distance) {}
