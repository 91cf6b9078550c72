/*
 * Copyright (c) 2025 Fuzzmatch4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.fuzzmatch4j.core.api.model;

/** Summary of one completed search, handed to reporters for metrics. */
public record SearchReport(
        MatcherType algorithm, int textLength, int patternLength, int effectiveDistance, int occurrences) {}
