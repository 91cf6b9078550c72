/*
 * Copyright (c) 2025 Fuzzmatch4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.fuzzmatch4j.core.api;

/** Thrown before any scanning when a matcher is handed a zero-length pattern. */
public final class EmptyPatternException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    public EmptyPatternException() {
        super("empty pattern");
    }
}
