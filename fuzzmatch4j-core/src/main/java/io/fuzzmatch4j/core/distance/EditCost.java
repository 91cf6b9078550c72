/*
 * Copyright (c) 2025 Fuzzmatch4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.fuzzmatch4j.core.distance;

/** Unit substitution cost over raw bytes. */
public final class EditCost {
    private EditCost() {}

    public static int of(byte a, byte b) {
        return a == b ? 0 : 1;
    }
}
