/*
 * Copyright (c) 2025 Fuzzmatch4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.fuzzmatch4j.core.report;

import io.fuzzmatch4j.core.api.model.SearchReport;

public final class NoopReporter implements Reporter {
    @Override
    public void report(SearchReport report) {
        /* no-op */
    }
}
