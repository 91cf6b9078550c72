/*
 * Copyright (c) 2025 Fuzzmatch4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.fuzzmatch4j.spring;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.fuzzmatch4j.core.api.model.SearchReport;
import io.fuzzmatch4j.core.report.Reporter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

public final class MicrometerReporter implements Reporter {
    static final String SEARCHES = "fuzzmatch4j_searches_total";
    static final String OCCURRENCES = "fuzzmatch4j_occurrences_total";

    private final MeterRegistry registry;
    private final Deque<SearchReport> ring = new ArrayDeque<>();
    private final int capacity;

    @SuppressFBWarnings(
            value = "EI_EXPOSE_REP2",
            justification = "MeterRegistry is a framework-managed, thread-safe component; "
                    + "keeping a reference is required for metrics reporting and it is not exposed via accessors.")
    public MicrometerReporter(MeterRegistry registry, int capacity) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.capacity = Math.max(10, capacity);
    }

    @Override
    public synchronized void report(SearchReport report) {
        if (report == null) return;
        String algorithm = report.algorithm().name();
        registry.counter(SEARCHES, "algorithm", algorithm).increment();
        registry.counter(OCCURRENCES, "algorithm", algorithm).increment(report.occurrences());
        if (ring.size() >= capacity) ring.removeFirst();
        ring.addLast(report);
    }

    /** Returns an unmodifiable snapshot of the recent reports ring buffer. */
    public synchronized List<SearchReport> recentReports() {
        return List.copyOf(ring);
    }

    public int capacity() {
        return capacity;
    }
}
