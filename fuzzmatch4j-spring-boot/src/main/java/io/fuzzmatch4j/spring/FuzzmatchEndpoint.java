/*
 * Copyright (c) 2025 Fuzzmatch4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.fuzzmatch4j.spring;

import io.fuzzmatch4j.core.api.Searcher;
import java.util.HashMap;
import java.util.Map;
import org.springframework.boot.actuate.endpoint.annotation.Endpoint;
import org.springframework.boot.actuate.endpoint.annotation.ReadOperation;

@Endpoint(id = "fuzzmatch")
public class FuzzmatchEndpoint {

    private final Searcher searcher;
    private final MicrometerReporter reporter;

    public FuzzmatchEndpoint(Searcher searcher, MicrometerReporter reporter) {
        this.searcher = searcher;
        this.reporter = reporter;
    }

    @ReadOperation
    public Map<String, Object> info() {
        Map<String, Object> m = new HashMap<>();
        m.put("status", "OK");
        m.put("algorithm", searcher.matcher().type().name());
        m.put("recentReports", reporter.recentReports());
        return m;
    }
}
