/*
 * Copyright (c) 2025 Fuzzmatch4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.fuzzmatch4j.core.api;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.fuzzmatch4j.core.api.model.Occurrence;
import io.fuzzmatch4j.core.api.model.SearchReport;
import io.fuzzmatch4j.core.report.NoopReporter;
import io.fuzzmatch4j.core.report.Reporter;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Front door for applications: runs one configured {@link Matcher} and tells a {@link Reporter}
 * about every completed search. Reporting is best-effort and never fails the search.
 */
public final class Searcher {
    private static final Logger log = LoggerFactory.getLogger(Searcher.class);

    private final Matcher matcher;
    private final Reporter reporter;

    public Searcher(Matcher matcher) {
        this(matcher, new NoopReporter());
    }

    public Searcher(Matcher matcher, Reporter reporter) {
        this.matcher = Objects.requireNonNull(matcher, "matcher");
        this.reporter = Objects.requireNonNull(reporter, "reporter");
    }

    public List<Occurrence> find(byte[] text, byte[] pattern, int maxDistance) {
        return findDetailed(text, pattern, maxDistance).occurrences();
    }

    public Result findDetailed(byte[] text, byte[] pattern, int maxDistance) {
        if (maxDistance < 0 && log.isDebugEnabled()) {
            log.debug("negative maxDistance {} treated as 0", maxDistance);
        }
        List<Occurrence> occurrences = matcher.find(text, pattern, maxDistance);
        var report = new SearchReport(
                matcher.type(),
                text.length,
                pattern.length,
                Bounds.clamp(maxDistance, pattern.length),
                occurrences.size());
        try {
            reporter.report(report);
        } catch (RuntimeException e) {
            log.warn("reporter {} failed, search result kept", reporter.getClass().getName(), e);
        }
        return new Result(List.copyOf(occurrences), report);
    }

    @SuppressFBWarnings(
            value = "EI_EXPOSE_REP",
            justification = "Matchers are stateless; handing out the configured instance lets callers "
                    + "bypass reporting without rebuilding it.")
    public Matcher matcher() {
        return matcher;
    }

    public record Result(List<Occurrence> occurrences, SearchReport report) {}
}
