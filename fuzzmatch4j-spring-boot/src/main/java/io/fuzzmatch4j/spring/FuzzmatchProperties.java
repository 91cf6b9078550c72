/*
 * Copyright (c) 2025 Fuzzmatch4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.fuzzmatch4j.spring;

import io.fuzzmatch4j.core.api.model.MatcherType;
import io.fuzzmatch4j.core.match.AutomatonCache;
import io.fuzzmatch4j.core.preset.MatcherRegistry;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Getter
@ConfigurationProperties(prefix = "fuzzmatch4j")
public class FuzzmatchProperties {

    @Setter
    private boolean enabled = true;

    @Setter
    private MatcherType algorithm = MatcherRegistry.defaultType();

    private Automaton automaton = new Automaton();

    private Metrics metrics = new Metrics();

    public void setAutomaton(Automaton automaton) {
        this.automaton = (automaton == null) ? new Automaton() : automaton;
    }

    public void setMetrics(Metrics metrics) {
        this.metrics = (metrics == null) ? new Metrics() : metrics;
    }

    // ---- nested: automaton ----
    public static final class Automaton {
        @Setter
        @Getter
        private int cacheCapacity = AutomatonCache.DEFAULT_CAPACITY; // 0 = build per search
    }

    // ---- nested: metrics ----
    public static final class Metrics {
        @Setter
        @Getter
        private int recentCapacity = 200;
    }
}
