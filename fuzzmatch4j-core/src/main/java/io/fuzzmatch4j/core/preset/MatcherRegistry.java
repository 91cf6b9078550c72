/*
 * Copyright (c) 2025 Fuzzmatch4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.fuzzmatch4j.core.preset;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.fuzzmatch4j.core.api.Matcher;
import io.fuzzmatch4j.core.api.model.MatcherType;
import io.fuzzmatch4j.core.match.AutomatonCache;
import io.fuzzmatch4j.core.match.SellersMatcher;
import io.fuzzmatch4j.core.match.UkkonenMatcher;
import io.fuzzmatch4j.core.match.WuManberMatcher;
import java.util.*;

/**
 * Builds {@link Matcher} instances from the logical {@link MatcherType}s users configure.
 *
 * <p>Every Ukkonen matcher built by one registry shares the registry's {@link AutomatonCache}.
 */
public final class MatcherRegistry {
    private final AutomatonCache automatonCache;

    public MatcherRegistry() {
        this(new AutomatonCache());
    }

    @SuppressFBWarnings(
            value = "EI_EXPOSE_REP2",
            justification = "The cache is thread-safe and meant to be shared between registries and matchers.")
    public MatcherRegistry(AutomatonCache automatonCache) {
        this.automatonCache = Objects.requireNonNull(automatonCache, "automatonCache");
    }

    /** Default algorithm when none is configured. */
    public static MatcherType defaultType() {
        return MatcherType.WU_MANBER;
    }

    /**
     * @param type the algorithm, or null for {@link #defaultType()}
     */
    public Matcher build(MatcherType type) {
        MatcherType t = type == null ? defaultType() : type;
        return switch (t) {
            case SELLERS -> new SellersMatcher();
            case UKKONEN -> new UkkonenMatcher(automatonCache);
            case WU_MANBER -> new WuManberMatcher();
        };
    }

    /** One matcher per algorithm, in declaration order of {@link MatcherType}. */
    public List<Matcher> buildAll() {
        List<Matcher> out = new ArrayList<>();
        for (MatcherType t : MatcherType.values()) out.add(build(t));
        return List.copyOf(out);
    }

    @SuppressFBWarnings(
            value = "EI_EXPOSE_REP",
            justification = "The cache is thread-safe and shared on purpose so diagnostics can inspect or clear it.")
    public AutomatonCache automatonCache() {
        return automatonCache;
    }
}
