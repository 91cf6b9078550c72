/*
 * Copyright (c) 2025 Fuzzmatch4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.fuzzmatch4j.spring.config;

import io.fuzzmatch4j.core.api.Matcher;
import io.fuzzmatch4j.core.api.Searcher;
import io.fuzzmatch4j.core.match.AutomatonCache;
import io.fuzzmatch4j.core.preset.MatcherRegistry;
import io.fuzzmatch4j.core.report.NoopReporter;
import io.fuzzmatch4j.core.report.Reporter;
import io.fuzzmatch4j.spring.FuzzmatchEndpoint;
import io.fuzzmatch4j.spring.FuzzmatchProperties;
import io.fuzzmatch4j.spring.MicrometerReporter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.autoconfigure.endpoint.condition.ConditionalOnAvailableEndpoint;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.*;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Auto-configures a {@link Searcher} for the algorithm selected in {@code fuzzmatch4j.*}. */
@Slf4j
@AutoConfiguration(
        afterName = "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
@EnableConfigurationProperties(FuzzmatchProperties.class)
@ConditionalOnProperty(prefix = "fuzzmatch4j", name = "enabled", havingValue = "true", matchIfMissing = true)
public class FuzzmatchAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public AutomatonCache fuzzmatchAutomatonCache(FuzzmatchProperties props) {
        return new AutomatonCache(props.getAutomaton().getCacheCapacity());
    }

    @Bean
    @ConditionalOnMissingBean
    public MatcherRegistry fuzzmatchMatcherRegistry(AutomatonCache cache) {
        return new MatcherRegistry(cache);
    }

    @Bean
    @ConditionalOnMissingBean
    public Matcher fuzzmatchMatcher(MatcherRegistry registry, FuzzmatchProperties props) {
        Matcher matcher = registry.build(props.getAlgorithm());
        log.info("fuzzmatch4j: using {} matcher", matcher.type());
        return matcher;
    }

    @Bean
    @ConditionalOnMissingBean(Reporter.class)
    public Reporter fuzzmatchReporter() {
        // MicrometerReporter, when present, is registered first and is itself the Reporter
        return new NoopReporter();
    }

    @Bean
    @ConditionalOnMissingBean
    public Searcher fuzzmatchSearcher(Matcher matcher, Reporter reporter) {
        return new Searcher(matcher, reporter);
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(MeterRegistry.class)
    static class MetricsConfiguration {

        @Bean
        @ConditionalOnBean(MeterRegistry.class)
        @ConditionalOnMissingBean
        public MicrometerReporter fuzzmatchMicrometerReporter(MeterRegistry registry, FuzzmatchProperties props) {
            return new MicrometerReporter(registry, props.getMetrics().getRecentCapacity());
        }
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(name = "org.springframework.boot.actuate.endpoint.annotation.Endpoint")
    static class EndpointConfiguration {

        @Bean
        @ConditionalOnBean(MicrometerReporter.class)
        @ConditionalOnMissingBean
        @ConditionalOnAvailableEndpoint(endpoint = FuzzmatchEndpoint.class)
        public FuzzmatchEndpoint fuzzmatchEndpoint(Searcher searcher, MicrometerReporter reporter) {
            return new FuzzmatchEndpoint(searcher, reporter);
        }
    }
}
