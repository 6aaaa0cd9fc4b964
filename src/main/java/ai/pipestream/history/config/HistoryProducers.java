package ai.pipestream.history.config;

import ai.pipestream.history.compare.ComparisonLimits;
import ai.pipestream.history.compare.ComparisonReporter;
import ai.pipestream.history.diff.DiffEngine;
import ai.pipestream.history.diff.MyersDiffAlgorithm;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;

import java.time.Clock;

@ApplicationScoped
public class HistoryProducers {

    /**
     * Clock used to stamp new versions.
     */
    @Produces
    @Singleton
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Produces
    @Singleton
    public DiffEngine diffEngine() {
        return new DiffEngine(new MyersDiffAlgorithm());
    }

    /**
     * Produces the reporter with the configured size ceiling.
     */
    @Produces
    @Singleton
    public ComparisonReporter comparisonReporter(DiffEngine diffEngine, HistoryConfiguration config) {
        ComparisonLimits limits = new ComparisonLimits(
                config.diff().maxLines(),
                config.diff().maxBytes(),
                config.diff().failOnLimit());
        return new ComparisonReporter(diffEngine, limits);
    }
}
