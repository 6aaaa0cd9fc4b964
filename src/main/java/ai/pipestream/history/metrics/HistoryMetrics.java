package ai.pipestream.history.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

/**
 * Metrics for version history operations.
 * Exposes counters, timers, and histograms via Micrometer.
 */
@ApplicationScoped
public class HistoryMetrics {

    @Inject
    MeterRegistry registry;

    private Counter versionsCreatedTotal;
    private Counter rollbacksTotal;
    private Counter comparisonsTotal;
    private Counter comparisonsCoarseTotal;
    private Counter concurrencyConflictsTotal;

    private Timer createVersionLatency;
    private Timer compareLatency;

    private DistributionSummary diffEntries;

    @PostConstruct
    void init() {
        // Counters
        versionsCreatedTotal = Counter.builder("history_versions_created_total")
                .description("Total number of versions appended, rollbacks included")
                .register(registry);

        rollbacksTotal = Counter.builder("history_rollbacks_total")
                .description("Total number of rollbacks")
                .register(registry);

        comparisonsTotal = Counter.builder("history_comparisons_total")
                .description("Total number of comparisons computed")
                .register(registry);

        comparisonsCoarseTotal = Counter.builder("history_comparisons_coarse_total")
                .description("Comparisons degraded to a coarse result by the size ceiling")
                .register(registry);

        concurrencyConflictsTotal = Counter.builder("history_concurrency_conflicts_total")
                .description("Writes rejected after exhausting serialization attempts")
                .register(registry);

        // Timers
        createVersionLatency = Timer.builder("history_create_version_latency_ms")
                .description("Latency of appending a version, lock wait included")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);

        compareLatency = Timer.builder("history_compare_latency_ms")
                .description("Latency of computing a comparison")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);

        // Distribution Summaries
        diffEntries = DistributionSummary.builder("history_diff_entries")
                .description("Distribution of diff sizes in entries")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }

    public void recordVersionCreated() {
        versionsCreatedTotal.increment();
    }

    public void recordRollback() {
        rollbacksTotal.increment();
    }

    public void recordComparison(int entries, boolean coarse) {
        comparisonsTotal.increment();
        if (coarse) {
            comparisonsCoarseTotal.increment();
        } else {
            diffEntries.record(entries);
        }
    }

    public void recordConcurrencyConflict() {
        concurrencyConflictsTotal.increment();
    }

    public Timer.Sample startCreateVersionTimer() {
        return Timer.start(registry);
    }

    public void stopCreateVersionTimer(Timer.Sample sample) {
        sample.stop(createVersionLatency);
    }

    public Timer.Sample startCompareTimer() {
        return Timer.start(registry);
    }

    public void stopCompareTimer(Timer.Sample sample) {
        sample.stop(compareLatency);
    }

    public double versionsCreated() {
        return versionsCreatedTotal.count();
    }
}
