package ai.pipestream.history.compare;

import ai.pipestream.history.config.HistoryConfiguration;
import com.google.common.base.Throwables;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.util.concurrent.UncheckedExecutionException;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.cache.GuavaCacheMetrics;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Bounded cache of comparisons between two persisted versions.
 * <p>
 * Versions never change once written, so an entry is valid for as long as it stays cached.
 * Keys must name concrete version ids, never the moving "current" head or a draft.
 */
@ApplicationScoped
public class ComparisonCache {

    private static final Logger LOG = Logger.getLogger(ComparisonCache.class);

    @Inject
    HistoryConfiguration config;

    @Inject
    MeterRegistry meterRegistry;

    private Cache<PairKey, ComparisonResult> cache;

    record PairKey(String documentId, String fromVersionId, String toVersionId) {
    }

    @PostConstruct
    void init() {
        cache = CacheBuilder.newBuilder()
                .maximumSize(config.cache().maxEntries())
                .expireAfterAccess(config.cache().idleTtl().toMillis(), TimeUnit.MILLISECONDS)
                .recordStats()
                .build();

        GuavaCacheMetrics.monitor(meterRegistry, cache, "history_comparison_cache");

        LOG.infof("ComparisonCache initialized: maxEntries=%d, idleTtl=%s",
                config.cache().maxEntries(), config.cache().idleTtl());
    }

    /**
     * Returns the cached comparison of two versions, computing and caching it on a miss.
     */
    public ComparisonResult get(String documentId, String fromVersionId, String toVersionId,
                                Supplier<ComparisonResult> loader) {
        PairKey key = new PairKey(documentId, fromVersionId, toVersionId);
        try {
            // Concurrent misses on one key wait for a single load.
            return cache.get(key, () -> {
                LOG.debugf("Comparison cache miss: documentId=%s, from=%s, to=%s",
                        documentId, fromVersionId, toVersionId);
                return loader.get();
            });
        } catch (UncheckedExecutionException | ExecutionException e) {
            Throwables.throwIfUnchecked(e.getCause());
            throw new IllegalStateException("Comparison failed: documentId=" + documentId, e.getCause());
        }
    }

    public long size() {
        return cache.size();
    }
}
