package ai.pipestream.history.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.time.Duration;

/**
 * Configuration for the document history service.
 * All keys are namespaced under {@code history.*}.
 */
@ConfigMapping(prefix = "history")
public interface HistoryConfiguration {

    /**
     * Diff size ceiling.
     */
    Diff diff();

    /**
     * Version store write serialization.
     */
    Store store();

    /**
     * Version listing page sizes.
     */
    Paging paging();

    /**
     * Rollback retry policy.
     */
    Rollback rollback();

    /**
     * Cache of comparisons between persisted versions.
     */
    Cache cache();

    interface Diff {
        /**
         * Maximum line count of either side before a comparison turns coarse.
         * Default: 20000.
         */
        @WithDefault("20000")
        int maxLines();

        /**
         * Maximum combined size of both sides in bytes before a comparison turns coarse.
         * Default: 4 MiB.
         */
        @WithDefault("4194304")
        long maxBytes();

        /**
         * Fail oversized comparisons instead of returning a coarse result.
         * Default: false.
         */
        @WithDefault("false")
        boolean failOnLimit();
    }

    interface Store {
        /**
         * How long a writer waits for the per-document lock on each attempt.
         * Default: 2 seconds.
         */
        @WithDefault("PT2S")
        Duration lockTimeout();

        /**
         * Lock attempts before a write fails with a concurrency conflict.
         * Default: 3.
         */
        @WithDefault("3")
        int maxLockAttempts();
    }

    interface Paging {
        @WithDefault("20")
        int defaultLimit();

        @WithDefault("100")
        int maxLimit();
    }

    interface Rollback {
        /**
         * Attempts to append the restored version when the head moves underneath it.
         * Default: 3.
         */
        @WithDefault("3")
        int maxAttempts();
    }

    interface Cache {
        @WithDefault("1000")
        int maxEntries();

        @WithDefault("PT10M")
        Duration idleTtl();
    }
}
