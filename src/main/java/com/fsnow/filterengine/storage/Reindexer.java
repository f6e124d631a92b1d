package com.fsnow.filterengine.storage;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Compacts namespace test tables once removals left too many holes in them.
 * <p>
 * Passes are deferred by a configurable delay and run on a single daemon
 * thread, under the namespace lock. At most one pass is pending per namespace.
 */
public class Reindexer {

    private static final Logger logger = LoggerFactory.getLogger(Reindexer.class);

    private final double threshold;
    private final long delayMillis;
    private final ScheduledExecutorService executor;
    private final AtomicLong completedPasses = new AtomicLong(0);

    /**
     * @param threshold Share of freed test table slots triggering a compaction
     * @param delayMillis Delay before a scheduled compaction runs
     */
    public Reindexer(double threshold, long delayMillis) {
        this.threshold = threshold;
        this.delayMillis = delayMillis;
        this.executor = Executors.newSingleThreadScheduledExecutor(new ThreadFactoryBuilder()
                .setNameFormat("FilterEngine-Reindexer-%d")
                .setDaemon(true)
                .build());
    }

    /**
     * Checks if the namespace test table must be compacted.
     */
    public boolean needsReindex(NamespaceStorage namespace) {
        return namespace.getTestTable().needsReindex(threshold);
    }

    /**
     * Schedules a compaction of the namespace, unless one is already pending.
     * Callers hold the namespace lock.
     */
    public void schedule(NamespaceStorage namespace) {
        if (!namespace.markReindexScheduled()) {
            return;
        }

        try {
            executor.schedule(() -> reindex(namespace), delayMillis, TimeUnit.MILLISECONDS);
            logger.debug("Reindex of {}/{} scheduled in {} ms",
                    namespace.getIndex(), namespace.getCollection(), delayMillis);
        } catch (RejectedExecutionException e) {
            namespace.clearReindexScheduled();
            logger.warn("Reindex of {}/{} rejected: reindexer is shut down",
                    namespace.getIndex(), namespace.getCollection());
        }
    }

    private void reindex(NamespaceStorage namespace) {
        namespace.lock();
        try {
            namespace.clearReindexScheduled();

            if (namespace.isDropped()) {
                logger.debug("Skipping reindex of dropped namespace {}/{}",
                        namespace.getIndex(), namespace.getCollection());
                return;
            }

            if (needsReindex(namespace)) {
                namespace.reindex();
                completedPasses.incrementAndGet();
            }
        } catch (Exception e) {
            logger.error("Error while reindexing {}/{}", namespace.getIndex(), namespace.getCollection(), e);
        } finally {
            namespace.unlock();
        }
    }

    /**
     * Number of compactions performed so far.
     */
    public long getCompletedPasses() {
        return completedPasses.get();
    }

    public void shutdown() {
        logger.info("Shutting down reindexer");
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
