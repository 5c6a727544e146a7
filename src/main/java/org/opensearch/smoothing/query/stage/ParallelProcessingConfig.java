/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.smoothing.query.stage;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.opensearch.common.settings.ClusterSettings;
import org.opensearch.common.settings.Settings;
import org.opensearch.smoothing.SmoothingPlugin;
import org.opensearch.smoothing.core.time.VariableRateMovingAverage;

import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.ForkJoinWorkerThread;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * When the variable-rate engine splits a batch across threads, and the threads it uses.
 *
 * <p>The engine's work is measured in cells, {@code seriesCount * length}: one output value each. A batch
 * goes parallel only when parallelism is enabled and the batch has at least {@link #minimumCells()} cells.
 * Parallel work runs on a dedicated pool of daemon threads named {@value #THREAD_NAME_PREFIX}{@code N},
 * sized by {@link SmoothingPlugin#PARALLEL_POOL_SIZE}. Until the plugin creates that pool, and after it is
 * shut down, the common pool is used instead.</p>
 *
 * <p>The active configuration lives in {@link VariableRateMovingAverage}; this class builds it from the
 * node settings and keeps it current when they change.</p>
 *
 * @param enabled whether batches may be split across threads at all
 * @param minimumCells smallest batch, in cells, worth splitting
 */
public record ParallelProcessingConfig(boolean enabled, long minimumCells) {

    private static final Logger logger = LogManager.getLogger(ParallelProcessingConfig.class);

    static final String THREAD_NAME_PREFIX = "smoothing-parallel-";

    private static final long TERMINATION_TIMEOUT_SECONDS = 30;

    private static final AtomicReference<ForkJoinPool> POOL = new AtomicReference<>();

    /**
     * @param cells {@code seriesCount * length} of the batch
     * @return true if a batch of that size should be evaluated in parallel
     */
    public boolean allowsParallel(long cells) {
        return enabled && cells > 0 && cells >= minimumCells;
    }

    /**
     * @return the configuration the node settings yield when none is set explicitly
     */
    public static ParallelProcessingConfig defaults() {
        return fromSettings(Settings.EMPTY);
    }

    /**
     * @return a configuration that never splits a batch
     */
    public static ParallelProcessingConfig sequential() {
        return new ParallelProcessingConfig(false, Long.MAX_VALUE);
    }

    /**
     * @return a configuration that splits every non-empty batch
     */
    public static ParallelProcessingConfig always() {
        return new ParallelProcessingConfig(true, 0L);
    }

    static ParallelProcessingConfig fromSettings(Settings settings) {
        return new ParallelProcessingConfig(SmoothingPlugin.PARALLEL_ENABLED.get(settings), SmoothingPlugin.PARALLEL_MIN_CELLS.get(settings));
    }

    /**
     * @return the pool parallel batches run on
     */
    public static ForkJoinPool currentPool() {
        ForkJoinPool pool = POOL.get();
        return pool == null ? ForkJoinPool.commonPool() : pool;
    }

    /**
     * Creates the dedicated pool, installs the configuration derived from {@code settings}, and follows
     * later changes of the parallel processing settings.
     *
     * @param clusterSettings the node's cluster settings, for update listeners
     * @param settings the node settings
     */
    public static void initialize(ClusterSettings clusterSettings, Settings settings) {
        resizePool(SmoothingPlugin.PARALLEL_POOL_SIZE.get(settings));
        install(fromSettings(settings));
        clusterSettings.addSettingsUpdateConsumer(
            SmoothingPlugin.PARALLEL_ENABLED,
            SmoothingPlugin.PARALLEL_MIN_CELLS,
            (enabled, minimumCells) -> install(new ParallelProcessingConfig(enabled, minimumCells))
        );
        clusterSettings.addSettingsUpdateConsumer(SmoothingPlugin.PARALLEL_POOL_SIZE, ParallelProcessingConfig::resizePool);
    }

    private static void install(ParallelProcessingConfig config) {
        VariableRateMovingAverage.setParallelConfig(config);
        logger.info("Variable-rate parallel processing: enabled={}, minimumCells={}", config.enabled(), config.minimumCells());
    }

    /**
     * Replaces the dedicated pool. Batches already running on the old pool finish there; the engine
     * evaluates a batch the old pool rejects sequentially.
     */
    static void resizePool(int parallelism) {
        retire(POOL.getAndSet(newPool(parallelism)), false);
        logger.info("Variable-rate parallel pool size set to {}", parallelism);
    }

    /**
     * Shuts the dedicated pool down, waiting for running batches. Later parallel batches use the common pool.
     */
    public static void shutdown() {
        retire(POOL.getAndSet(null), true);
    }

    private static void retire(ForkJoinPool pool, boolean await) {
        if (pool == null) {
            return;
        }
        pool.shutdown();
        if (await == false) {
            return;
        }
        try {
            if (pool.awaitTermination(TERMINATION_TIMEOUT_SECONDS, TimeUnit.SECONDS) == false) {
                logger.warn("Variable-rate parallel pool still busy after {}s, interrupting workers", TERMINATION_TIMEOUT_SECONDS);
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static ForkJoinPool newPool(int parallelism) {
        ForkJoinPool.ForkJoinWorkerThreadFactory factory = pool -> {
            ForkJoinWorkerThread worker = ForkJoinPool.defaultForkJoinWorkerThreadFactory.newThread(pool);
            worker.setName(THREAD_NAME_PREFIX + worker.getPoolIndex());
            worker.setDaemon(true);
            return worker;
        };
        return new ForkJoinPool(parallelism, factory, null, false);
    }
}
