/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.smoothing;

import org.opensearch.client.Client;
import org.opensearch.cluster.metadata.IndexNameExpressionResolver;
import org.opensearch.cluster.service.ClusterService;
import org.opensearch.common.settings.Setting;
import org.opensearch.core.common.io.stream.NamedWriteableRegistry;
import org.opensearch.core.xcontent.NamedXContentRegistry;
import org.opensearch.env.Environment;
import org.opensearch.env.NodeEnvironment;
import org.opensearch.plugins.Plugin;
import org.opensearch.repositories.RepositoriesService;
import org.opensearch.script.ScriptService;
import org.opensearch.smoothing.core.mean.WindowedMeanDispatcher;
import org.opensearch.smoothing.query.stage.ParallelProcessingConfig;
import org.opensearch.threadpool.ThreadPool;
import org.opensearch.watcher.ResourceWatcherService;

import java.io.IOException;
import java.util.Collection;
import java.util.List;
import java.util.function.Supplier;

/**
 * Plugin for moving-average smoothing of sampled series
 */
public class SmoothingPlugin extends Plugin {

    /**
     * Whether series without missing samples take the linear-time path. When disabled every
     * series is averaged window by window.
     */
    public static final Setting<Boolean> FAST_PATH_ENABLED = Setting.boolSetting(
        "smoothing.moving_average.fast_path.enabled",
        true,
        Setting.Property.NodeScope,
        Setting.Property.Dynamic
    );

    /**
     * Whether the variable-rate moving average may run on the dedicated parallel pool.
     */
    public static final Setting<Boolean> PARALLEL_ENABLED = Setting.boolSetting(
        "smoothing.variable_rate.parallel_processing.enabled",
        false,
        Setting.Property.NodeScope,
        Setting.Property.Dynamic
    );

    /**
     * Smallest batch, in cells (series count times series length), that the variable-rate moving average
     * splits across threads.
     */
    public static final Setting<Long> PARALLEL_MIN_CELLS = Setting.longSetting(
        "smoothing.variable_rate.parallel_processing.min_cells",
        10_000L,
        0L,
        Setting.Property.NodeScope,
        Setting.Property.Dynamic
    );

    /**
     * Parallelism of the dedicated pool. Defaults to half the available processors.
     */
    public static final Setting<Integer> PARALLEL_POOL_SIZE = Setting.intSetting(
        "smoothing.variable_rate.parallel_processing.pool_size",
        Math.max(1, Runtime.getRuntime().availableProcessors() / 2),
        1,
        Setting.Property.NodeScope,
        Setting.Property.Dynamic
    );

    /**
     * Default constructor
     */
    public SmoothingPlugin() {}

    @Override
    public List<Setting<?>> getSettings() {
        return List.of(FAST_PATH_ENABLED, PARALLEL_ENABLED, PARALLEL_MIN_CELLS, PARALLEL_POOL_SIZE);
    }

    @Override
    public Collection<Object> createComponents(
        Client client,
        ClusterService clusterService,
        ThreadPool threadPool,
        ResourceWatcherService resourceWatcherService,
        ScriptService scriptService,
        NamedXContentRegistry xContentRegistry,
        Environment environment,
        NodeEnvironment nodeEnvironment,
        NamedWriteableRegistry namedWriteableRegistry,
        IndexNameExpressionResolver indexNameExpressionResolver,
        Supplier<RepositoriesService> repositoriesServiceSupplier
    ) {
        WindowedMeanDispatcher.initialize(clusterService.getClusterSettings(), environment.settings());
        ParallelProcessingConfig.initialize(clusterService.getClusterSettings(), environment.settings());
        return List.of();
    }

    @Override
    public void close() throws IOException {
        ParallelProcessingConfig.shutdown();
    }
}
