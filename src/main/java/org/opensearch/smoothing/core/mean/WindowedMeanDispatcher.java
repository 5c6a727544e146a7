/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.smoothing.core.mean;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.opensearch.common.settings.ClusterSettings;
import org.opensearch.common.settings.Settings;
import org.opensearch.smoothing.SmoothingPlugin;
import org.opensearch.smoothing.core.utils.SeriesUtils;
import org.opensearch.smoothing.core.window.WindowSpec;

/**
 * Routes each series to the cheapest strategy that is correct for it.
 *
 * <p>A series holding at least one missing sample goes to {@link ExactWindowedMean}, which excludes
 * missing samples from each mean. Any other series goes to {@link FastWindowedMean}. Both agree up
 * to floating-point rounding whenever no sample is missing.</p>
 *
 * <p>The fast path can be switched off with {@link SmoothingPlugin#FAST_PATH_ENABLED}, in which case
 * every series takes the exact path.</p>
 */
public final class WindowedMeanDispatcher implements WindowedMean {

    private static final Logger logger = LogManager.getLogger(WindowedMeanDispatcher.class);

    /** Shared stateless instance. */
    public static final WindowedMeanDispatcher INSTANCE = new WindowedMeanDispatcher();

    /** The name of this strategy. */
    public static final String NAME = "auto";

    /**
     * Whether series without missing samples may take the fast path.
     * Can be overridden via setFastPathEnabled for testing.
     */
    private static volatile boolean fastPathEnabled = true;

    private WindowedMeanDispatcher() {}

    /**
     * Read the fast path setting and register a listener for its dynamic updates.
     * Called from SmoothingPlugin.createComponents() once per node startup.
     *
     * @param clusterSettings the cluster settings for registering dynamic listeners
     * @param settings the current node settings
     */
    public static void initialize(ClusterSettings clusterSettings, Settings settings) {
        setFastPathEnabled(SmoothingPlugin.FAST_PATH_ENABLED.get(settings));
        clusterSettings.addSettingsUpdateConsumer(SmoothingPlugin.FAST_PATH_ENABLED, WindowedMeanDispatcher::setFastPathEnabled);
    }

    /**
     * @param enabled false to route every series to the exact path
     */
    public static void setFastPathEnabled(boolean enabled) {
        fastPathEnabled = enabled;
        logger.info("Moving average fast path enabled={}", enabled);
    }

    /**
     * @return whether the fast path may be selected
     */
    public static boolean isFastPathEnabled() {
        return fastPathEnabled;
    }

    /**
     * Picks the strategy for a series.
     *
     * @param series the series about to be averaged
     * @return the exact strategy if the series holds a missing sample or the fast path is disabled,
     *         the fast strategy otherwise
     */
    public static WindowedMean select(double[] series) {
        if (!fastPathEnabled || SeriesUtils.containsMissing(series)) {
            return ExactWindowedMean.INSTANCE;
        }
        return FastWindowedMean.INSTANCE;
    }

    @Override
    public double[] apply(double[] series, WindowSpec window) {
        SeriesUtils.requireNonNull(series, "series");
        WindowedMean strategy = select(series);
        if (logger.isDebugEnabled()) {
            logger.debug("Using {} moving average for length={}, window={}", strategy.getName(), series.length, window);
        }
        if (strategy == FastWindowedMean.INSTANCE) {
            // select() already ruled out missing samples
            return FastWindowedMean.compute(series, window);
        }
        return strategy.apply(series, window);
    }

    @Override
    public String getName() {
        return NAME;
    }
}
