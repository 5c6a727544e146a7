/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.smoothing.core.mean;

import org.opensearch.smoothing.core.utils.SeriesUtils;
import org.opensearch.smoothing.core.window.WindowSpec;

/**
 * Reference moving average: evaluates the clipped window of every index directly.
 *
 * <p>Missing samples are excluded from each mean, and an index whose whole window is missing yields NaN.
 * This makes it the only strategy that is correct for series holding missing samples. The cost is
 * proportional to {@code n * min(before + after + 1, n)}.</p>
 *
 * <p>{@link #meanAt(double[], int, WindowSpec)} is also the ground truth that
 * {@link FastWindowedMean} falls back to near the edges of a series. Both accumulate through
 * {@link MeanWindow}, so they agree on infinite samples and on wide magnitude ranges.</p>
 */
public final class ExactWindowedMean implements WindowedMean {

    /** Shared stateless instance. */
    public static final ExactWindowedMean INSTANCE = new ExactWindowedMean();

    /** The name of this strategy. */
    public static final String NAME = "exact";

    private ExactWindowedMean() {}

    @Override
    public double[] apply(double[] series, WindowSpec window) {
        SeriesUtils.requireNonNull(series, "series");
        double[] result = new double[series.length];
        for (int i = 0; i < series.length; i++) {
            result[i] = meanAt(series, i, window);
        }
        return result;
    }

    /**
     * Mean of the non-missing samples inside the clipped window of one index.
     *
     * @param series the input series
     * @param index the current index
     * @param window the resolved window
     * @return the mean, or NaN if every sample of the window is missing
     */
    public static double meanAt(double[] series, int index, WindowSpec window) {
        int lo = window.lowerBound(index);
        int hi = window.upperBound(index, series.length);
        MeanWindow meanWindow = new MeanWindow();
        for (int j = lo; j <= hi; j++) {
            meanWindow.add(series[j]);
        }
        return meanWindow.mean();
    }

    @Override
    public String getName() {
        return NAME;
    }
}
