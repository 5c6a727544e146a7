/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.smoothing.core.time;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.opensearch.smoothing.core.mean.WindowedMeanDispatcher;
import org.opensearch.smoothing.core.utils.SeriesUtils;
import org.opensearch.smoothing.core.window.TimeWindowSpec;
import org.opensearch.smoothing.core.window.WindowSpec;

/**
 * Moving average with a window given as a duration, for series sampled at a known constant rate.
 *
 * <p>The durations are translated into sample counts with {@link TimeWindowSpec#toWindowSpec(double)}
 * (truncated toward zero) and the series is handed to the {@link WindowedMeanDispatcher}. For irregular
 * sampling use {@link VariableRateMovingAverage} instead.</p>
 */
public final class ConstantRateMovingAverage {

    private static final Logger logger = LogManager.getLogger(ConstantRateMovingAverage.class);

    private ConstantRateMovingAverage() {
        // Utility class
    }

    /**
     * Applies the moving average.
     *
     * @param series the series, NaN marking missing samples
     * @param frequency sampling frequency, in samples per time unit of the window
     * @param window the time window
     * @return a new series of the same length
     * @throws IllegalArgumentException if the frequency is not strictly positive and finite
     */
    public static double[] apply(double[] series, double frequency, TimeWindowSpec window) {
        SeriesUtils.requireNonNull(series, "series");
        if (window == null) {
            throw new NullPointerException("window cannot be null");
        }
        WindowSpec samples = window.toWindowSpec(frequency);
        logger.debug("Translated time window {} at frequency {} to {}", window, frequency, samples);
        return WindowedMeanDispatcher.INSTANCE.apply(series, samples);
    }
}
