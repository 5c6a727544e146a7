/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.smoothing;

import org.opensearch.smoothing.core.mean.ExactWindowedMean;
import org.opensearch.smoothing.core.mean.FastWindowedMean;
import org.opensearch.smoothing.core.mean.WindowedMeanDispatcher;
import org.opensearch.smoothing.core.model.MultiSeries;
import org.opensearch.smoothing.core.time.ConstantRateMovingAverage;
import org.opensearch.smoothing.core.time.VariableRateMovingAverage;
import org.opensearch.smoothing.core.window.TimeWindowSpec;
import org.opensearch.smoothing.core.window.WindowSpec;

import java.util.OptionalInt;

/**
 * Entry points for sliding-window moving averages.
 *
 * <p>A series is a {@code double[]} in which {@link Double#NaN} marks a missing sample. Every operation
 * leaves its inputs untouched and returns freshly allocated arrays of the input's shape. Invalid
 * arguments raise {@link IllegalArgumentException} before any computation starts.</p>
 *
 * <h2>Usage Examples:</h2>
 * <pre>{@code
 * // average of each sample and the one before it
 * double[] smoothed = MovingAverages.movingAverage(y, 1, 0);
 *
 * // 0.5s on each side of a 100Hz signal
 * double[] byTime = MovingAverages.movingAverageByTime(y, 100.0, 0.5);
 *
 * // irregular sampling: 2 time units before, 1 after
 * double[] irregular = MovingAverages.movingAverageVariableRate(x, y, 2.0, 1.0);
 * }</pre>
 *
 * <p>Overloads without an {@code after} argument use a symmetric window.</p>
 */
public final class MovingAverages {

    private MovingAverages() {
        // Utility class
    }

    /**
     * Resolves a window request.
     *
     * @param before samples before the current index
     * @param after samples after the current index, or empty for a symmetric window
     * @return the resolved window
     * @throws IllegalArgumentException if a count is negative
     */
    public static WindowSpec resolveWindow(int before, OptionalInt after) {
        return WindowSpec.resolve(before, after);
    }

    /**
     * @see #exactMean(double[], WindowSpec)
     */
    public static double[] exactMean(double[] series, int before) {
        return exactMean(series, WindowSpec.symmetric(before));
    }

    /**
     * @see #exactMean(double[], WindowSpec)
     */
    public static double[] exactMean(double[] series, int before, int after) {
        return exactMean(series, WindowSpec.of(before, after));
    }

    /**
     * Moving average that excludes missing samples; always defined.
     *
     * @param series the series
     * @param window the window
     * @return a new series of the same length
     */
    public static double[] exactMean(double[] series, WindowSpec window) {
        return ExactWindowedMean.INSTANCE.apply(series, window);
    }

    /**
     * @see #fastMean(double[], WindowSpec)
     */
    public static double[] fastMean(double[] series, int before) {
        return fastMean(series, WindowSpec.symmetric(before));
    }

    /**
     * @see #fastMean(double[], WindowSpec)
     */
    public static double[] fastMean(double[] series, int before, int after) {
        return fastMean(series, WindowSpec.of(before, after));
    }

    /**
     * Linear-time moving average for series without missing samples.
     *
     * @param series the series, without NaN
     * @param window the window
     * @return a new series of the same length
     * @throws IllegalArgumentException if the series holds a missing sample
     */
    public static double[] fastMean(double[] series, WindowSpec window) {
        return FastWindowedMean.INSTANCE.apply(series, window);
    }

    /**
     * @see #movingAverage(double[], WindowSpec)
     */
    public static double[] movingAverage(double[] series, int before) {
        return movingAverage(series, WindowSpec.symmetric(before));
    }

    /**
     * @see #movingAverage(double[], WindowSpec)
     */
    public static double[] movingAverage(double[] series, int before, int after) {
        return movingAverage(series, WindowSpec.of(before, after));
    }

    /**
     * Moving average taking the fast path when the series has no missing sample and the exact path otherwise.
     *
     * @param series the series
     * @param window the window
     * @return a new series of the same length
     */
    public static double[] movingAverage(double[] series, WindowSpec window) {
        return WindowedMeanDispatcher.INSTANCE.apply(series, window);
    }

    /**
     * @see #movingAverageByTime(double[], double, TimeWindowSpec)
     */
    public static double[] movingAverageByTime(double[] series, double frequency, double timeBefore) {
        return movingAverageByTime(series, frequency, TimeWindowSpec.symmetric(timeBefore));
    }

    /**
     * @see #movingAverageByTime(double[], double, TimeWindowSpec)
     */
    public static double[] movingAverageByTime(double[] series, double frequency, double timeBefore, double timeAfter) {
        return movingAverageByTime(series, frequency, new TimeWindowSpec(timeBefore, timeAfter));
    }

    /**
     * Moving average over a series sampled at a constant rate, with the window given as durations.
     *
     * @param series the series
     * @param frequency samples per time unit
     * @param window the time window
     * @return a new series of the same length
     * @throws IllegalArgumentException if the frequency is not strictly positive
     */
    public static double[] movingAverageByTime(double[] series, double frequency, TimeWindowSpec window) {
        return ConstantRateMovingAverage.apply(series, frequency, window);
    }

    /**
     * @see #movingAverageVariableRate(double[], double[], TimeWindowSpec)
     */
    public static double[] movingAverageVariableRate(double[] timestamps, double[] series, double timeBefore) {
        return movingAverageVariableRate(timestamps, series, TimeWindowSpec.symmetric(timeBefore));
    }

    /**
     * @see #movingAverageVariableRate(double[], double[], TimeWindowSpec)
     */
    public static double[] movingAverageVariableRate(double[] timestamps, double[] series, double timeBefore, double timeAfter) {
        return movingAverageVariableRate(timestamps, series, new TimeWindowSpec(timeBefore, timeAfter));
    }

    /**
     * Moving average over an irregularly sampled series.
     *
     * @param timestamps the timestamp of every sample
     * @param series the series, as long as the timestamps
     * @param window the time window
     * @return a new series of the same length
     * @throws IllegalArgumentException if the lengths differ
     */
    public static double[] movingAverageVariableRate(double[] timestamps, double[] series, TimeWindowSpec window) {
        return VariableRateMovingAverage.apply(timestamps, series, window);
    }

    /**
     * @see #movingAverageVariableRate(double[], double[][], TimeWindowSpec)
     */
    public static double[][] movingAverageVariableRate(double[] timestamps, double[][] batch, double timeBefore) {
        return movingAverageVariableRate(timestamps, batch, TimeWindowSpec.symmetric(timeBefore));
    }

    /**
     * @see #movingAverageVariableRate(double[], double[][], TimeWindowSpec)
     */
    public static double[][] movingAverageVariableRate(double[] timestamps, double[][] batch, double timeBefore, double timeAfter) {
        return movingAverageVariableRate(timestamps, batch, new TimeWindowSpec(timeBefore, timeAfter));
    }

    /**
     * Moving average over a batch of irregularly sampled series sharing one timestamp axis.
     *
     * @param timestamps the shared timestamp axis
     * @param batch the series, each as long as the axis
     * @param window the time window
     * @return a new batch of the same shape
     * @throws IllegalArgumentException if a series length differs from the axis length
     */
    public static double[][] movingAverageVariableRate(double[] timestamps, double[][] batch, TimeWindowSpec window) {
        return VariableRateMovingAverage.apply(timestamps, batch, window);
    }

    /**
     * Moving average over a batch on its own timestamp axis.
     *
     * @param batch the batch
     * @param window the time window
     * @return a new batch on the same axis
     */
    public static MultiSeries movingAverageVariableRate(MultiSeries batch, TimeWindowSpec window) {
        return VariableRateMovingAverage.apply(batch, window);
    }
}
