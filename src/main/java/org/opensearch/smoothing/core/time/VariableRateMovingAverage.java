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
import org.opensearch.smoothing.core.mean.MeanWindow;
import org.opensearch.smoothing.core.model.MultiSeries;
import org.opensearch.smoothing.core.utils.SeriesUtils;
import org.opensearch.smoothing.core.window.TimeWindowSpec;
import org.opensearch.smoothing.query.stage.ParallelProcessingConfig;

import java.util.Locale;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.IntConsumer;
import java.util.stream.IntStream;

/**
 * Moving average over series sampled at irregular times.
 *
 * <p>A fixed sample count means nothing when the spacing varies, so the window is defined on timestamp
 * values only: the output at index {@code i} is the mean of every sample {@code j} with
 * {@code x[i] - before <= x[j] <= x[i] + after}, whatever the order of {@code i} and {@code j}.
 * Missing samples are excluded; an index whose window holds only missing samples yields NaN.</p>
 *
 * <p>A batch of series sharing one timestamp axis is processed together so each window is located once
 * for the whole batch. When the axis is sorted in non-decreasing order the windows are contiguous and
 * both of their bounds only move forward, so they are found with a two-pointer sweep and each series is
 * averaged with a sliding {@link MeanWindow}: O(n) per series. Otherwise every index scans the whole axis
 * and the cost is O(n²).</p>
 *
 * <p>Large batches can be evaluated in parallel, see {@link ParallelProcessingConfig}. The sorted path
 * parallelizes across series and the unsorted path across indices; results are identical to the
 * sequential evaluation.</p>
 */
public final class VariableRateMovingAverage {

    private static final Logger logger = LogManager.getLogger(VariableRateMovingAverage.class);

    private static volatile ParallelProcessingConfig parallelConfig = ParallelProcessingConfig.defaults();

    private VariableRateMovingAverage() {
        // Utility class
    }

    /**
     * Installs the configuration deciding when batches are evaluated in parallel.
     *
     * @param config the configuration
     */
    public static void setParallelConfig(ParallelProcessingConfig config) {
        parallelConfig = config;
    }

    /**
     * @return the current parallel processing configuration
     */
    public static ParallelProcessingConfig getParallelConfig() {
        return parallelConfig;
    }

    /**
     * Smooths a single series.
     *
     * @param timestamps the timestamp axis
     * @param series the series, as long as the axis
     * @param window the time window
     * @return a new series of the same length
     * @throws IllegalArgumentException if the lengths differ or a timestamp is NaN
     */
    public static double[] apply(double[] timestamps, double[] series, TimeWindowSpec window) {
        SeriesUtils.requireNonNull(series, "series");
        return apply(timestamps, new double[][] { series }, window)[0];
    }

    /**
     * Smooths every series of a batch.
     *
     * @param timestamps the timestamp axis shared by the batch
     * @param batch the series, each as long as the axis
     * @param window the time window
     * @return a new batch with as many series as the input, each of the same length
     * @throws IllegalArgumentException if a series length differs from the axis length or a timestamp is NaN
     */
    public static double[][] apply(double[] timestamps, double[][] batch, TimeWindowSpec window) {
        SeriesUtils.requireNonNull(timestamps, "timestamps");
        if (batch == null) {
            throw new NullPointerException("batch cannot be null");
        }
        if (window == null) {
            throw new NullPointerException("window cannot be null");
        }
        int n = timestamps.length;
        for (int s = 0; s < batch.length; s++) {
            String name = String.format(Locale.ROOT, "series[%d]", s);
            SeriesUtils.requireNonNull(batch[s], name);
            SeriesUtils.requireLength(batch[s], n, name);
        }
        SeriesUtils.requireNoMissingTimestamps(timestamps);

        double[][] result = new double[batch.length][n];
        if (n == 0 || batch.length == 0) {
            return result;
        }

        boolean sorted = SeriesUtils.isNonDecreasing(timestamps);
        boolean parallel = parallelConfig.allowsParallel((long) batch.length * n);
        if (logger.isDebugEnabled()) {
            logger.debug(
                "Variable-rate moving average: length={}, seriesCount={}, sortedTimestamps={}, parallel={}",
                n,
                batch.length,
                sorted,
                parallel
            );
        }

        if (sorted) {
            int[] lower = new int[n];
            int[] upper = new int[n];
            sweepBounds(timestamps, window, lower, upper);
            forEach(batch.length, parallel, s -> slideMeans(batch[s], lower, upper, result[s]));
        } else {
            forEach(n, parallel, i -> scanMeans(timestamps, batch, window, i, result));
        }
        return result;
    }

    /**
     * Smooths every series of a batch on the batch's own timestamp axis.
     *
     * @param batch the batch
     * @param window the time window
     * @return a new batch on the same axis
     */
    public static MultiSeries apply(MultiSeries batch, TimeWindowSpec window) {
        if (batch == null) {
            throw new NullPointerException("batch cannot be null");
        }
        return batch.withValues(apply(batch.getTimestamps(), batch.toArray(), window));
    }

    /**
     * For a non-decreasing axis, finds the first and last index of every window. Both bounds are
     * non-decreasing in {@code i}. Every window holds at least its own index, so {@code lower[i] <= i <= upper[i]}.
     */
    static void sweepBounds(double[] timestamps, TimeWindowSpec window, int[] lower, int[] upper) {
        int n = timestamps.length;
        int lo = 0;
        int hi = 0;
        for (int i = 0; i < n; i++) {
            double center = timestamps[i];
            while (timestamps[lo] < center - window.before()) {
                lo++;
            }
            if (hi < i) {
                hi = i;
            }
            while (hi + 1 < n && timestamps[hi + 1] <= center + window.after()) {
                hi++;
            }
            lower[i] = lo;
            upper[i] = hi;
        }
    }

    private static void slideMeans(double[] series, int[] lower, int[] upper, double[] out) {
        MeanWindow meanWindow = new MeanWindow();
        int lo = 0;
        int hi = -1;
        for (int i = 0; i < out.length; i++) {
            while (hi < upper[i]) {
                meanWindow.add(series[++hi]);
            }
            while (lo < lower[i]) {
                meanWindow.remove(series[lo++]);
            }
            out[i] = meanWindow.mean();
        }
    }

    private static void scanMeans(double[] timestamps, double[][] batch, TimeWindowSpec window, int index, double[][] result) {
        int n = timestamps.length;
        int[] members = new int[n];
        int count = 0;
        double center = timestamps[index];
        for (int j = 0; j < n; j++) {
            if (window.contains(center, timestamps[j])) {
                members[count++] = j;
            }
        }
        MeanWindow meanWindow = new MeanWindow();
        for (int s = 0; s < batch.length; s++) {
            double[] series = batch[s];
            meanWindow.clear();
            for (int k = 0; k < count; k++) {
                meanWindow.add(series[members[k]]);
            }
            result[s][index] = meanWindow.mean();
        }
    }

    private static void forEach(int count, boolean parallel, IntConsumer task) {
        if (parallel) {
            ForkJoinPool pool = ParallelProcessingConfig.currentPool();
            try {
                pool.submit(() -> IntStream.range(0, count).parallel().forEach(task)).join();
                return;
            } catch (RejectedExecutionException e) {
                // pool was resized or shut down after the lookup
                logger.debug("Parallel pool rejected a batch of {} tasks, evaluating it sequentially", count, e);
            }
        }
        for (int i = 0; i < count; i++) {
            task.accept(i);
        }
    }
}
