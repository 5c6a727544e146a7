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
 * Linear-time moving average for series without missing samples.
 *
 * <p>The series is first smoothed by a centred {@link BoxFilter} of width {@code before + after + 1}.
 * A centred window does not match an asymmetric request, so the filtered series is realigned by
 * {@code shift = ceil((after - before) / 2)} positions into a fresh buffer: after the shift, the box
 * of every index spans exactly {@code [i - before, i + after]}.</p>
 *
 * <p>That box is only correct where it lies fully inside the series. Near the start (indices below
 * {@code before + |shift|}) and near the end (indices from {@code n - after - |shift|}) it either
 * reached reflected samples or was shifted out of the buffer, so those indices are recomputed with
 * {@link ExactWindowedMean#meanAt(double[], int, WindowSpec)}. When the window is wider than the
 * series no index is interior and the filter pass is skipped altogether.</p>
 *
 * <p>The result matches {@link ExactWindowedMean} up to floating-point rounding of the running sum.</p>
 */
public final class FastWindowedMean implements WindowedMean {

    /** Shared stateless instance. */
    public static final FastWindowedMean INSTANCE = new FastWindowedMean();

    /** The name of this strategy. */
    public static final String NAME = "fast";

    private FastWindowedMean() {}

    /**
     * {@inheritDoc}
     *
     * @throws IllegalArgumentException if the series holds a missing sample
     */
    @Override
    public double[] apply(double[] series, WindowSpec window) {
        SeriesUtils.requireNonNull(series, "series");
        if (SeriesUtils.containsMissing(series)) {
            throw new IllegalArgumentException("fast moving average requires a series without missing (NaN) samples");
        }
        return compute(series, window);
    }

    /**
     * Same as {@link #apply(double[], WindowSpec)} without the missing-sample scan. The caller guarantees
     * that the series holds no NaN.
     */
    static double[] compute(double[] series, WindowSpec window) {
        int n = series.length;
        if (n == 0) {
            return new double[0];
        }
        int before = window.before();
        int after = window.after();
        long shift = Math.floorDiv((long) after - before + 1, 2);
        long absShift = Math.abs(shift);

        double[] result;
        if (window.size() <= n) {
            result = realign(BoxFilter.uniformFilter(series, (int) window.size()), (int) shift);
        } else {
            // every index falls in one of the edge ranges below
            result = SeriesUtils.missing(n);
        }

        int headEnd = (int) Math.min(before + absShift, n);
        for (int i = 0; i < headEnd; i++) {
            result[i] = ExactWindowedMean.meanAt(series, i, window);
        }
        int tailStart = (int) Math.max(Math.max(n - after - absShift, 0), headEnd);
        for (int i = n - 1; i >= tailStart; i--) {
            result[i] = ExactWindowedMean.meanAt(series, i, window);
        }
        return result;
    }

    /**
     * Moves every value {@code shift} positions towards the start (positive shift) or the end
     * (negative shift) of a new buffer. Positions left without a value are NaN.
     */
    static double[] realign(double[] filtered, int shift) {
        int n = filtered.length;
        if (shift == 0) {
            return filtered;
        }
        double[] shifted = SeriesUtils.missing(n);
        int distance = Math.abs(shift);
        if (distance >= n) {
            return shifted;
        }
        if (shift > 0) {
            System.arraycopy(filtered, distance, shifted, 0, n - distance);
        } else {
            System.arraycopy(filtered, 0, shifted, distance, n - distance);
        }
        return shifted;
    }

    @Override
    public String getName() {
        return NAME;
    }
}
