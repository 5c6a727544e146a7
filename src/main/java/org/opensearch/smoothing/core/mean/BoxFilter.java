/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.smoothing.core.mean;

import org.opensearch.smoothing.core.utils.SeriesUtils;

import java.util.Locale;

/**
 * Centred uniform (box) filter computed with a running sum, so the cost is O(n + size)
 * regardless of the window width.
 *
 * <p>The window of index {@code i} spans {@code [i - size / 2, i - size / 2 + size - 1]}: for an odd
 * size it has as many samples on each side of {@code i}, for an even size one more on the left.
 * Positions outside the series are synthesized by mirroring the series about its edges, the edge
 * sample included ("reflect" extension):</p>
 * <pre>
 *   d c b a | a b c d | d c b a
 * </pre>
 * <p>Reflected values are only a convenience that keeps every window full. Callers that need a
 * mean restricted to samples inside the series must recompute the edges themselves.</p>
 */
public final class BoxFilter {

    private BoxFilter() {
        // Utility class
    }

    /**
     * Applies the filter.
     *
     * @param series the input series, expected to hold no missing samples
     * @param size the window width, at least 1
     * @return a new series of the same length holding the centred means
     * @throws IllegalArgumentException if {@code size < 1}
     */
    public static double[] uniformFilter(double[] series, int size) {
        SeriesUtils.requireNonNull(series, "series");
        if (size < 1) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, "filter size must be >= 1, got %d", size));
        }
        int n = series.length;
        double[] result = new double[n];
        if (n == 0) {
            return result;
        }

        long left = size / 2;
        MeanWindow window = new MeanWindow();
        for (long k = -left; k < size - left; k++) {
            window.add(series[reflect(k, n)]);
        }
        result[0] = window.mean();

        for (int i = 1; i < n; i++) {
            long leaving = i - 1 - left;
            window.remove(series[reflect(leaving, n)]);
            window.add(series[reflect(leaving + size, n)]);
            result[i] = window.mean();
        }
        return result;
    }

    /**
     * Maps a virtual position to an index of a series of length {@code n} under the reflect policy.
     * The mirrored sequence is periodic with period {@code 2n}.
     *
     * @param position any position, possibly outside {@code [0, n)}
     * @param n the series length, at least 1
     * @return the index whose sample stands at {@code position}
     */
    static int reflect(long position, int n) {
        long period = 2L * n;
        long folded = Math.floorMod(position, period);
        return (int) (folded < n ? folded : period - 1 - folded);
    }
}
