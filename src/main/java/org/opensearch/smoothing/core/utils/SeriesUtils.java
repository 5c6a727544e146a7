/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.smoothing.core.utils;

import java.util.Arrays;
import java.util.Locale;
import java.util.Objects;

/**
 * Helpers shared by the windowed mean implementations. A series is a plain {@code double[]}
 * where {@link Double#NaN} marks a missing sample.
 */
public final class SeriesUtils {

    private SeriesUtils() {
        // Utility class
    }

    /**
     * Checks whether a series holds at least one missing sample.
     *
     * @param series the series to scan
     * @return true if any element is NaN
     */
    public static boolean containsMissing(double[] series) {
        for (double value : series) {
            if (Double.isNaN(value)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Checks whether a timestamp axis is sorted in non-decreasing order.
     *
     * @param timestamps the axis to check
     * @return true if {@code timestamps[i] <= timestamps[i + 1]} for every i
     */
    public static boolean isNonDecreasing(double[] timestamps) {
        for (int i = 1; i < timestamps.length; i++) {
            if (timestamps[i] < timestamps[i - 1]) {
                return false;
            }
        }
        return true;
    }

    /**
     * Null check producing the message format used across stages and engines.
     *
     * @param array the array to check
     * @param name argument name for the message
     * @return the array
     * @throws NullPointerException if the array is null
     */
    public static double[] requireNonNull(double[] array, String name) {
        return Objects.requireNonNull(array, () -> name + " cannot be null");
    }

    /**
     * Validates that a series has the expected length.
     *
     * @param series the series to check
     * @param expectedLength the required length
     * @param name argument name for the message
     * @throws IllegalArgumentException on a length mismatch
     */
    public static void requireLength(double[] series, int expectedLength, String name) {
        if (series.length != expectedLength) {
            throw new IllegalArgumentException(
                String.format(Locale.ROOT, "%s has length %d but the timestamp axis has length %d", name, series.length, expectedLength)
            );
        }
    }

    /**
     * Validates that no timestamp is NaN, since a NaN timestamp can never satisfy a window predicate.
     *
     * @param timestamps the axis to check
     * @throws IllegalArgumentException if a timestamp is NaN
     */
    public static void requireNoMissingTimestamps(double[] timestamps) {
        for (int i = 0; i < timestamps.length; i++) {
            if (Double.isNaN(timestamps[i])) {
                throw new IllegalArgumentException(String.format(Locale.ROOT, "timestamp at index %d is NaN", i));
            }
        }
    }

    /**
     * Allocates a series of the given length filled with missing samples.
     *
     * @param length the length of the series
     * @return a new array of NaN
     */
    public static double[] missing(int length) {
        double[] result = new double[length];
        Arrays.fill(result, Double.NaN);
        return result;
    }
}
