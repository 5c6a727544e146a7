/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.smoothing.core.model;

import org.opensearch.smoothing.core.utils.SeriesUtils;

import java.util.Arrays;
import java.util.Locale;

/**
 * A rectangular batch of series sharing one timestamp axis.
 *
 * <p>Every series has exactly as many samples as the axis has timestamps. Missing samples are
 * represented by {@link Double#NaN}. The axis does not need to be uniformly spaced nor sorted.</p>
 *
 * <p>Instances are immutable: arrays are copied on the way in and on the way out, so a batch never
 * aliases storage owned by its caller.</p>
 */
public final class MultiSeries {

    private final double[] timestamps;
    private final double[][] values;

    private MultiSeries(double[] timestamps, double[][] values) {
        this.timestamps = timestamps;
        this.values = values;
    }

    /**
     * Creates a batch from a timestamp axis and any number of series.
     *
     * @param timestamps the shared timestamp axis
     * @param series the series, each as long as the axis
     * @return a new batch holding copies of the given arrays
     * @throws IllegalArgumentException if a series length differs from the axis length
     */
    public static MultiSeries of(double[] timestamps, double[]... series) {
        SeriesUtils.requireNonNull(timestamps, "timestamps");
        if (series == null) {
            throw new NullPointerException("series cannot be null");
        }
        double[][] copies = new double[series.length][];
        for (int s = 0; s < series.length; s++) {
            double[] row = SeriesUtils.requireNonNull(series[s], String.format(Locale.ROOT, "series[%d]", s));
            SeriesUtils.requireLength(row, timestamps.length, String.format(Locale.ROOT, "series[%d]", s));
            copies[s] = row.clone();
        }
        return new MultiSeries(timestamps.clone(), copies);
    }

    /**
     * @return number of samples in each series
     */
    public int length() {
        return timestamps.length;
    }

    /**
     * @return number of series in the batch
     */
    public int seriesCount() {
        return values.length;
    }

    /**
     * @return a copy of the timestamp axis
     */
    public double[] getTimestamps() {
        return timestamps.clone();
    }

    /**
     * @param index position of the series in the batch
     * @return a copy of the series
     */
    public double[] getSeries(int index) {
        return values[index].clone();
    }

    /**
     * @return a copy of every series, in batch order
     */
    public double[][] toArray() {
        double[][] copy = new double[values.length][];
        for (int s = 0; s < values.length; s++) {
            copy[s] = values[s].clone();
        }
        return copy;
    }

    /**
     * Builds a batch on the same timestamp axis holding new values.
     *
     * @param newValues the series of the new batch, each as long as this batch's axis
     * @return a new batch
     * @throws IllegalArgumentException if a series length differs from the axis length
     */
    public MultiSeries withValues(double[][] newValues) {
        return of(timestamps, newValues);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        MultiSeries that = (MultiSeries) obj;
        return Arrays.equals(timestamps, that.timestamps) && Arrays.deepEquals(values, that.values);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(timestamps) + Arrays.deepHashCode(values);
    }

    @Override
    public String toString() {
        return "MultiSeries{timestamps=" + Arrays.toString(timestamps) + ", values=" + Arrays.deepToString(values) + '}';
    }
}
