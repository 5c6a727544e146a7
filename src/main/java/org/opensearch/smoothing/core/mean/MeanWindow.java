/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.smoothing.core.mean;

/**
 * Running sum over the samples currently inside a window, with the count of samples that are not missing.
 *
 * <p>Missing samples (NaN) are skipped on both {@link #add(double)} and {@link #remove(double)} and do
 * not count towards the non-missing count, so {@link #mean()} averages only over real observations and
 * is NaN when there are none.</p>
 *
 * <p>Infinite samples are counted per sign instead of being added to the sum, so one leaving the window
 * restores the finite sum exactly. Finite samples are accumulated with Neumaier compensated summation:
 * a large sample leaving the window does not take the small ones still inside it along with it.</p>
 *
 * <p>Removing a value that was never added corrupts the sum; callers slide the window in FIFO order.</p>
 */
public final class MeanWindow {

    private double finiteSum;
    private double compensation;
    private int numNonMissing;
    private int numPositiveInfinite;
    private int numNegativeInfinite;

    /**
     * Adds a sample entering the window.
     *
     * @param value the sample, NaN if missing
     */
    public void add(double value) {
        if (Double.isNaN(value)) {
            return;
        }
        numNonMissing++;
        if (value == Double.POSITIVE_INFINITY) {
            numPositiveInfinite++;
        } else if (value == Double.NEGATIVE_INFINITY) {
            numNegativeInfinite++;
        } else {
            accumulate(value);
        }
    }

    /**
     * Removes a sample leaving the window.
     *
     * @param value the sample, NaN if missing
     */
    public void remove(double value) {
        if (Double.isNaN(value)) {
            return;
        }
        numNonMissing--;
        if (value == Double.POSITIVE_INFINITY) {
            numPositiveInfinite--;
        } else if (value == Double.NEGATIVE_INFINITY) {
            numNegativeInfinite--;
        } else {
            accumulate(-value);
        }
    }

    private void accumulate(double value) {
        double total = finiteSum + value;
        if (Math.abs(finiteSum) >= Math.abs(value)) {
            compensation += (finiteSum - total) + value;
        } else {
            compensation += (value - total) + finiteSum;
        }
        finiteSum = total;
    }

    /**
     * Empties the window.
     */
    public void clear() {
        finiteSum = 0;
        compensation = 0;
        numNonMissing = 0;
        numPositiveInfinite = 0;
        numNegativeInfinite = 0;
    }

    /**
     * @return sum of the non-missing samples in the window; infinite when infinite samples of one sign are
     *         present, NaN when both signs are
     */
    public double sum() {
        if (numPositiveInfinite > 0 && numNegativeInfinite > 0) {
            return Double.NaN;
        }
        if (numPositiveInfinite > 0) {
            return Double.POSITIVE_INFINITY;
        }
        if (numNegativeInfinite > 0) {
            return Double.NEGATIVE_INFINITY;
        }
        return finiteSum + compensation;
    }

    /**
     * @return number of non-missing samples in the window
     */
    public int getNonMissingCount() {
        return numNonMissing;
    }

    /**
     * @return mean of the non-missing samples, or NaN if every sample in the window is missing
     */
    public double mean() {
        if (numNonMissing == 0) {
            return Double.NaN;
        }
        return sum() / numNonMissing;
    }
}
