/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.smoothing.core.mean;

import org.opensearch.smoothing.core.window.WindowSpec;

/**
 * Computes, at every index of a series, the mean of the samples inside a clipped sample-domain window.
 *
 * <h2>Window semantics</h2>
 * For a series {@code y} of length {@code n} and a window {@code (before, after)}, the output at index
 * {@code i} is the mean of {@code y[max(i - before, 0) .. min(i + after, n - 1)]}. Windows are clipped
 * at the edges of the series: no sample is synthesized outside of it.
 *
 * <h2>Missing values</h2>
 * A missing sample is {@link Double#NaN}. Implementations either exclude missing samples from the mean
 * (an all-missing window yields NaN) or reject series holding them.
 *
 * <h2>Ownership</h2>
 * The input series is never modified; the result is always a freshly allocated array of the same length.
 */
public interface WindowedMean {

    /**
     * Applies the moving average.
     *
     * @param series the input series, NaN marking missing samples
     * @param window the resolved window
     * @return a new series of the same length
     */
    double[] apply(double[] series, WindowSpec window);

    /**
     * Short name used in logs and stage output.
     *
     * @return the name of this strategy
     */
    String getName();
}
