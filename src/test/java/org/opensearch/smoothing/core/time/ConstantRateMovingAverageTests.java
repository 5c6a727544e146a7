/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.smoothing.core.time;

import org.opensearch.smoothing.core.mean.ExactWindowedMean;
import org.opensearch.smoothing.core.window.TimeWindowSpec;
import org.opensearch.smoothing.core.window.WindowSpec;
import org.opensearch.test.OpenSearchTestCase;

public class ConstantRateMovingAverageTests extends OpenSearchTestCase {

    public void testDurationsTranslatedToSamples() {
        double[] series = { 1, 2, 3, 4, 5, 6 };
        // 1.0 time unit at 2 samples per unit covers two samples on each side
        double[] result = ConstantRateMovingAverage.apply(series, 2.0, TimeWindowSpec.symmetric(1.0));
        assertArrayEquals(ExactWindowedMean.INSTANCE.apply(series, WindowSpec.symmetric(2)), result, 1e-9);
    }

    public void testFractionalSamplesTruncated() {
        double[] series = { 1, 2, 3, 4 };
        // 0.9 * 1.0 truncates to an empty window
        double[] result = ConstantRateMovingAverage.apply(series, 1.0, TimeWindowSpec.symmetric(0.9));
        assertArrayEquals(series, result, 0.0);
    }

    public void testAsymmetricWindow() {
        double[] series = { 1, 2, 3, 4, 5 };
        double[] result = ConstantRateMovingAverage.apply(series, 1.0, new TimeWindowSpec(1.0, 0.0));
        assertArrayEquals(new double[] { 1, 1.5, 2.5, 3.5, 4.5 }, result, 1e-9);
    }

    public void testInvalidFrequencyRejected() {
        double[] series = { 1, 2 };
        expectThrows(IllegalArgumentException.class, () -> ConstantRateMovingAverage.apply(series, 0.0, TimeWindowSpec.symmetric(1.0)));
        expectThrows(IllegalArgumentException.class, () -> ConstantRateMovingAverage.apply(series, -2.0, TimeWindowSpec.symmetric(1.0)));
    }

    public void testNullArgumentsRejected() {
        expectThrows(NullPointerException.class, () -> ConstantRateMovingAverage.apply(null, 1.0, TimeWindowSpec.symmetric(1.0)));
        expectThrows(NullPointerException.class, () -> ConstantRateMovingAverage.apply(new double[] { 1 }, 1.0, null));
    }
}
