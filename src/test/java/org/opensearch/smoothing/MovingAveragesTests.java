/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.smoothing;

import org.opensearch.smoothing.core.model.MultiSeries;
import org.opensearch.smoothing.core.window.TimeWindowSpec;
import org.opensearch.smoothing.core.window.WindowSpec;
import org.opensearch.test.OpenSearchTestCase;

import java.util.OptionalInt;

/**
 * Behaviour of the public entry points as seen by callers.
 */
public class MovingAveragesTests extends OpenSearchTestCase {

    private static final double DELTA = 1e-9;

    public void testResolveWindow() {
        assertEquals(WindowSpec.of(2, 2), MovingAverages.resolveWindow(2, OptionalInt.empty()));
        assertEquals(WindowSpec.of(2, 0), MovingAverages.resolveWindow(2, OptionalInt.of(0)));
    }

    public void testZeroWindowIsIdentity() {
        double[] series = { 3, Double.NaN, -1, 8 };
        for (double[] result : new double[][] {
            MovingAverages.exactMean(series, 0),
            MovingAverages.movingAverage(series, 0),
            MovingAverages.movingAverage(series, 0, 0) }) {
            assertEquals(3.0, result[0], 0.0);
            assertTrue(Double.isNaN(result[1]));
            assertEquals(-1.0, result[2], 0.0);
            assertEquals(8.0, result[3], 0.0);
        }
        assertArrayEquals(new double[] { 3, 5, 8 }, MovingAverages.fastMean(new double[] { 3, 5, 8 }, 0), 0.0);
    }

    public void testLengthPreserved() {
        int length = randomIntBetween(0, 50);
        double[] series = new double[length];
        for (int i = 0; i < length; i++) {
            series[i] = randomDouble();
        }
        int before = randomIntBetween(0, 60);
        int after = randomIntBetween(0, 60);
        assertEquals(length, MovingAverages.exactMean(series, before, after).length);
        assertEquals(length, MovingAverages.fastMean(series, before, after).length);
        assertEquals(length, MovingAverages.movingAverage(series, before, after).length);
    }

    public void testOmittedAfterIsSymmetric() {
        double[] series = { 4, 8, 15, 16, 23, 42 };
        assertArrayEquals(MovingAverages.exactMean(series, 2, 2), MovingAverages.exactMean(series, 2), 0.0);
        assertArrayEquals(MovingAverages.fastMean(series, 2, 2), MovingAverages.fastMean(series, 2), 0.0);
        assertArrayEquals(MovingAverages.movingAverage(series, 2, 2), MovingAverages.movingAverage(series, 2), 0.0);
    }

    public void testMissingSamplesExcluded() {
        assertArrayEquals(new double[] { 1, 2, 3 }, MovingAverages.movingAverage(new double[] { 1, Double.NaN, 3 }, 1), DELTA);
    }

    public void testTrailingWindow() {
        double[] series = { 1, 2, 3, 4, 5 };
        double[] expected = { 1, 1.5, 2.5, 3.5, 4.5 };
        assertArrayEquals(expected, MovingAverages.exactMean(series, 1, 0), DELTA);
        assertArrayEquals(expected, MovingAverages.fastMean(series, 1, 0), DELTA);
        assertArrayEquals(expected, MovingAverages.movingAverage(series, 1, 0), DELTA);
    }

    public void testFastMeanRejectsMissingSamples() {
        expectThrows(IllegalArgumentException.class, () -> MovingAverages.fastMean(new double[] { Double.NaN }, 1));
    }

    public void testNegativeCountsRejected() {
        expectThrows(IllegalArgumentException.class, () -> MovingAverages.movingAverage(new double[] { 1 }, -1));
        expectThrows(IllegalArgumentException.class, () -> MovingAverages.exactMean(new double[] { 1 }, 1, -1));
    }

    public void testMovingAverageByTime() {
        double[] series = { 1, 2, 3, 4, 5 };
        assertArrayEquals(new double[] { 1, 1.5, 2.5, 3.5, 4.5 }, MovingAverages.movingAverageByTime(series, 1.0, 1.0, 0.0), DELTA);
        assertArrayEquals(
            MovingAverages.movingAverage(series, 1),
            MovingAverages.movingAverageByTime(series, 2.0, 0.5),
            DELTA
        );
        expectThrows(IllegalArgumentException.class, () -> MovingAverages.movingAverageByTime(series, 0.0, 1.0));
    }

    public void testMovingAverageVariableRate() {
        double[] timestamps = { 0, 1, 2, 10, 11 };
        double[] series = { 1, 2, 3, 4, 5 };

        double[] result = MovingAverages.movingAverageVariableRate(timestamps, series, 1.0);
        assertEquals(1.5, result[0], DELTA);
        assertEquals(4.5, result[3], DELTA);

        double[][] batch = MovingAverages.movingAverageVariableRate(timestamps, new double[][] { series, series }, 1.0, 1.0);
        assertArrayEquals(result, batch[0], DELTA);
        assertArrayEquals(result, batch[1], DELTA);

        MultiSeries smoothed = MovingAverages.movingAverageVariableRate(
            MultiSeries.of(timestamps, series),
            TimeWindowSpec.symmetric(1.0)
        );
        assertArrayEquals(result, smoothed.getSeries(0), DELTA);
    }
}
