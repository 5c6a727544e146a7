/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.smoothing.core.mean;

import org.opensearch.common.settings.ClusterSettings;
import org.opensearch.common.settings.Setting;
import org.opensearch.common.settings.Settings;
import org.opensearch.smoothing.SmoothingPlugin;
import org.opensearch.smoothing.core.window.WindowSpec;
import org.opensearch.test.OpenSearchTestCase;

import java.util.Set;

public class WindowedMeanDispatcherTests extends OpenSearchTestCase {

    @Override
    public void tearDown() throws Exception {
        WindowedMeanDispatcher.setFastPathEnabled(true);
        super.tearDown();
    }

    public void testSelectsFastPathForCompleteSeries() {
        assertSame(FastWindowedMean.INSTANCE, WindowedMeanDispatcher.select(new double[] { 1, 2, 3 }));
    }

    public void testSelectsExactPathWhenSamplesMissing() {
        assertSame(ExactWindowedMean.INSTANCE, WindowedMeanDispatcher.select(new double[] { 1, Double.NaN, 3 }));
    }

    public void testSelectsExactPathWhenFastPathDisabled() {
        WindowedMeanDispatcher.setFastPathEnabled(false);
        assertSame(ExactWindowedMean.INSTANCE, WindowedMeanDispatcher.select(new double[] { 1, 2, 3 }));
    }

    public void testResultIndependentOfSelectedPath() {
        double[] series = new double[64];
        for (int i = 0; i < series.length; i++) {
            series[i] = randomDoubleBetween(-10.0, 10.0, true);
        }
        WindowSpec window = WindowSpec.of(randomIntBetween(0, 8), randomIntBetween(0, 8));

        double[] fast = WindowedMeanDispatcher.INSTANCE.apply(series, window);
        WindowedMeanDispatcher.setFastPathEnabled(false);
        double[] exact = WindowedMeanDispatcher.INSTANCE.apply(series, window);
        assertArrayEquals(exact, fast, 1e-9);
    }

    public void testMissingSamplesExcluded() {
        double[] result = WindowedMeanDispatcher.INSTANCE.apply(new double[] { 1, Double.NaN, 3 }, WindowSpec.symmetric(1));
        assertArrayEquals(new double[] { 1, 2, 3 }, result, 1e-12);
    }

    public void testInitializeAndDynamicUpdates() {
        String key = SmoothingPlugin.FAST_PATH_ENABLED.getKey();
        Settings initialSettings = Settings.builder().put(key, false).build();
        Set<Setting<?>> settingsSet = Set.of(SmoothingPlugin.FAST_PATH_ENABLED);
        ClusterSettings clusterSettings = new ClusterSettings(initialSettings, settingsSet);

        WindowedMeanDispatcher.initialize(clusterSettings, initialSettings);
        assertFalse(WindowedMeanDispatcher.isFastPathEnabled());

        clusterSettings.applySettings(Settings.builder().put(key, true).build());
        assertTrue(WindowedMeanDispatcher.isFastPathEnabled());
    }
}
