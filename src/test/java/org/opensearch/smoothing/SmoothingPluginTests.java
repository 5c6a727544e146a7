/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.smoothing;

import org.opensearch.common.settings.Setting;
import org.opensearch.common.settings.Settings;
import org.opensearch.test.OpenSearchTestCase;

import java.util.List;

public class SmoothingPluginTests extends OpenSearchTestCase {

    public void testGetSettings() throws Exception {
        try (SmoothingPlugin plugin = new SmoothingPlugin()) {
            List<Setting<?>> settings = plugin.getSettings();
            assertEquals(4, settings.size());
            assertTrue(settings.contains(SmoothingPlugin.FAST_PATH_ENABLED));
            assertTrue(settings.contains(SmoothingPlugin.PARALLEL_ENABLED));
            assertTrue(settings.contains(SmoothingPlugin.PARALLEL_MIN_CELLS));
            assertTrue(settings.contains(SmoothingPlugin.PARALLEL_POOL_SIZE));
        }
    }

    public void testSettingDefaults() {
        assertTrue(SmoothingPlugin.FAST_PATH_ENABLED.get(Settings.EMPTY));
        assertFalse(SmoothingPlugin.PARALLEL_ENABLED.get(Settings.EMPTY));
        assertEquals(Long.valueOf(10_000L), SmoothingPlugin.PARALLEL_MIN_CELLS.get(Settings.EMPTY));
        assertTrue(SmoothingPlugin.PARALLEL_POOL_SIZE.get(Settings.EMPTY) >= 1);
    }

    public void testSettingsAreDynamic() {
        assertTrue(SmoothingPlugin.FAST_PATH_ENABLED.isDynamic());
        assertTrue(SmoothingPlugin.PARALLEL_ENABLED.isDynamic());
        assertTrue(SmoothingPlugin.PARALLEL_MIN_CELLS.isDynamic());
        assertTrue(SmoothingPlugin.PARALLEL_POOL_SIZE.isDynamic());
    }

    public void testInvalidSettingValuesRejected() {
        Settings negativeMinimum = Settings.builder().put(SmoothingPlugin.PARALLEL_MIN_CELLS.getKey(), -1).build();
        expectThrows(IllegalArgumentException.class, () -> SmoothingPlugin.PARALLEL_MIN_CELLS.get(negativeMinimum));

        Settings zeroPool = Settings.builder().put(SmoothingPlugin.PARALLEL_POOL_SIZE.getKey(), 0).build();
        expectThrows(IllegalArgumentException.class, () -> SmoothingPlugin.PARALLEL_POOL_SIZE.get(zeroPool));
    }
}
