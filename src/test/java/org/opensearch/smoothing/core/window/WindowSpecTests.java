/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.smoothing.core.window;

import org.opensearch.core.common.io.stream.Writeable;
import org.opensearch.test.AbstractWireSerializingTestCase;

import java.util.OptionalInt;

public class WindowSpecTests extends AbstractWireSerializingTestCase<WindowSpec> {

    public void testResolveDefaultsToSymmetric() {
        WindowSpec window = WindowSpec.resolve(3, OptionalInt.empty());
        assertEquals(3, window.before());
        assertEquals(3, window.after());
        assertFalse(window.isAsymmetric());
    }

    public void testResolveKeepsExplicitAfter() {
        WindowSpec window = WindowSpec.resolve(1, OptionalInt.of(0));
        assertEquals(1, window.before());
        assertEquals(0, window.after());
        assertTrue(window.isAsymmetric());
    }

    public void testZeroAfterIsNotTreatedAsAbsent() {
        assertEquals(WindowSpec.of(4, 0), WindowSpec.resolve(4, OptionalInt.of(0)));
    }

    public void testNegativeCountsRejected() {
        IllegalArgumentException e = expectThrows(IllegalArgumentException.class, () -> WindowSpec.of(-1, 0));
        assertTrue(e.getMessage().contains("samples before"));
        e = expectThrows(IllegalArgumentException.class, () -> WindowSpec.resolve(2, OptionalInt.of(-3)));
        assertTrue(e.getMessage().contains("samples after"));
    }

    public void testSizeDoesNotOverflow() {
        WindowSpec window = WindowSpec.of(Integer.MAX_VALUE, Integer.MAX_VALUE);
        assertEquals(2L * Integer.MAX_VALUE + 1, window.size());
        assertEquals(1L, WindowSpec.IDENTITY.size());
    }

    public void testBoundsAreClipped() {
        WindowSpec window = WindowSpec.of(2, 1);
        assertEquals(0, window.lowerBound(0));
        assertEquals(1, window.lowerBound(3));
        assertEquals(4, window.upperBound(3, 10));
        assertEquals(4, window.upperBound(4, 5));

        WindowSpec huge = WindowSpec.of(0, Integer.MAX_VALUE);
        assertEquals(9, huge.upperBound(5, 10));
    }

    @Override
    protected Writeable.Reader<WindowSpec> instanceReader() {
        return WindowSpec::readFrom;
    }

    @Override
    protected WindowSpec createTestInstance() {
        return WindowSpec.of(randomIntBetween(0, 1000), randomIntBetween(0, 1000));
    }
}
