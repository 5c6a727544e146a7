/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.smoothing.stage;

import org.opensearch.common.xcontent.XContentFactory;
import org.opensearch.core.common.io.stream.Writeable;
import org.opensearch.core.xcontent.ToXContent;
import org.opensearch.core.xcontent.XContentBuilder;
import org.opensearch.smoothing.core.model.MultiSeries;
import org.opensearch.smoothing.core.window.WindowSpec;
import org.opensearch.test.AbstractWireSerializingTestCase;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;

public class MovingAverageStageTests extends AbstractWireSerializingTestCase<MovingAverageStage> {

    public void testProcessSmoothsEverySeries() {
        MovingAverageStage stage = new MovingAverageStage(WindowSpec.of(1, 0));
        MultiSeries input = MultiSeries.of(
            new double[] { 10, 20, 30, 40, 50 },
            new double[] { 1, 2, 3, 4, 5 },
            new double[] { 1, Double.NaN, 3, Double.NaN, 5 }
        );

        MultiSeries result = stage.process(input);

        assertEquals(2, result.seriesCount());
        assertArrayEquals(input.getTimestamps(), result.getTimestamps(), 0.0);
        assertArrayEquals(new double[] { 1, 1.5, 2.5, 3.5, 4.5 }, result.getSeries(0), 1e-9);
        assertArrayEquals(new double[] { 1, 1, 3, 3, 5 }, result.getSeries(1), 1e-9);
    }

    public void testProcessEmptyBatch() {
        MovingAverageStage stage = new MovingAverageStage(WindowSpec.symmetric(3));
        MultiSeries input = MultiSeries.of(new double[0]);

        assertEquals(0, stage.process(input).seriesCount());
    }

    public void testProcessNullInput() {
        MovingAverageStage stage = new MovingAverageStage(WindowSpec.IDENTITY);
        NullPointerException e = expectThrows(NullPointerException.class, () -> stage.process(null));
        assertEquals("moving_average stage received null input", e.getMessage());
    }

    public void testFromArgs() {
        assertEquals(WindowSpec.of(3, 3), MovingAverageStage.fromArgs(Map.of("before", 3)).getWindow());
        assertEquals(WindowSpec.of(3, 1), MovingAverageStage.fromArgs(Map.of("before", 3, "after", 1L)).getWindow());

        Map<String, Object> nullAfter = new HashMap<>();
        nullAfter.put("before", 2);
        nullAfter.put("after", null);
        assertEquals(WindowSpec.of(2, 2), MovingAverageStage.fromArgs(nullAfter).getWindow());
    }

    public void testFromArgsInvalid() {
        IllegalArgumentException e = expectThrows(IllegalArgumentException.class, () -> MovingAverageStage.fromArgs(Map.of()));
        assertEquals("moving_average requires 'before' parameter", e.getMessage());

        e = expectThrows(IllegalArgumentException.class, () -> MovingAverageStage.fromArgs(Map.of("before", 1.5)));
        assertEquals("moving_average parameter 'before' must be an integer, got [1.5]", e.getMessage());

        expectThrows(IllegalArgumentException.class, () -> MovingAverageStage.fromArgs(Map.of("before", 1L << 40)));
        expectThrows(IllegalArgumentException.class, () -> MovingAverageStage.fromArgs(Map.of("before", 1, "after", -2)));
    }

    public void testToXContent() throws IOException {
        MovingAverageStage stage = new MovingAverageStage(WindowSpec.of(4, 1));
        try (XContentBuilder builder = XContentFactory.jsonBuilder()) {
            builder.startObject();
            stage.toXContent(builder, ToXContent.EMPTY_PARAMS);
            builder.endObject();

            assertEquals("{\"before\":4,\"after\":1}", builder.toString());
        }
    }

    @Override
    protected Writeable.Reader<MovingAverageStage> instanceReader() {
        return MovingAverageStage::readFrom;
    }

    @Override
    protected MovingAverageStage createTestInstance() {
        return new MovingAverageStage(WindowSpec.of(randomIntBetween(0, 100), randomIntBetween(0, 100)));
    }
}
