/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.smoothing.stage;

import org.opensearch.core.common.io.stream.StreamInput;
import org.opensearch.core.common.io.stream.StreamOutput;
import org.opensearch.core.xcontent.ToXContent;
import org.opensearch.core.xcontent.XContentBuilder;
import org.opensearch.smoothing.core.mean.WindowedMeanDispatcher;
import org.opensearch.smoothing.core.model.MultiSeries;
import org.opensearch.smoothing.core.window.WindowSpec;
import org.opensearch.smoothing.query.stage.PipelineStage;
import org.opensearch.smoothing.query.stage.PipelineStageAnnotation;

import java.io.IOException;
import java.util.Map;
import java.util.Objects;

/**
 * Pipeline stage that applies a sample-count moving average to every series of a batch.
 * <p>
 * Each series independently takes the fast or the exact path, see {@link WindowedMeanDispatcher}.
 * The timestamp axis is carried through untouched.
 */
@PipelineStageAnnotation(name = "moving_average")
public class MovingAverageStage implements PipelineStage {
    /** The name of this stage. */
    public static final String NAME = "moving_average";

    private final WindowSpec window;

    /**
     * Creates a moving average stage.
     *
     * @param window the sample window
     */
    public MovingAverageStage(WindowSpec window) {
        this.window = Objects.requireNonNull(window, "window cannot be null");
    }

    @Override
    public MultiSeries process(MultiSeries input) {
        if (input == null) {
            throw new NullPointerException(getName() + " stage received null input");
        }
        double[][] smoothed = new double[input.seriesCount()][];
        for (int s = 0; s < smoothed.length; s++) {
            smoothed[s] = WindowedMeanDispatcher.INSTANCE.apply(input.getSeries(s), window);
        }
        return input.withValues(smoothed);
    }

    /**
     * @return the sample window
     */
    public WindowSpec getWindow() {
        return window;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public void toXContent(XContentBuilder builder, ToXContent.Params params) throws IOException {
        builder.field("before", window.before());
        builder.field("after", window.after());
    }

    @Override
    public void writeTo(StreamOutput out) throws IOException {
        window.writeTo(out);
    }

    /**
     * Deserializes a MovingAverageStage from a stream.
     *
     * @param in the input stream
     * @return the deserialized MovingAverageStage
     * @throws IOException if an I/O error occurs
     */
    public static MovingAverageStage readFrom(StreamInput in) throws IOException {
        return new MovingAverageStage(WindowSpec.readFrom(in));
    }

    /**
     * Creates a MovingAverageStage from a map of arguments: {@code before} (required) and
     * {@code after} (optional, defaults to {@code before}).
     *
     * @param args the argument map
     * @return the created MovingAverageStage
     * @throws IllegalArgumentException if required parameters are missing or invalid
     */
    public static MovingAverageStage fromArgs(Map<String, Object> args) {
        int before = StageArguments.requireInt(args, "before", NAME);
        return new MovingAverageStage(WindowSpec.resolve(before, StageArguments.optionalInt(args, "after", NAME)));
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        MovingAverageStage that = (MovingAverageStage) obj;
        return window.equals(that.window);
    }

    @Override
    public int hashCode() {
        return window.hashCode();
    }
}
