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
import org.opensearch.smoothing.core.model.MultiSeries;
import org.opensearch.smoothing.core.time.VariableRateMovingAverage;
import org.opensearch.smoothing.core.window.TimeWindowSpec;
import org.opensearch.smoothing.query.stage.PipelineStage;
import org.opensearch.smoothing.query.stage.PipelineStageAnnotation;

import java.io.IOException;
import java.util.Map;
import java.util.Objects;

/**
 * Pipeline stage that applies a time-window moving average on the batch's own, possibly irregular,
 * timestamp axis.
 * <p>
 * Durations given as time strings ({@code "30s"}, {@code "5m"}) are converted to milliseconds, which
 * suits epoch-millisecond timestamps; plain numbers are taken in the unit of the timestamps.
 */
@PipelineStageAnnotation(name = "moving_average_variable_rate")
public class VariableRateMovingAverageStage implements PipelineStage {
    /** The name of this stage. */
    public static final String NAME = "moving_average_variable_rate";

    private final TimeWindowSpec window;

    /**
     * Creates a variable-rate moving average stage.
     *
     * @param window the time window, in timestamp units
     */
    public VariableRateMovingAverageStage(TimeWindowSpec window) {
        this.window = Objects.requireNonNull(window, "window cannot be null");
    }

    @Override
    public MultiSeries process(MultiSeries input) {
        if (input == null) {
            throw new NullPointerException(getName() + " stage received null input");
        }
        return VariableRateMovingAverage.apply(input, window);
    }

    /**
     * @return the time window
     */
    public TimeWindowSpec getWindow() {
        return window;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public void toXContent(XContentBuilder builder, ToXContent.Params params) throws IOException {
        builder.field("time_before", window.before());
        builder.field("time_after", window.after());
    }

    @Override
    public void writeTo(StreamOutput out) throws IOException {
        window.writeTo(out);
    }

    /**
     * Deserializes a VariableRateMovingAverageStage from a stream.
     *
     * @param in the input stream
     * @return the deserialized VariableRateMovingAverageStage
     * @throws IOException if an I/O error occurs
     */
    public static VariableRateMovingAverageStage readFrom(StreamInput in) throws IOException {
        return new VariableRateMovingAverageStage(TimeWindowSpec.readFrom(in));
    }

    /**
     * Creates a VariableRateMovingAverageStage from a map of arguments: {@code time_before} (required)
     * and {@code time_after} (optional, defaults to {@code time_before}).
     *
     * @param args the argument map
     * @return the created VariableRateMovingAverageStage
     * @throws IllegalArgumentException if required parameters are missing or invalid
     */
    public static VariableRateMovingAverageStage fromArgs(Map<String, Object> args) {
        double timeBefore = StageArguments.requireDuration(args, "time_before", NAME);
        return new VariableRateMovingAverageStage(
            TimeWindowSpec.resolve(timeBefore, StageArguments.optionalDuration(args, "time_after", NAME))
        );
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        VariableRateMovingAverageStage that = (VariableRateMovingAverageStage) obj;
        return window.equals(that.window);
    }

    @Override
    public int hashCode() {
        return window.hashCode();
    }
}
