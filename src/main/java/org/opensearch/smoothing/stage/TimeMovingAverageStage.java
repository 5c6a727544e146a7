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
import org.opensearch.smoothing.core.window.TimeWindowSpec;
import org.opensearch.smoothing.core.window.WindowSpec;
import org.opensearch.smoothing.query.stage.PipelineStage;
import org.opensearch.smoothing.query.stage.PipelineStageAnnotation;

import java.io.IOException;
import java.util.Map;
import java.util.Objects;

/**
 * Pipeline stage that applies a moving average defined by durations to series sampled at a known
 * constant frequency.
 * <p>
 * The durations are translated to sample counts once, when the stage is built, so an invalid frequency
 * is rejected before any batch is processed. Durations and frequency share one caller-defined time unit,
 * so both are plain numbers; time strings such as {@code "1s"} are rejected.
 */
@PipelineStageAnnotation(name = "moving_average_by_time")
public class TimeMovingAverageStage implements PipelineStage {
    /** The name of this stage. */
    public static final String NAME = "moving_average_by_time";

    private final double frequency;
    private final TimeWindowSpec timeWindow;
    private final WindowSpec sampleWindow;

    /**
     * Creates a constant-rate time window stage.
     *
     * @param frequency sampling frequency, in samples per time unit of the window
     * @param timeWindow the time window
     * @throws IllegalArgumentException if the frequency is not strictly positive and finite
     */
    public TimeMovingAverageStage(double frequency, TimeWindowSpec timeWindow) {
        this.frequency = frequency;
        this.timeWindow = Objects.requireNonNull(timeWindow, "time window cannot be null");
        this.sampleWindow = timeWindow.toWindowSpec(frequency);
    }

    @Override
    public MultiSeries process(MultiSeries input) {
        if (input == null) {
            throw new NullPointerException(getName() + " stage received null input");
        }
        double[][] smoothed = new double[input.seriesCount()][];
        for (int s = 0; s < smoothed.length; s++) {
            smoothed[s] = WindowedMeanDispatcher.INSTANCE.apply(input.getSeries(s), sampleWindow);
        }
        return input.withValues(smoothed);
    }

    /**
     * @return the sampling frequency
     */
    public double getFrequency() {
        return frequency;
    }

    /**
     * @return the time window
     */
    public TimeWindowSpec getTimeWindow() {
        return timeWindow;
    }

    /**
     * @return the sample window the time window translates to
     */
    public WindowSpec getSampleWindow() {
        return sampleWindow;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public void toXContent(XContentBuilder builder, ToXContent.Params params) throws IOException {
        builder.field("frequency", frequency);
        builder.field("time_before", timeWindow.before());
        builder.field("time_after", timeWindow.after());
    }

    @Override
    public void writeTo(StreamOutput out) throws IOException {
        out.writeDouble(frequency);
        timeWindow.writeTo(out);
    }

    /**
     * Deserializes a TimeMovingAverageStage from a stream.
     *
     * @param in the input stream
     * @return the deserialized TimeMovingAverageStage
     * @throws IOException if an I/O error occurs
     */
    public static TimeMovingAverageStage readFrom(StreamInput in) throws IOException {
        double frequency = in.readDouble();
        TimeWindowSpec timeWindow = TimeWindowSpec.readFrom(in);
        return new TimeMovingAverageStage(frequency, timeWindow);
    }

    /**
     * Creates a TimeMovingAverageStage from a map of numeric arguments: {@code frequency} and
     * {@code time_before} (required) and {@code time_after} (optional, defaults to {@code time_before}).
     *
     * @param args the argument map
     * @return the created TimeMovingAverageStage
     * @throws IllegalArgumentException if required parameters are missing or invalid
     */
    public static TimeMovingAverageStage fromArgs(Map<String, Object> args) {
        double frequency = StageArguments.requireDouble(args, "frequency", NAME);
        double timeBefore = StageArguments.requireDouble(args, "time_before", NAME);
        TimeWindowSpec timeWindow = TimeWindowSpec.resolve(timeBefore, StageArguments.optionalDouble(args, "time_after", NAME));
        return new TimeMovingAverageStage(frequency, timeWindow);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        TimeMovingAverageStage that = (TimeMovingAverageStage) obj;
        return Double.compare(frequency, that.frequency) == 0 && timeWindow.equals(that.timeWindow);
    }

    @Override
    public int hashCode() {
        return Objects.hash(frequency, timeWindow);
    }
}
