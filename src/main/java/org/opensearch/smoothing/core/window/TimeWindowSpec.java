/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.smoothing.core.window;

import org.opensearch.core.common.io.stream.StreamInput;
import org.opensearch.core.common.io.stream.StreamOutput;
import org.opensearch.core.common.io.stream.Writeable;

import java.io.IOException;
import java.util.Locale;
import java.util.OptionalDouble;

/**
 * A time-domain window, expressed in the same unit as the timestamps of the series it is applied to.
 *
 * <p>The window of a sample taken at time {@code t} covers every sample whose timestamp lies in
 * {@code [t - before, t + after]}, both ends inclusive. With a known constant sampling rate the
 * window translates to a {@link WindowSpec} through {@link #toWindowSpec(double)}.</p>
 *
 * @param before duration preceding the current timestamp
 * @param after duration following the current timestamp
 */
public record TimeWindowSpec(double before, double after) implements Writeable {

    public TimeWindowSpec {
        requireValidDuration("time before", before);
        requireValidDuration("time after", after);
    }

    /**
     * Resolves a time window request, falling back to a symmetric window when {@code after} is absent.
     *
     * @param before duration before the current timestamp
     * @param after duration after the current timestamp, or empty for {@code after = before}
     * @return the resolved window
     * @throws IllegalArgumentException if a duration is negative or not finite
     */
    public static TimeWindowSpec resolve(double before, OptionalDouble after) {
        return new TimeWindowSpec(before, after.orElse(before));
    }

    /**
     * @param halfWidth duration on each side of the current timestamp
     * @return a window with {@code before == after == halfWidth}
     */
    public static TimeWindowSpec symmetric(double halfWidth) {
        return new TimeWindowSpec(halfWidth, halfWidth);
    }

    /**
     * Translates this window to a sample-count window for a series sampled at a constant rate.
     * Durations are converted with {@code (int) (duration * frequency)}, i.e. truncated toward zero.
     *
     * @param frequency sampling frequency, in samples per timestamp unit
     * @return the equivalent sample-domain window
     * @throws IllegalArgumentException if the frequency is not strictly positive and finite, or a
     *         translated count does not fit in an {@code int}
     */
    public WindowSpec toWindowSpec(double frequency) {
        if (!(frequency > 0) || Double.isInfinite(frequency)) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, "frequency must be > 0 and finite, got %s", frequency));
        }
        return new WindowSpec(toSampleCount("time before", before, frequency), toSampleCount("time after", after, frequency));
    }

    /**
     * Whether a timestamp belongs to the window centred on {@code center}.
     *
     * @param center the current timestamp
     * @param timestamp the candidate timestamp
     * @return true if {@code center - before <= timestamp <= center + after}
     */
    public boolean contains(double center, double timestamp) {
        return timestamp >= center - before && timestamp <= center + after;
    }

    private static int toSampleCount(String name, double duration, double frequency) {
        double samples = duration * frequency;
        if (samples >= Integer.MAX_VALUE + 1.0) {
            throw new IllegalArgumentException(
                String.format(Locale.ROOT, "%s of %s at frequency %s exceeds the maximum window size", name, duration, frequency)
            );
        }
        return (int) samples;
    }

    private static void requireValidDuration(String name, double duration) {
        if (Double.isNaN(duration) || Double.isInfinite(duration) || duration < 0) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, "%s must be >= 0 and finite, got %s", name, duration));
        }
    }

    @Override
    public void writeTo(StreamOutput out) throws IOException {
        out.writeDouble(before);
        out.writeDouble(after);
    }

    /**
     * Deserializes a TimeWindowSpec from a stream.
     *
     * @param in the input stream
     * @return the deserialized window
     * @throws IOException if an I/O error occurs
     */
    public static TimeWindowSpec readFrom(StreamInput in) throws IOException {
        double before = in.readDouble();
        double after = in.readDouble();
        return new TimeWindowSpec(before, after);
    }
}
