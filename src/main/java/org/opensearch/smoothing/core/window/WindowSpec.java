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
import java.util.OptionalInt;

/**
 * A resolved, possibly asymmetric, sample-domain window.
 *
 * <p>The window of index {@code i} covers the samples {@code [i - before, i + after]},
 * clipped to the bounds of the series. Both counts are non-negative; a request that
 * leaves {@code after} unspecified resolves to a symmetric window.</p>
 *
 * <pre>{@code
 * WindowSpec.symmetric(2);                       // [i-2, i+2]
 * WindowSpec.of(2, 0);                           // [i-2, i]
 * WindowSpec.resolve(3, OptionalInt.empty());    // [i-3, i+3]
 * }</pre>
 *
 * @param before number of samples preceding the current index
 * @param after number of samples following the current index
 */
public record WindowSpec(int before, int after) implements Writeable {

    /** The identity window: every index averages only itself. */
    public static final WindowSpec IDENTITY = new WindowSpec(0, 0);

    public WindowSpec {
        if (before < 0) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, "samples before must be >= 0, got %d", before));
        }
        if (after < 0) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, "samples after must be >= 0, got %d", after));
        }
    }

    /**
     * Resolves a window request, falling back to a symmetric window when {@code after} is absent.
     *
     * @param before number of samples before the current index
     * @param after number of samples after the current index, or empty for {@code after = before}
     * @return the resolved window
     * @throws IllegalArgumentException if either count is negative
     */
    public static WindowSpec resolve(int before, OptionalInt after) {
        return new WindowSpec(before, after.orElse(before));
    }

    /**
     * @param before number of samples before the current index
     * @param after number of samples after the current index
     * @return the resolved window
     */
    public static WindowSpec of(int before, int after) {
        return new WindowSpec(before, after);
    }

    /**
     * @param halfWidth number of samples on each side of the current index
     * @return a window with {@code before == after == halfWidth}
     */
    public static WindowSpec symmetric(int halfWidth) {
        return new WindowSpec(halfWidth, halfWidth);
    }

    /**
     * Total width of the window, current sample included. Widened to {@code long} since both
     * halves may be as large as {@link Integer#MAX_VALUE}.
     *
     * @return {@code before + after + 1}
     */
    public long size() {
        return (long) before + after + 1;
    }

    /**
     * Whether the window extends differently on each side.
     *
     * @return true if {@code before != after}
     */
    public boolean isAsymmetric() {
        return before != after;
    }

    /**
     * First index inside the clipped window of {@code index}.
     *
     * @param index the current index
     * @return {@code max(index - before, 0)}
     */
    public int lowerBound(int index) {
        return Math.max(index - before, 0);
    }

    /**
     * Last index inside the clipped window of {@code index}.
     *
     * @param index the current index
     * @param length length of the series
     * @return {@code min(index + after, length - 1)}
     */
    public int upperBound(int index, int length) {
        return (int) Math.min((long) index + after, length - 1);
    }

    @Override
    public void writeTo(StreamOutput out) throws IOException {
        out.writeVInt(before);
        out.writeVInt(after);
    }

    /**
     * Deserializes a WindowSpec from a stream.
     *
     * @param in the input stream
     * @return the deserialized window
     * @throws IOException if an I/O error occurs
     */
    public static WindowSpec readFrom(StreamInput in) throws IOException {
        int before = in.readVInt();
        int after = in.readVInt();
        return new WindowSpec(before, after);
    }
}
