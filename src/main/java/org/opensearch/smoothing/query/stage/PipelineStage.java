/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.smoothing.query.stage;

import org.opensearch.core.common.io.stream.StreamOutput;
import org.opensearch.core.common.io.stream.Writeable;
import org.opensearch.core.xcontent.ToXContent;
import org.opensearch.core.xcontent.XContentBuilder;
import org.opensearch.smoothing.core.model.MultiSeries;

import java.io.IOException;

/**
 * Interface for pipeline stages that transform a batch of series.
 *
 * <p>A stage receives a {@link MultiSeries} and returns a new one on the same timestamp axis. The
 * input is never modified.</p>
 *
 * <h2>Key Features:</h2>
 * <ul>
 *   <li><strong>Serialization Support:</strong> Extends {@link Writeable} so a stage definition can be
 *       shipped between nodes</li>
 *   <li><strong>XContent Support:</strong> Renders its arguments through {@link #toXContent}</li>
 *   <li><strong>Registration:</strong> Implementations are annotated with {@link PipelineStageAnnotation}
 *       and created by {@link PipelineStageFactory}</li>
 * </ul>
 */
public interface PipelineStage extends Writeable {
    /**
     * Get the name of this pipeline stage.
     *
     * @return The stage name
     */
    String getName();

    /**
     * Process a batch of series.
     *
     * @param input The batch to process
     * @return A new batch on the same timestamp axis
     * @throws NullPointerException if input is null
     */
    MultiSeries process(MultiSeries input);

    /**
     * Serialize this stage to XContent including all arguments.
     * @param builder The XContentBuilder to write to
     * @param params Serialization parameters
     * @throws IOException if serialization fails
     */
    void toXContent(XContentBuilder builder, ToXContent.Params params) throws IOException;

    /**
     * Write stage-specific data to the output stream for serialization.
     *
     * @param out the output stream
     * @throws IOException if an I/O error occurs
     */
    void writeTo(StreamOutput out) throws IOException;
}
