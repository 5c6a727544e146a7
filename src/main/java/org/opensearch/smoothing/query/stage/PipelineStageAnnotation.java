/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.smoothing.query.stage;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a pipeline stage class and gives the name it is registered under in {@link PipelineStageFactory}.
 *
 * <h2>Usage:</h2>
 * <pre>{@code
 * @PipelineStageAnnotation(name = "moving_average")
 * public class MovingAverageStage implements PipelineStage {
 *     // Implementation...
 * }
 * }</pre>
 *
 * <h2>Requirements:</h2>
 * <ul>
 *   <li>The annotated class must implement {@link PipelineStage}</li>
 *   <li>The class must have a static {@code fromArgs(Map<String, Object>)} method</li>
 *   <li>The class must have a static {@code readFrom(StreamInput)} method</li>
 * </ul>
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
public @interface PipelineStageAnnotation {

    /**
     * The name of the pipeline stage as it appears in definitions.
     *
     * @return the stage name
     */
    String name();
}
