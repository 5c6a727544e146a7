/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.smoothing.query.stage;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.opensearch.core.common.io.stream.StreamInput;
import org.opensearch.core.common.io.stream.StreamOutput;
import org.opensearch.smoothing.stage.MovingAverageStage;
import org.opensearch.smoothing.stage.TimeMovingAverageStage;
import org.opensearch.smoothing.stage.VariableRateMovingAverageStage;

import java.io.IOException;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Creates pipeline stages by name, either from an argument map or from a stream.
 *
 * <p>Each stage class is registered under the name of its {@link PipelineStageAnnotation}. The factory
 * reaches the stage through its static {@code fromArgs(Map)} and {@code readFrom(StreamInput)} methods.
 * On the wire a stage is written as its name followed by its own data, see {@link #writeTo}.</p>
 */
public final class PipelineStageFactory {

    private static final Logger logger = LogManager.getLogger(PipelineStageFactory.class);

    private static final Map<String, StageRegistration> REGISTRY = new ConcurrentHashMap<>();

    static {
        registerStageType(MovingAverageStage.class);
        registerStageType(TimeMovingAverageStage.class);
        registerStageType(VariableRateMovingAverageStage.class);
    }

    private record StageRegistration(Class<? extends PipelineStage> stageClass, Method fromArgs, Method readFrom) {}

    private PipelineStageFactory() {
        // Utility class
    }

    /**
     * Register a stage class under its annotated name.
     *
     * @param stageClass the stage class
     * @throws IllegalArgumentException if the class is not annotated or lacks the static factory methods
     */
    public static void registerStageType(Class<? extends PipelineStage> stageClass) {
        PipelineStageAnnotation annotation = stageClass.getAnnotation(PipelineStageAnnotation.class);
        if (annotation == null) {
            throw new IllegalArgumentException(stageClass.getName() + " is not annotated with @PipelineStageAnnotation");
        }
        Method fromArgs = findStaticMethod(stageClass, "fromArgs", Map.class);
        Method readFrom = findStaticMethod(stageClass, "readFrom", StreamInput.class);
        REGISTRY.put(annotation.name(), new StageRegistration(stageClass, fromArgs, readFrom));
        logger.debug("Registered pipeline stage [{}] -> {}", annotation.name(), stageClass.getSimpleName());
    }

    private static Method findStaticMethod(Class<?> stageClass, String name, Class<?> parameterType) {
        try {
            Method method = stageClass.getMethod(name, parameterType);
            if (!Modifier.isStatic(method.getModifiers())) {
                throw new IllegalArgumentException(stageClass.getName() + "." + name + " must be static");
            }
            return method;
        } catch (NoSuchMethodException e) {
            throw new IllegalArgumentException(
                String.format(Locale.ROOT, "%s must declare a static %s(%s) method", stageClass.getName(), name, parameterType.getSimpleName()),
                e
            );
        }
    }

    /**
     * Create a stage from its name and arguments.
     *
     * @param stageType the registered stage name
     * @param args the stage arguments
     * @return the new stage
     * @throws IllegalArgumentException if the name is unknown or the arguments are rejected
     */
    public static PipelineStage createWithArgs(String stageType, Map<String, Object> args) {
        StageRegistration registration = lookup(stageType);
        try {
            return registration.stageClass().cast(registration.fromArgs().invoke(null, args));
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause();
            throw new IllegalArgumentException("Failed to create stage '" + stageType + "': " + cause.getMessage(), cause);
        } catch (IllegalAccessException e) {
            throw new IllegalArgumentException("Failed to create stage '" + stageType + "': " + e.getMessage(), e);
        }
    }

    /**
     * Read a stage written by {@link #writeTo(StreamOutput, PipelineStage)}.
     *
     * @param in the stream input
     * @return the deserialized stage
     * @throws IOException if an I/O error occurs
     */
    public static PipelineStage readFrom(StreamInput in) throws IOException {
        String stageType = in.readString();
        return readFrom(in, stageType);
    }

    /**
     * Read the data of a stage whose name is already known.
     *
     * @param in the stream input
     * @param stageType the registered stage name
     * @return the deserialized stage
     * @throws IOException if an I/O error occurs
     */
    public static PipelineStage readFrom(StreamInput in, String stageType) throws IOException {
        StageRegistration registration = lookup(stageType);
        try {
            return registration.stageClass().cast(registration.readFrom().invoke(null, in));
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IOException ioException) {
                throw ioException;
            }
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            throw new IllegalStateException("Failed to read stage '" + stageType + "'", cause);
        } catch (IllegalAccessException e) {
            throw new IllegalStateException("Failed to read stage '" + stageType + "'", e);
        }
    }

    /**
     * Write a stage preceded by its name so that {@link #readFrom(StreamInput)} can restore it.
     *
     * @param out the stream output
     * @param stage the stage to write
     * @throws IOException if an I/O error occurs
     */
    public static void writeTo(StreamOutput out, PipelineStage stage) throws IOException {
        out.writeString(stage.getName());
        stage.writeTo(out);
    }

    /**
     * @return a copy of the registered stage names
     */
    public static Set<String> getSupportedStageTypes() {
        return new HashSet<>(REGISTRY.keySet());
    }

    /**
     * @param stageType a stage name
     * @return true if a stage is registered under that name
     */
    public static boolean isStageTypeSupported(String stageType) {
        return stageType != null && REGISTRY.containsKey(stageType);
    }

    private static StageRegistration lookup(String stageType) {
        if (stageType == null || stageType.isEmpty()) {
            throw new IllegalArgumentException("Stage type cannot be null or empty");
        }
        StageRegistration registration = REGISTRY.get(stageType);
        if (registration == null) {
            throw new IllegalArgumentException("Unknown stage type: " + stageType + ", supported types: " + REGISTRY.keySet());
        }
        return registration;
    }
}
