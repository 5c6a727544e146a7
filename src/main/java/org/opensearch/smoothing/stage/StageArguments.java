/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.smoothing.stage;

import org.opensearch.common.unit.TimeValue;

import java.util.Locale;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.OptionalInt;

/**
 * Typed access to the argument maps handed to the stages' {@code fromArgs} methods.
 */
final class StageArguments {

    private StageArguments() {
        // Utility class
    }

    static int requireInt(Map<String, Object> args, String key, String stageName) {
        return toInt(require(args, key, stageName), key, stageName);
    }

    static OptionalInt optionalInt(Map<String, Object> args, String key, String stageName) {
        Object value = args.get(key);
        return value == null ? OptionalInt.empty() : OptionalInt.of(toInt(value, key, stageName));
    }

    static double requireDouble(Map<String, Object> args, String key, String stageName) {
        Object value = require(args, key, stageName);
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        throw invalidType(key, stageName, "a number", value);
    }

    static OptionalDouble optionalDouble(Map<String, Object> args, String key, String stageName) {
        Object value = args.get(key);
        if (value == null) {
            return OptionalDouble.empty();
        }
        if (value instanceof Number number) {
            return OptionalDouble.of(number.doubleValue());
        }
        throw invalidType(key, stageName, "a number", value);
    }

    /**
     * A duration given either as a number, taken as is, or as a time string such as {@code "5m"},
     * taken in milliseconds.
     */
    static double requireDuration(Map<String, Object> args, String key, String stageName) {
        return toDuration(require(args, key, stageName), key, stageName);
    }

    static OptionalDouble optionalDuration(Map<String, Object> args, String key, String stageName) {
        Object value = args.get(key);
        return value == null ? OptionalDouble.empty() : OptionalDouble.of(toDuration(value, key, stageName));
    }

    private static Object require(Map<String, Object> args, String key, String stageName) {
        if (args == null) {
            throw new IllegalArgumentException(stageName + " requires arguments");
        }
        Object value = args.get(key);
        if (value == null) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, "%s requires '%s' parameter", stageName, key));
        }
        return value;
    }

    private static int toInt(Object value, String key, String stageName) {
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            long longValue = ((Number) value).longValue();
            if (longValue >= Integer.MIN_VALUE && longValue <= Integer.MAX_VALUE) {
                return (int) longValue;
            }
        }
        throw invalidType(key, stageName, "an integer", value);
    }

    private static double toDuration(Object value, String key, String stageName) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof String text) {
            return TimeValue.parseTimeValue(text, null, stageName + " " + key).getMillis();
        }
        throw invalidType(key, stageName, "a number or a time value", value);
    }

    private static IllegalArgumentException invalidType(String key, String stageName, String expected, Object value) {
        return new IllegalArgumentException(
            String.format(Locale.ROOT, "%s parameter '%s' must be %s, got [%s]", stageName, key, expected, value)
        );
    }
}
