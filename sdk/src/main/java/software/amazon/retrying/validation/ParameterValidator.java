// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.retrying.validation;

import java.time.Duration;

/**
 * Utility class for validating strategy and configuration parameters.
 *
 * <p>Provides common validation methods to ensure consistent error messages across the SDK. All failures are reported
 * eagerly as {@link IllegalArgumentException}, so a malformed configuration never reaches the retry loop.
 */
public final class ParameterValidator {

    private ParameterValidator() {
        // Utility class - prevent instantiation
    }

    /**
     * Validates that a value is not null.
     *
     * @param value the value to validate
     * @param parameterName the name of the parameter (for error messages)
     * @param <T> the value type
     * @return the validated value
     * @throws IllegalArgumentException if value is null
     */
    public static <T> T validateNotNull(T value, String parameterName) {
        if (value == null) {
            throw new IllegalArgumentException(parameterName + " cannot be null");
        }
        return value;
    }

    /**
     * Validates that a duration is present and not negative.
     *
     * @param duration the duration to validate
     * @param parameterName the name of the parameter (for error messages)
     * @throws IllegalArgumentException if duration is null or negative
     */
    public static void validateDuration(Duration duration, String parameterName) {
        validateNotNull(duration, parameterName);
        if (duration.isNegative()) {
            throw new IllegalArgumentException(parameterName + " must not be negative, got: " + duration);
        }
    }

    /**
     * Validates that an optional duration (if provided) is not negative.
     *
     * @param duration the duration to validate (can be null)
     * @param parameterName the name of the parameter (for error messages)
     * @throws IllegalArgumentException if duration is non-null and negative
     */
    public static void validateOptionalDuration(Duration duration, String parameterName) {
        if (duration != null && duration.isNegative()) {
            throw new IllegalArgumentException(parameterName + " must not be negative, got: " + duration);
        }
    }

    /**
     * Validates that an integer value is positive (greater than 0).
     *
     * @param value the value to validate
     * @param parameterName the name of the parameter (for error messages)
     * @throws IllegalArgumentException if value is null or not positive
     */
    public static void validatePositiveInteger(Integer value, String parameterName) {
        validateNotNull(value, parameterName);
        if (value <= 0) {
            throw new IllegalArgumentException(parameterName + " must be positive, got: " + value);
        }
    }

    /**
     * Validates that {@code min} does not exceed {@code max}.
     *
     * @param min lower bound
     * @param max upper bound
     * @param minName name of the lower bound parameter
     * @param maxName name of the upper bound parameter
     * @throws IllegalArgumentException if either bound is null or {@code min > max}
     */
    public static void validateRange(Duration min, Duration max, String minName, String maxName) {
        validateDuration(min, minName);
        validateDuration(max, maxName);
        if (min.compareTo(max) > 0) {
            throw new IllegalArgumentException(
                    minName + " must not be greater than " + maxName + ", got: " + min + " > " + max);
        }
    }
}
