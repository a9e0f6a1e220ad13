// Copyright The Wrapkit Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package dev.wrapkit.validation;

import java.time.Duration;

/**
 * Utility class for validating input parameters.
 *
 * <p>Provides common validation methods to ensure consistent error messages across the library.
 */
public final class ParameterValidator {

    private ParameterValidator() {
        // Utility class - prevent instantiation
    }

    /**
     * Validates that a duration is present and not negative.
     *
     * @param duration the duration to validate
     * @param parameterName the name of the parameter (for error messages)
     * @throws IllegalArgumentException if duration is null or negative
     */
    public static void validateNonNegativeDuration(Duration duration, String parameterName) {
        if (duration == null) {
            throw new IllegalArgumentException(parameterName + " cannot be null");
        }
        if (duration.isNegative()) {
            throw new IllegalArgumentException(parameterName + " must not be negative, got: " + duration);
        }
    }

    /**
     * Validates that an optional duration (if provided) is strictly positive.
     *
     * @param duration the duration to validate (can be null)
     * @param parameterName the name of the parameter (for error messages)
     * @throws IllegalArgumentException if duration is non-null and zero or negative
     */
    public static void validateOptionalPositiveDuration(Duration duration, String parameterName) {
        if (duration != null && (duration.isNegative() || duration.isZero())) {
            throw new IllegalArgumentException(parameterName + " must be positive, got: " + duration);
        }
    }

    /**
     * Validates that an integer value is zero or greater.
     *
     * @param value the value to validate
     * @param parameterName the name of the parameter (for error messages)
     * @throws IllegalArgumentException if value is negative
     */
    public static void validateNonNegativeInteger(int value, String parameterName) {
        if (value < 0) {
            throw new IllegalArgumentException(parameterName + " must not be negative, got: " + value);
        }
    }
}
