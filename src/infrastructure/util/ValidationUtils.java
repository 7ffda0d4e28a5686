package infrastructure.util;

import java.util.Collection;

/**
 * Input validation utilities used at system boundaries (CLI argument parsing,
 * configuration building, engine construction).
 *
 * <p>All methods throw {@link IllegalArgumentException} with a descriptive message
 * on invalid input so callers can propagate or display the reason to the user.
 */
public final class ValidationUtils {

    private ValidationUtils() {
        // Prevent instantiation: static methods only
    }

    /**
     * Validates that an integer value is strictly positive (greater than zero).
     *
     * @param value     the integer value to check
     * @param paramName parameter name used in the error message
     * @throws IllegalArgumentException if {@code value <= 0}
     */
    public static void validatePositive(int value, String paramName) {
        if (value <= 0) {
            throw new IllegalArgumentException(
                paramName + " must be positive, got: " + value);
        }
    }

    /**
     * Validates that a floating-point value is finite and strictly positive.
     *
     * @param value     the value to check
     * @param paramName parameter name used in the error message
     * @throws IllegalArgumentException if {@code value} is not a finite number {@code > 0}
     */
    public static void validatePositive(double value, String paramName) {
        if (!(value > 0.0) || Double.isInfinite(value)) {
            throw new IllegalArgumentException(
                paramName + " must be a positive finite number, got: " + value);
        }
    }

    /**
     * Validates that an integer value is zero or greater.
     *
     * @param value     the integer value to check
     * @param paramName parameter name used in the error message
     * @throws IllegalArgumentException if {@code value < 0}
     */
    public static void validateNonNegative(int value, String paramName) {
        if (value < 0) {
            throw new IllegalArgumentException(
                paramName + " must be non-negative, got: " + value);
        }
    }

    /**
     * Validates that a collection is neither {@code null} nor empty.
     *
     * @param values    the collection to check
     * @param paramName parameter name used in the error message
     * @throws IllegalArgumentException if {@code values} is null or empty
     */
    public static void validateNotEmpty(Collection<?> values, String paramName) {
        if (values == null || values.isEmpty()) {
            throw new IllegalArgumentException(paramName + " cannot be null or empty");
        }
    }
}
