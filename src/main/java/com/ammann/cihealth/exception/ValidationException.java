/* (C)2026 */
package com.ammann.cihealth.exception;

/**
 * Exception indicating that a caller-supplied report option does not meet the constraints
 * of the report build.
 *
 * <p>Provides factory methods for common validation failure patterns.
 */
public class ValidationException extends ReportException {

    public ValidationException(String message) {
        super(message, null);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Creates validation exception for insufficient data.
     */
    public static ValidationException insufficientData(String resourceType, int required, int actual) {
        return new ValidationException(
                String.format("Insufficient %s: need at least %d, but got %d",
                        resourceType, required, actual));
    }

    /**
     * Creates validation exception for invalid parameter.
     */
    public static ValidationException invalidParameter(String paramName, Object value, String expected) {
        return new ValidationException(
                String.format("Invalid parameter '%s': got '%s', expected %s",
                        paramName, value, expected));
    }
}
