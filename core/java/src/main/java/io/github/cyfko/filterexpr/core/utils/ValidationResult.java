package io.github.cyfko.filterexpr.core.utils;

import io.github.cyfko.filterexpr.core.exception.ErrorCode;
import io.github.cyfko.filterexpr.core.exception.FilterValidationException;

import java.util.Objects;

/**
 * Outcome of a non-throwing semantic check.
 * <p>
 * Instances are immutable and created via {@link #success()} and
 * {@link #failure(FilterValidationException)}.
 * </p>
 *
 * <p>Usage example:</p>
 * <pre>{@code
 * ValidationResult result = FilterExpressions.validate(expr);
 * if (!result.isValid()) {
 *     System.out.println("Validation error: " + result.getErrorMessage());
 * }
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class ValidationResult {

    private static final ValidationResult SUCCESS = new ValidationResult(null);

    private final FilterValidationException error;

    private ValidationResult(FilterValidationException error) {
        this.error = error;
    }

    public static ValidationResult success() {
        return SUCCESS;
    }

    /**
     * @param error the latched validation error
     * @return an invalid result carrying {@code error}
     */
    public static ValidationResult failure(FilterValidationException error) {
        return new ValidationResult(Objects.requireNonNull(error, "Validation error cannot be null"));
    }

    public boolean isValid() {
        return error == null;
    }

    /**
     * @return the error if invalid, or null if valid
     */
    public FilterValidationException getError() {
        return error;
    }

    /**
     * @return the error code if invalid, or null if valid
     */
    public ErrorCode getErrorCode() {
        return error == null ? null : error.getErrorCode();
    }

    /**
     * @return error message if invalid, or null if valid
     */
    public String getErrorMessage() {
        return error == null ? null : error.getMessage();
    }

    @Override
    public String toString() {
        return isValid() ? "ValidationResult[valid=true]"
                : "ValidationResult[valid=false, error=" + error.getMessage() + "]";
    }
}
