package com.studentregistry.backend.validation;

import java.util.List;

/**
 * Outcome of validating a payload: either a value or a non-empty list of violations.
 */
public final class ValidationResult<T> {

    private final T value;
    private final List<FieldViolation> violations;

    private ValidationResult(T value, List<FieldViolation> violations) {
        this.value = value;
        this.violations = violations;
    }

    public static <T> ValidationResult<T> valid(T value) {
        return new ValidationResult<>(value, List.of());
    }

    public static <T> ValidationResult<T> invalid(List<FieldViolation> violations) {
        if (violations == null || violations.isEmpty()) {
            throw new IllegalArgumentException("invalid result needs at least one violation");
        }
        return new ValidationResult<>(null, List.copyOf(violations));
    }

    public boolean isValid() {
        return violations.isEmpty();
    }

    public List<FieldViolation> violations() {
        return violations;
    }

    public T orElseThrow() {
        if (!isValid()) throw new StudentValidationException(violations);
        return value;
    }
}
