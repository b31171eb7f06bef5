package com.studentregistry.backend.validation;

/**
 * One failed rule. rule is one of: required, not_null, type, length, range, pattern, object.
 */
public record FieldViolation(
        String field,
        String rule,
        Object value,
        String message
) {}
