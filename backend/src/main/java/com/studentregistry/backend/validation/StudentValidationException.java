package com.studentregistry.backend.validation;

import java.util.List;
import java.util.stream.Collectors;

public class StudentValidationException extends RuntimeException {

    private final List<FieldViolation> violations;

    public StudentValidationException(List<FieldViolation> violations) {
        super(violations.stream()
                .map(FieldViolation::message)
                .collect(Collectors.joining("; ")));
        this.violations = List.copyOf(violations);
    }

    public List<FieldViolation> getViolations() {
        return violations;
    }
}
