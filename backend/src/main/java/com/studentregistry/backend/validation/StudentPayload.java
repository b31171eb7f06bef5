package com.studentregistry.backend.validation;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;

/**
 * Full create payload. The constraints here are the single source of the field
 * rules: partial updates are checked against the same properties.
 */
public record StudentPayload(
        @NotNull(message = "name is required")
        @CodePointLength(min = 2, max = 50, message = "name must be between 2 and 50 characters")
        String name,

        @NotNull(message = "age is required")
        @Min(value = 1, message = "age must be between 1 and 99")
        @Max(value = 99, message = "age must be between 1 and 99")
        Integer age,

        @NotNull(message = "class_year is required")
        @Pattern(regexp = "^year \\d+$", message = "class_year must look like 'year <number>'")
        String classYear
) {}
