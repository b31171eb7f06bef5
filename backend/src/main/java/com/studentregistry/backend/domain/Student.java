package com.studentregistry.backend.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A stored student record.
 * - id: generated by the store on create, never changes afterwards
 * - classYear: serialized as "class_year"
 */
public record Student(
        String id,
        String name,
        int age,
        @JsonProperty("class_year") String classYear
) {}
