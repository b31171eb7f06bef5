package com.studentregistry.backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.List;

/**
 * Bound from the {@code student-api.*} keys of application.yml.
 */
@ConfigurationProperties(prefix = "student-api")
public record StudentApiProperties(
        @DefaultValue("Student Management API") String title,
        @DefaultValue("1.0.0") String version,
        List<Seed> seed
) {

    public StudentApiProperties {
        seed = seed == null ? List.of() : List.copyOf(seed);
    }

    // records inserted at startup
    public record Seed(String name, Integer age, String classYear) {}
}
