package com.studentregistry.backend.validation;

import com.studentregistry.backend.domain.Student;

/**
 * Partial update payload (PATCH). Only present fields are applied.
 */
public record StudentPatch(
        PatchField<String> name,
        PatchField<Integer> age,
        PatchField<String> classYear
) {

    public static StudentPatch empty() {
        return new StudentPatch(PatchField.absent(), PatchField.absent(), PatchField.absent());
    }

    public Student applyTo(Student prev) {
        return new Student(
                prev.id(),
                name.orElse(prev.name()),
                age.isPresent() ? age.get() : prev.age(),
                classYear.orElse(prev.classYear())
        );
    }
}
