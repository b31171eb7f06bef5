package com.studentregistry.backend.repo;

import com.studentregistry.backend.domain.Student;
import com.studentregistry.backend.validation.StudentPatch;
import com.studentregistry.backend.validation.StudentPayload;

import java.util.List;

/**
 * Authoritative holder of student records.
 *
 * Lookups that find nothing throw {@link StudentNotFoundException}; payloads
 * that break a field rule throw
 * {@link com.studentregistry.backend.validation.StudentValidationException}.
 */
public interface StudentStore {

    /** All records, in insertion order. */
    List<Student> listAll();

    Student get(String id);

    /**
     * Case-insensitive substring match on name. An empty result is reported
     * as not found, never as an empty list.
     */
    List<Student> searchByName(String substring);

    Student create(StudentPayload payload);

    /** Applies the present fields of the patch; absent fields keep their value. */
    Student update(String id, StudentPatch patch);

    void delete(String id);
}
