package com.studentregistry.backend.repo;

import java.util.NoSuchElementException;

public class StudentNotFoundException extends NoSuchElementException {

    public StudentNotFoundException(String message) {
        super(message);
    }

    public static StudentNotFoundException forId(String id) {
        return new StudentNotFoundException("Student with ID " + id + " not found");
    }

    public static StudentNotFoundException forName(String name) {
        return new StudentNotFoundException("No students found with name '" + name + "'");
    }
}
