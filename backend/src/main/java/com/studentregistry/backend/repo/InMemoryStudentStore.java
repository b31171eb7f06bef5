package com.studentregistry.backend.repo;

import com.studentregistry.backend.domain.Student;
import com.studentregistry.backend.validation.StudentPatch;
import com.studentregistry.backend.validation.StudentPayload;
import com.studentregistry.backend.validation.StudentValidator;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;
import java.util.stream.Collectors;

@Component
public class InMemoryStudentStore implements StudentStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryStudentStore.class);

    private final StudentValidator validator;
    private final Supplier<String> idGenerator;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock(true);

    // id -> student, insertion order
    private final Map<String, Student> students = new LinkedHashMap<>();

    @Autowired
    public InMemoryStudentStore(StudentValidator validator) {
        this(validator, () -> UUID.randomUUID().toString());
    }

    InMemoryStudentStore(StudentValidator validator, Supplier<String> idGenerator) {
        this.validator = validator;
        this.idGenerator = idGenerator;
    }

    @Override
    public List<Student> listAll() {
        lock.readLock().lock();
        try {
            return new ArrayList<>(students.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Student get(String id) {
        lock.readLock().lock();
        try {
            Student s = students.get(id);
            if (s == null) throw StudentNotFoundException.forId(id);
            return s;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<Student> searchByName(String substring) {
        String qn = substring.toLowerCase(Locale.ROOT);
        List<Student> found;
        lock.readLock().lock();
        try {
            found = students.values().stream()
                    .filter(s -> s.name().toLowerCase(Locale.ROOT).contains(qn))
                    .collect(Collectors.toList());
        } finally {
            lock.readLock().unlock();
        }
        if (found.isEmpty()) throw StudentNotFoundException.forName(substring);
        return found;
    }

    @Override
    public Student create(StudentPayload payload) {
        StudentPayload valid = validator.validate(payload).orElseThrow();

        lock.writeLock().lock();
        try {
            String id = idGenerator.get();
            while (students.containsKey(id)) {
                id = idGenerator.get();
            }
            Student s = new Student(id, valid.name(), valid.age(), valid.classYear());
            students.put(id, s);
            log.debug("Created student {}", id);
            return s;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Student update(String id, StudentPatch patch) {
        lock.writeLock().lock();
        try {
            Student prev = students.get(id);
            if (prev == null) throw StudentNotFoundException.forId(id);

            StudentPatch valid = validator.validate(patch).orElseThrow();
            Student next = valid.applyTo(prev);
            students.put(id, next);
            log.debug("Updated student {}", id);
            return next;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void delete(String id) {
        lock.writeLock().lock();
        try {
            if (students.remove(id) == null) throw StudentNotFoundException.forId(id);
            log.debug("Deleted student {}", id);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @PreDestroy
    void shutdown() {
        lock.writeLock().lock();
        try {
            log.info("Shutting down student store, discarding {} records", students.size());
            students.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }
}
