package com.studentregistry.backend.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.studentregistry.backend.domain.Student;
import com.studentregistry.backend.repo.StudentStore;
import com.studentregistry.backend.validation.StudentPatch;
import com.studentregistry.backend.validation.StudentPayload;
import com.studentregistry.backend.validation.StudentValidator;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.net.URI;
import java.util.List;

@RestController
@RequestMapping("/students")
public class StudentController {

    private final StudentStore store;
    private final StudentValidator validator;

    public StudentController(StudentStore store, StudentValidator validator) {
        this.store = store;
        this.validator = validator;
    }

    @GetMapping
    public List<Student> list() {
        return store.listAll();
    }

    @GetMapping("/search/by-name")
    public List<Student> searchByName(@RequestParam(required = false) String name) {
        String q = validator.validateNameQuery(name).orElseThrow();
        return store.searchByName(q);
    }

    @GetMapping("/{id}")
    public Student get(@PathVariable String id) {
        return store.get(id);
    }

    @PostMapping
    public ResponseEntity<Student> create(@RequestBody(required = false) JsonNode body) {
        StudentPayload payload = validator.validateCreate(body).orElseThrow();
        Student created = store.create(payload);
        return ResponseEntity.created(URI.create("/students/" + created.id())).body(created);
    }

    /**
     * Unknown id wins over a bad body: existence is checked before validation.
     */
    @PatchMapping("/{id}")
    public Student update(@PathVariable String id, @RequestBody(required = false) JsonNode body) {
        store.get(id);
        StudentPatch patch = validator.validatePatch(body).orElseThrow();
        return store.update(id, patch);
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(@PathVariable String id) {
        store.delete(id);
    }
}
