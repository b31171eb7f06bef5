package com.studentregistry.backend.validation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.Validation;
import jakarta.validation.ValidatorFactory;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

class StudentValidatorTest {

    private static ValidatorFactory factory;
    private static StudentValidator validator;
    private final ObjectMapper om = new ObjectMapper();

    @BeforeAll
    static void setUp() {
        factory = Validation.buildDefaultValidatorFactory();
        validator = new StudentValidator(factory.getValidator());
    }

    @AfterAll
    static void tearDown() {
        factory.close();
    }

    private JsonNode json(String s) throws Exception {
        return om.readTree(s);
    }

    private ValidationResult<StudentPayload> create(String name, int age, String classYear) {
        return validator.validate(new StudentPayload(name, age, classYear));
    }

    @Test
    void acceptsValidCreateBody() throws Exception {
        ValidationResult<StudentPayload> r = validator.validateCreate(
                json("{\"name\":\"Alice Smith\",\"age\":16,\"class_year\":\"year 11\"}"));

        assertThat(r.isValid()).isTrue();
        assertThat(r.orElseThrow()).isEqualTo(new StudentPayload("Alice Smith", 16, "year 11"));
    }

    @Test
    void ageBoundaries() {
        assertThat(create("Al", 1, "year 1").isValid()).isTrue();
        assertThat(create("Al", 99, "year 1").isValid()).isTrue();

        ValidationResult<StudentPayload> zero = create("Al", 0, "year 1");
        assertThat(zero.isValid()).isFalse();
        assertThat(zero.violations()).singleElement()
                .satisfies(v -> {
                    assertThat(v.field()).isEqualTo("age");
                    assertThat(v.rule()).isEqualTo("range");
                    assertThat(v.value()).isEqualTo(0);
                });
        assertThat(create("Al", 100, "year 1").isValid()).isFalse();
    }

    @Test
    void nameLengthBoundaries() {
        assertThat(create("ab", 10, "year 1").isValid()).isTrue();
        assertThat(create("a".repeat(50), 10, "year 1").isValid()).isTrue();

        ValidationResult<StudentPayload> tooShort = create("a", 10, "year 1");
        assertThat(tooShort.violations()).extracting(FieldViolation::field, FieldViolation::rule)
                .containsExactly(tuple("name", "length"));
        assertThat(create("a".repeat(51), 10, "year 1").isValid()).isFalse();
    }

    @Test
    void nameLengthCountsCharactersNotCodeUnits() {
        String smile = "\uD83D\uDE00";

        ValidationResult<StudentPayload> one = create(smile, 10, "year 1");
        assertThat(one.violations()).extracting(FieldViolation::field, FieldViolation::rule)
                .containsExactly(tuple("name", "length"));
        assertThat(create(smile.repeat(2), 10, "year 1").isValid()).isTrue();
        assertThat(create(smile.repeat(50), 10, "year 1").isValid()).isTrue();
        assertThat(create(smile.repeat(51), 10, "year 1").isValid()).isFalse();
    }

    @Test
    void patchNameLengthCountsCharacters() throws Exception {
        String smile = "\uD83D\uDE00";

        assertThat(validator.validatePatch(json("{\"name\":\"" + smile + "\"}")).isValid()).isFalse();
        assertThat(validator.validatePatch(json("{\"name\":\"" + smile.repeat(50) + "\"}")).isValid()).isTrue();
    }

    @Test
    void classYearPattern() {
        assertThat(create("Al", 10, "year 12").isValid()).isTrue();
        assertThat(create("Al", 10, "year 123").isValid()).isTrue();

        ValidationResult<StudentPayload> grade = create("Al", 10, "grade 12");
        assertThat(grade.violations()).singleElement()
                .satisfies(v -> {
                    assertThat(v.field()).isEqualTo("class_year");
                    assertThat(v.rule()).isEqualTo("pattern");
                    assertThat(v.value()).isEqualTo("grade 12");
                });
        assertThat(create("Al", 10, "year ").isValid()).isFalse();
        assertThat(create("Al", 10, "Year 12").isValid()).isFalse();
    }

    @Test
    void createReportsEveryMissingFieldOnce() throws Exception {
        ValidationResult<StudentPayload> r = validator.validateCreate(json("{}"));

        assertThat(r.violations()).extracting(FieldViolation::field)
                .containsExactly("name", "age", "class_year");
        assertThat(r.violations()).extracting(FieldViolation::rule)
                .containsOnly("required");
    }

    @Test
    void createRejectsWrongJsonTypes() throws Exception {
        ValidationResult<StudentPayload> r = validator.validateCreate(
                json("{\"name\":42,\"age\":\"16\",\"class_year\":\"year 11\"}"));

        assertThat(r.violations()).extracting(FieldViolation::field, FieldViolation::rule)
                .containsExactly(
                        tuple("name", "type"),
                        tuple("age", "type"));
    }

    @Test
    void createRejectsFractionalAndHugeAges() throws Exception {
        assertThat(validator.validateCreate(json("{\"name\":\"Al\",\"age\":16.5,\"class_year\":\"year 1\"}"))
                .violations()).extracting(FieldViolation::rule).containsExactly("type");
        assertThat(validator.validateCreate(json("{\"name\":\"Al\",\"age\":99999999999,\"class_year\":\"year 1\"}"))
                .violations()).extracting(FieldViolation::rule).containsExactly("range");
    }

    @Test
    void createRejectsNonObjectBodies() throws Exception {
        assertThat(validator.validateCreate(null).violations())
                .extracting(FieldViolation::rule).containsExactly("object");
        assertThat(validator.validateCreate(json("[1,2]")).violations())
                .extracting(FieldViolation::rule).containsExactly("object");
    }

    @Test
    void createIgnoresClientSuppliedId() throws Exception {
        ValidationResult<StudentPayload> r = validator.validateCreate(
                json("{\"id\":\"mine\",\"name\":\"Alice\",\"age\":16,\"class_year\":\"year 11\"}"));

        assertThat(r.isValid()).isTrue();
    }

    @Test
    void emptyPatchHasEveryFieldAbsent() throws Exception {
        ValidationResult<StudentPatch> r = validator.validatePatch(json("{}"));

        assertThat(r.isValid()).isTrue();
        assertThat(r.orElseThrow()).isEqualTo(StudentPatch.empty());
    }

    @Test
    void patchKeepsOnlyPresentFields() throws Exception {
        StudentPatch patch = validator.validatePatch(json("{\"age\":17}")).orElseThrow();

        assertThat(patch.name().isPresent()).isFalse();
        assertThat(patch.age()).isEqualTo(PatchField.of(17));
        assertThat(patch.classYear().isPresent()).isFalse();
    }

    @Test
    void patchUsesTheSameRulesAsCreate() throws Exception {
        ValidationResult<StudentPatch> r = validator.validatePatch(
                json("{\"name\":\"A\",\"age\":100,\"class_year\":\"grade 12\"}"));

        assertThat(r.violations()).extracting(FieldViolation::field, FieldViolation::rule)
                .containsExactly(
                        tuple("name", "length"),
                        tuple("age", "range"),
                        tuple("class_year", "pattern"));
    }

    @Test
    void patchRejectsExplicitNull() throws Exception {
        ValidationResult<StudentPatch> r = validator.validatePatch(json("{\"name\":null}"));

        assertThat(r.violations()).singleElement()
                .satisfies(v -> {
                    assertThat(v.field()).isEqualTo("name");
                    assertThat(v.rule()).isEqualTo("not_null");
                });
    }

    @Test
    void orElseThrowCarriesViolations() {
        ValidationResult<StudentPayload> r = create("a", 0, "x");

        assertThatThrownBy(r::orElseThrow)
                .isInstanceOf(StudentValidationException.class)
                .satisfies(e -> assertThat(((StudentValidationException) e).getViolations()).hasSize(3));
    }

    @Test
    void nameQueryNeedsTwoCharacters() {
        assertThat(validator.validateNameQuery("Jo").isValid()).isTrue();
        assertThat(validator.validateNameQuery("J").violations())
                .extracting(FieldViolation::rule).containsExactly("length");
        assertThat(validator.validateNameQuery("\uD83D\uDE00").violations())
                .extracting(FieldViolation::rule).containsExactly("length");
        assertThat(validator.validateNameQuery("\uD83D\uDE00\uD83D\uDE00").isValid()).isTrue();
        assertThat(validator.validateNameQuery(null).violations())
                .extracting(FieldViolation::rule).containsExactly("required");
    }

    @Test
    void invalidResultNeedsViolations() {
        assertThatThrownBy(() -> ValidationResult.invalid(List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
