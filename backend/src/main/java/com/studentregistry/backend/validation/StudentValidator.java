package com.studentregistry.backend.validation;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import org.springframework.stereotype.Component;

import java.lang.annotation.Annotation;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Explicit validation of request bodies at the handler boundary.
 *
 * Parsing checks presence and JSON types; the value rules (length, range,
 * pattern) come from the constraint metadata on {@link StudentPayload}, so the
 * create and patch paths cannot drift apart.
 */
@Component
public class StudentValidator {

    public static final String NAME = "name";
    public static final String AGE = "age";
    public static final String CLASS_YEAR = "class_year";

    static final int MIN_NAME_QUERY = 2;

    private static final List<String> FIELD_ORDER = List.of(NAME, AGE, CLASS_YEAR);

    // StudentPayload property -> JSON field
    private static final Map<String, String> PROPERTY_TO_FIELD = Map.of(
            "name", NAME,
            "age", AGE,
            "classYear", CLASS_YEAR
    );

    private final Validator validator;

    public StudentValidator(Validator validator) {
        this.validator = validator;
    }

    public ValidationResult<StudentPayload> validateCreate(JsonNode body) {
        if (body == null || !body.isObject()) {
            return ValidationResult.invalid(List.of(notAnObject(body)));
        }
        List<FieldViolation> parsed = new ArrayList<>();
        String name = readText(body, NAME, parsed);
        Integer age = readInt(body, AGE, parsed);
        String classYear = readText(body, CLASS_YEAR, parsed);

        StudentPayload payload = new StudentPayload(name, age, classYear);
        return merge(payload, parsed, validate(payload).violations());
    }

    public ValidationResult<StudentPatch> validatePatch(JsonNode body) {
        if (body == null || !body.isObject()) {
            return ValidationResult.invalid(List.of(notAnObject(body)));
        }
        List<FieldViolation> parsed = new ArrayList<>();
        PatchField<String> name = body.has(NAME)
                ? PatchField.of(readText(body, NAME, parsed))
                : PatchField.absent();
        PatchField<Integer> age = body.has(AGE)
                ? PatchField.of(readInt(body, AGE, parsed))
                : PatchField.absent();
        PatchField<String> classYear = body.has(CLASS_YEAR)
                ? PatchField.of(readText(body, CLASS_YEAR, parsed))
                : PatchField.absent();

        StudentPatch patch = new StudentPatch(name, age, classYear);
        return merge(patch, parsed, validate(patch).violations());
    }

    public ValidationResult<StudentPayload> validate(StudentPayload payload) {
        List<FieldViolation> out = new ArrayList<>();
        for (ConstraintViolation<StudentPayload> v : validator.validate(payload)) {
            out.add(toViolation(v));
        }
        return out.isEmpty() ? ValidationResult.valid(payload) : ValidationResult.invalid(sorted(out));
    }

    /**
     * Checks every present field of the patch against the same property rules
     * as {@link #validate(StudentPayload)}. Absent fields are not checked.
     */
    public ValidationResult<StudentPatch> validate(StudentPatch patch) {
        List<FieldViolation> out = new ArrayList<>();
        checkProperty("name", patch.name(), out);
        checkProperty("age", patch.age(), out);
        checkProperty("classYear", patch.classYear(), out);
        return out.isEmpty() ? ValidationResult.valid(patch) : ValidationResult.invalid(sorted(out));
    }

    public ValidationResult<String> validateNameQuery(String q) {
        if (q == null) {
            return ValidationResult.invalid(List.of(
                    new FieldViolation(NAME, "required", null, "query parameter 'name' is required")));
        }
        if (CodePointLengthValidator.codePoints(q) < MIN_NAME_QUERY) {
            return ValidationResult.invalid(List.of(
                    new FieldViolation(NAME, "length", q,
                            "query parameter 'name' must be at least " + MIN_NAME_QUERY + " characters")));
        }
        return ValidationResult.valid(q);
    }

    // ---------------- helpers ----------------

    private void checkProperty(String property, PatchField<?> field, List<FieldViolation> out) {
        if (!field.isPresent()) return;
        for (ConstraintViolation<StudentPayload> v :
                validator.validateValue(StudentPayload.class, property, field.get())) {
            out.add(toViolation(v));
        }
    }

    private static <T> ValidationResult<T> merge(T value, List<FieldViolation> parsed, List<FieldViolation> rules) {
        if (parsed.isEmpty() && rules.isEmpty()) return ValidationResult.valid(value);

        // a field that failed parsing is reported once, with the parse failure
        Set<String> reported = new HashSet<>();
        List<FieldViolation> out = new ArrayList<>(parsed);
        parsed.forEach(v -> reported.add(v.field()));
        for (FieldViolation v : rules) {
            if (!reported.contains(v.field())) out.add(v);
        }
        return ValidationResult.invalid(sorted(out));
    }

    private static String readText(JsonNode body, String field, List<FieldViolation> out) {
        if (!body.has(field)) {
            out.add(new FieldViolation(field, "required", null, field + " is required"));
            return null;
        }
        JsonNode node = body.get(field);
        if (node.isNull()) return null;
        if (!node.isTextual()) {
            out.add(new FieldViolation(field, "type", node, field + " must be a string"));
            return null;
        }
        return node.textValue();
    }

    private static Integer readInt(JsonNode body, String field, List<FieldViolation> out) {
        if (!body.has(field)) {
            out.add(new FieldViolation(field, "required", null, field + " is required"));
            return null;
        }
        JsonNode node = body.get(field);
        if (node.isNull()) return null;
        if (!node.isIntegralNumber()) {
            out.add(new FieldViolation(field, "type", node, field + " must be an integer"));
            return null;
        }
        if (!node.canConvertToInt()) {
            out.add(new FieldViolation(field, "range", node, field + " must be between 1 and 99"));
            return null;
        }
        return node.intValue();
    }

    private static FieldViolation notAnObject(JsonNode body) {
        return new FieldViolation(null, "object", body, "request body must be a JSON object");
    }

    private static FieldViolation toViolation(ConstraintViolation<?> v) {
        String property = v.getPropertyPath().toString();
        String field = PROPERTY_TO_FIELD.getOrDefault(property, property);
        return new FieldViolation(field, ruleOf(v), v.getInvalidValue(), v.getMessage());
    }

    private static String ruleOf(ConstraintViolation<?> v) {
        Class<? extends Annotation> type = v.getConstraintDescriptor().getAnnotation().annotationType();
        if (type == NotNull.class) return "not_null";
        if (type == CodePointLength.class) return "length";
        if (type == Min.class || type == Max.class) return "range";
        if (type == Pattern.class) return "pattern";
        return type.getSimpleName();
    }

    private static List<FieldViolation> sorted(List<FieldViolation> in) {
        List<FieldViolation> out = new ArrayList<>(in);
        out.sort(Comparator.comparingInt(v -> {
            int i = FIELD_ORDER.indexOf(v.field());
            return i < 0 ? FIELD_ORDER.size() : i;
        }));
        return out;
    }
}
