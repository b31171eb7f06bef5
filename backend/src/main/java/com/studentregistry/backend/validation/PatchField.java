package com.studentregistry.backend.validation;

import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * A field of a partial update: either absent (leave the stored value alone) or
 * present with a value. A present {@code null} is kept distinct from absent.
 */
public final class PatchField<T> {

    private final boolean present;
    private final T value;

    private PatchField(boolean present, T value) {
        this.present = present;
        this.value = value;
    }

    public static <T> PatchField<T> absent() {
        return new PatchField<>(false, null);
    }

    public static <T> PatchField<T> of(T value) {
        return new PatchField<>(true, value);
    }

    public boolean isPresent() {
        return present;
    }

    public T get() {
        if (!present) throw new NoSuchElementException("patch field is absent");
        return value;
    }

    public T orElse(T fallback) {
        return present ? value : fallback;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PatchField<?> other)) return false;
        return present == other.present && Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(present, value);
    }

    @Override
    public String toString() {
        return present ? "PatchField[" + value + "]" : "PatchField.absent";
    }
}
