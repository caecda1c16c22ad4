package com.loyaltycard.common;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * One field of a partial update.
 *
 * An absent field is left untouched. A present field carries the new value,
 * which may be {@code null} when the caller explicitly clears it.
 */
public final class FieldUpdate<T> {

    private final boolean present;
    private final T value;

    private FieldUpdate(boolean present, T value) {
        this.present = present;
        this.value = value;
    }

    public static <T> FieldUpdate<T> absent() {
        return new FieldUpdate<>(false, null);
    }

    public static <T> FieldUpdate<T> of(T value) {
        return new FieldUpdate<>(true, value);
    }

    public boolean isPresent() {
        return present;
    }

    public T getValue() {
        if (!present) {
            throw new IllegalStateException("Field was not supplied");
        }
        return value;
    }

    public void ifPresent(Consumer<? super T> action) {
        if (present) {
            action.accept(value);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FieldUpdate<?> other)) {
            return false;
        }
        return present == other.present && Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(present, value);
    }

    @Override
    public String toString() {
        return present ? "FieldUpdate[" + value + "]" : "FieldUpdate[absent]";
    }
}
