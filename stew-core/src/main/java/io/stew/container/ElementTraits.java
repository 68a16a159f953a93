package io.stew.container;

import java.util.Objects;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Per-container element rules: which content counts as present, and which value
 * marks a slot as deleted.
 * <p>
 * {@code isValid(emptyValue())} must be false, otherwise tombstones stay visible.
 *
 * @param <T> element type
 */
public interface ElementTraits<T> {

    /**
     * @return the value written into a slot to tombstone it
     */
    T emptyValue();

    /**
     * Validity predicate. Must be pure.
     *
     * @param element slot content, possibly the empty value
     * @return true if the slot counts as present
     */
    boolean isValid(T element);

    /**
     * Null tombstones; every non-null element is present.
     */
    static <T> ElementTraits<T> nonNull() {
        return new DefaultElementTraits<>(() -> null, Objects::nonNull);
    }

    /**
     * Tombstones with {@code emptyValue}; every element not equal to it is present.
     * Nulls are never present.
     */
    static <T> ElementTraits<T> withEmptyValue(T emptyValue) {
        return new DefaultElementTraits<>(() -> emptyValue,
                element -> element != null && !element.equals(emptyValue));
    }

    static <T> ElementTraits<T> of(Supplier<? extends T> emptyValue, Predicate<? super T> validity) {
        Objects.requireNonNull(emptyValue, "emptyValue");
        Objects.requireNonNull(validity, "validity");
        if (validity.test(emptyValue.get())) {
            throw new IllegalArgumentException("empty value must fail the validity predicate");
        }
        return new DefaultElementTraits<>(emptyValue, validity);
    }
}
