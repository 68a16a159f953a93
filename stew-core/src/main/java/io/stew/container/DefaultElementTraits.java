package io.stew.container;

import java.util.function.Predicate;
import java.util.function.Supplier;

record DefaultElementTraits<T>(Supplier<? extends T> empty, Predicate<? super T> validity)
        implements ElementTraits<T> {

    @Override
    public T emptyValue() {
        return empty.get();
    }

    @Override
    public boolean isValid(T element) {
        return validity.test(element);
    }
}
