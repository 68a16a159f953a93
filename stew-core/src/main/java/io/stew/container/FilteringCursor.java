package io.stew.container;

import io.stew.storage.SlotStorage;

import java.util.NoSuchElementException;

/**
 * Cursor over a slot range that skips slots failing the validity predicate.
 * <p>
 * Forward cursors walk {@code [lower, upper)} upwards and end at {@code upper};
 * reverse cursors walk it downwards and end at {@code lower - 1}.
 *
 * @param <T> element type
 */
final class FilteringCursor<T> implements Cursor<T> {

    private final SlotStorage<T> storage;
    private final ElementTraits<T> traits;
    private final int index;
    private final int lower;
    private final int upper;
    private final boolean reverse;
    private final boolean writable;

    private FilteringCursor(SlotStorage<T> storage, ElementTraits<T> traits, int index,
                            int lower, int upper, boolean reverse, boolean writable) {
        this.storage = storage;
        this.traits = traits;
        this.index = index;
        this.lower = lower;
        this.upper = upper;
        this.reverse = reverse;
        this.writable = writable;
    }

    /**
     * Forward cursor at the first valid slot at or after {@code start}.
     */
    static <T> FilteringCursor<T> forward(SlotStorage<T> storage, ElementTraits<T> traits,
                                          int start, int lower, int upper, boolean writable) {
        var i = start;
        while (i < upper && !traits.isValid(storage.get(i))) {
            i++;
        }
        return new FilteringCursor<>(storage, traits, i, lower, upper, false, writable);
    }

    /**
     * Reverse cursor at the first valid slot at or before {@code start}.
     */
    static <T> FilteringCursor<T> reverse(SlotStorage<T> storage, ElementTraits<T> traits,
                                          int start, int lower, int upper, boolean writable) {
        var i = start;
        while (i >= lower && !traits.isValid(storage.get(i))) {
            i--;
        }
        return new FilteringCursor<>(storage, traits, i, lower, upper, true, writable);
    }

    /**
     * Cursor pinned to {@code index} without skipping, even if the slot is invalid.
     */
    static <T> FilteringCursor<T> at(SlotStorage<T> storage, ElementTraits<T> traits,
                                     int index, int lower, int upper, boolean reverse, boolean writable) {
        return new FilteringCursor<>(storage, traits, index, lower, upper, reverse, writable);
    }

    boolean isOver(SlotStorage<?> other) {
        return storage == other;
    }

    @Override
    public int index() {
        return index;
    }

    @Override
    public boolean isReverse() {
        return reverse;
    }

    @Override
    public boolean isEnd() {
        return reverse ? index < lower : index >= upper;
    }

    @Override
    public boolean isValid() {
        return !isEnd() && traits.isValid(storage.get(index));
    }

    @Override
    public T get() {
        if (isEnd()) {
            throw new NoSuchElementException("cursor is at end");
        }
        return storage.get(index);
    }

    @Override
    public void set(T value) {
        if (!writable) {
            throw new UnsupportedOperationException("read-only cursor");
        }
        if (isEnd()) {
            throw new NoSuchElementException("cursor is at end");
        }
        storage.set(index, value);
    }

    @Override
    public FilteringCursor<T> next() {
        if (isEnd()) {
            throw new NoSuchElementException("cursor is at end");
        }
        return reverse
                ? reverse(storage, traits, index - 1, lower, upper, writable)
                : forward(storage, traits, index + 1, lower, upper, writable);
    }

    @Override
    public FilteringCursor<T> previous() {
        var step = reverse ? 1 : -1;
        var i = index + step;
        while (i >= lower && i < upper && !traits.isValid(storage.get(i))) {
            i += step;
        }
        if (i < lower || i >= upper) {
            throw new NoSuchElementException("no valid slot before cursor");
        }
        return new FilteringCursor<>(storage, traits, i, lower, upper, reverse, writable);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof FilteringCursor<?> other)) {
            return false;
        }
        return storage == other.storage && index == other.index && reverse == other.reverse;
    }

    @Override
    public int hashCode() {
        return 31 * Integer.hashCode(index) + (reverse ? 1 : 0);
    }

    @Override
    public String toString() {
        return "Cursor{index=" + index + ", range=[" + lower + ", " + upper + ")"
                + (reverse ? ", reverse" : "") + (isEnd() ? ", end" : "") + "}";
    }
}
