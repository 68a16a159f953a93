package io.stew.container;

import io.stew.storage.SlotStorage;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Read-only window over a fixed slot range of a guarded container.
 * <p>
 * The range is fixed when the view is created; slot contents are read live. Every
 * traversal (cursors, {@link #iterator()}, {@link #stream()}, {@link #size()}, {@link #find(Object)})
 * skips slots that fail the container's validity predicate, so tombstoned slots are invisible
 * although they still occupy the range.
 * <p>
 * A view is immutable and can be shared by any number of reader threads.
 *
 * @param <T> element type
 */
public final class View<T> implements Iterable<T> {

    private final SlotStorage<T> storage;
    private final ElementTraits<T> traits;
    private final int lower;
    private final int upper;

    View(SlotStorage<T> storage, ElementTraits<T> traits, int lower, int upper) {
        if (lower < 0 || upper < lower) {
            throw new IllegalArgumentException("invalid view range [" + lower + ", " + upper + ")");
        }
        this.storage = storage;
        this.traits = traits;
        this.lower = lower;
        this.upper = upper;
    }

    /**
     * @return cursor at the first valid slot of the range, or {@link #end()}
     */
    public ConstCursor<T> begin() {
        return FilteringCursor.forward(storage, traits, lower, lower, upper, false);
    }

    public ConstCursor<T> end() {
        return FilteringCursor.at(storage, traits, upper, lower, upper, false, false);
    }

    /**
     * @return reverse cursor at the last valid slot of the range, or {@link #reverseEnd()}
     */
    public ConstCursor<T> reverseBegin() {
        return FilteringCursor.reverse(storage, traits, upper - 1, lower, upper, false);
    }

    public ConstCursor<T> reverseEnd() {
        return FilteringCursor.at(storage, traits, lower - 1, lower, upper, true, false);
    }

    /**
     * Linear scan of the visible positions.
     *
     * @return true if {@code position} addresses a currently visible slot of this view
     */
    public boolean inView(ConstCursor<T> position) {
        if (position == null) {
            return false;
        }
        for (var it = begin(); !it.isEnd(); it = it.next()) {
            if (it.equals(position)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Range membership, ignoring slot validity.
     *
     * @return true if {@code position} is a forward cursor of the same container
     *         addressing a slot inside this view's range
     */
    public boolean inRange(ConstCursor<T> position) {
        return position instanceof FilteringCursor<T> cursor
                && cursor.isOver(storage)
                && !cursor.isReverse()
                && inRange(cursor.index());
    }

    boolean inRange(int index) {
        return index >= lower && index < upper;
    }

    /**
     * @return true if no slot in the range is valid
     */
    public boolean isEmpty() {
        return begin().isEnd();
    }

    /**
     * @return number of valid slots in the range
     */
    public int size() {
        var count = 0;
        for (var i = lower; i < upper; i++) {
            if (traits.isValid(storage.get(i))) {
                count++;
            }
        }
        return count;
    }

    /**
     * @return number of slots in the range, valid or not
     */
    public int slotCount() {
        return upper - lower;
    }

    /**
     * Find an element in the view.
     *
     * @param item the item to find
     * @return cursor at the first valid slot equal to {@code item}, or {@link #end()}
     */
    public ConstCursor<T> find(T item) {
        for (var i = lower; i < upper; i++) {
            var value = storage.get(i);
            if (traits.isValid(value) && Objects.equals(value, item)) {
                return FilteringCursor.at(storage, traits, i, lower, upper, false, false);
            }
        }
        return end();
    }

    public boolean contains(T item) {
        return !find(item).isEnd();
    }

    /**
     * Iterates the valid elements. Each slot is read once, so an element returned
     * by {@code next()} passed the predicate when it was read.
     */
    @Override
    public Iterator<T> iterator() {
        return new Iterator<>() {
            private int next = lower;
            private T pending;
            private boolean ready;

            @Override
            public boolean hasNext() {
                while (!ready && next < upper) {
                    var value = storage.get(next++);
                    if (traits.isValid(value)) {
                        pending = value;
                        ready = true;
                    }
                }
                return ready;
            }

            @Override
            public T next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                var value = pending;
                pending = null;
                ready = false;
                return value;
            }
        };
    }

    public Stream<T> stream() {
        return StreamSupport.stream(spliterator(), false);
    }

    /**
     * @return snapshot copy of the valid elements
     */
    public List<T> toList() {
        var elements = new ArrayList<T>();
        forEach(elements::add);
        return Collections.unmodifiableList(elements);
    }

    @Override
    public String toString() {
        return "View{range=[" + lower + ", " + upper + "), elements=" + toList() + "}";
    }
}
