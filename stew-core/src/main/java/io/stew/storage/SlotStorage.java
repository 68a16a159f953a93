package io.stew.storage;

import java.util.function.Predicate;

/**
 * Index-addressed slot storage backing a guarded container.
 * <p>
 * <b>Contract:</b>
 * <ul>
 *   <li>Slots are numbered {@code 0..size()-1}; a slot may hold any value, including null.</li>
 *   <li>Single writer. Readers may call {@link #get(int)} concurrently with a writer
 *       that only touches other slots or replaces a slot with {@link #set(int, Object)}.</li>
 *   <li>{@link #insert(int, Object)} and {@link #remove(int)} shift every slot at or after the index.</li>
 * </ul>
 *
 * @param <T> slot value type
 */
public interface SlotStorage<T> {

    /**
     * @return number of slots, live or not
     */
    int size();

    /**
     * @return maximum number of slots this storage can hold
     */
    int capacity();

    /**
     * Read a slot.
     *
     * @param index slot index
     * @return the slot content
     * @throws IndexOutOfBoundsException if index is outside {@code [0, size())}
     */
    T get(int index);

    /**
     * Replace a slot's content in place.
     *
     * @param index slot index
     * @param value new content
     * @throws IndexOutOfBoundsException if index is outside {@code [0, size())}
     */
    void set(int index, T value);

    /**
     * Append a slot.
     *
     * @param value content of the new slot
     * @throws IllegalStateException if capacity is exceeded
     */
    void add(T value);

    /**
     * Insert a slot before {@code index}, shifting trailing slots up by one.
     *
     * @param index insert position, {@code size()} appends
     * @param value content of the new slot
     * @throws IndexOutOfBoundsException if index is outside {@code [0, size()]}
     * @throws IllegalStateException if capacity is exceeded
     */
    void insert(int index, T value);

    /**
     * Remove a slot, shifting trailing slots down by one.
     *
     * @param index slot index
     * @throws IndexOutOfBoundsException if index is outside {@code [0, size())}
     */
    void remove(int index);

    /**
     * Remove every slot whose content matches the filter, keeping the order of the rest.
     *
     * @param filter selects slots to drop
     * @return number of removed slots
     */
    int removeIf(Predicate<? super T> filter);

    /**
     * Drop every slot at or after {@code newSize}.
     *
     * @param newSize new slot count
     * @throws IndexOutOfBoundsException if newSize is outside {@code [0, size()]}
     */
    void truncate(int newSize);

    /**
     * Drop every slot.
     */
    void clear();
}
