package io.stew.container;

/**
 * Mutable position in a guarded container. Only the writer should hold one.
 *
 * @param <T> element type
 */
public interface Cursor<T> extends ConstCursor<T> {

    /**
     * Overwrite the slot content in place.
     *
     * @throws java.util.NoSuchElementException at the end sentinel
     * @throws UnsupportedOperationException    if the cursor was handed out read-only
     */
    void set(T value);

    @Override
    Cursor<T> next();

    @Override
    Cursor<T> previous();
}
