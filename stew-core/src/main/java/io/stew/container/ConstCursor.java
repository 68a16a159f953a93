package io.stew.container;

/**
 * Read-only position in a guarded container.
 * <p>
 * Cursors are immutable values: stepping returns a new cursor. Stepping skips every slot
 * whose content fails the container's validity predicate, stopping at the next valid slot
 * or at the end sentinel. Two cursors are equal when they address the same slot of the same
 * container in the same direction, regardless of the range they were created for.
 *
 * @param <T> element type
 */
public interface ConstCursor<T> {

    /**
     * Physical slot index. The end sentinel of a forward cursor is the range's upper bound,
     * that of a reverse cursor is one below the range's lower bound.
     */
    int index();

    boolean isReverse();

    boolean isEnd();

    /**
     * @return true if the cursor is not at the end and its slot currently passes the predicate
     */
    boolean isValid();

    /**
     * Live content of the slot. A slot tombstoned after the cursor was created
     * yields the empty value.
     *
     * @throws java.util.NoSuchElementException at the end sentinel
     */
    T get();

    /**
     * @return cursor at the next valid slot, or the end sentinel
     * @throws java.util.NoSuchElementException if already at the end
     */
    ConstCursor<T> next();

    /**
     * @return cursor at the previous valid slot
     * @throws java.util.NoSuchElementException if there is no valid slot before this one
     */
    ConstCursor<T> previous();
}
