package io.stew.storage;

import java.util.concurrent.atomic.AtomicReferenceArray;

/**
 * Slot storage over one contiguous array.
 * <p>
 * Growth copies every slot into a larger array, so a reader holding the previous array
 * no longer sees writes made after the copy. Containers over this storage must not grow
 * it while a stable view is held.
 *
 * @param <T> slot value type
 */
public final class ArraySlotStorage<T> extends AbstractSlotStorage<T> {

    private static final int MAX_CAPACITY = Integer.MAX_VALUE - 8;

    private volatile AtomicReferenceArray<T> slots;

    public ArraySlotStorage(int initialCapacity) {
        if (initialCapacity <= 0) {
            throw new IllegalArgumentException("initialCapacity must be positive: " + initialCapacity);
        }
        this.slots = new AtomicReferenceArray<>(initialCapacity);
    }

    /**
     * Current length of the backing array.
     */
    public int allocatedSlots() {
        return slots.length();
    }

    @Override
    public int capacity() {
        return MAX_CAPACITY;
    }

    @Override
    protected T readSlot(int index) {
        return slots.get(index);
    }

    @Override
    protected void writeSlot(int index, T value) {
        slots.set(index, value);
    }

    @Override
    protected void ensureCapacity(int required) {
        var current = slots;
        if (required <= current.length()) {
            return;
        }
        if (required > MAX_CAPACITY) {
            throw new IllegalStateException("Slot storage capacity exceeded: " + MAX_CAPACITY);
        }
        var grown = (int) Math.min(MAX_CAPACITY, Math.max(required, (long) current.length() * 2));
        var copy = new AtomicReferenceArray<T>(grown);
        var live = size();
        for (var i = 0; i < live; i++) {
            copy.set(i, current.get(i));
        }
        slots = copy;
    }
}
