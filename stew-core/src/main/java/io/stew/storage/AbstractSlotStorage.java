package io.stew.storage;

import java.util.Objects;
import java.util.function.Predicate;

/**
 * Base class for slot storages.
 * <p>
 * Implements shifting, compaction and size publication on top of three primitives
 * supplied by subclasses: slot read, slot write and capacity growth.
 * The size is published through a volatile write after the slot content is written,
 * so a reader that observes the new size also observes the slot.
 *
 * @param <T> slot value type
 */
public abstract class AbstractSlotStorage<T> implements SlotStorage<T> {

    private volatile int size;

    protected abstract T readSlot(int index);

    protected abstract void writeSlot(int index, T value);

    /**
     * Make room for at least {@code required} slots.
     *
     * @throws IllegalStateException if the storage cannot grow that far
     */
    protected abstract void ensureCapacity(int required);

    @Override
    public int size() {
        return size;
    }

    @Override
    public T get(int index) {
        Objects.checkIndex(index, size);
        return readSlot(index);
    }

    @Override
    public void set(int index, T value) {
        Objects.checkIndex(index, size);
        writeSlot(index, value);
    }

    @Override
    public void add(T value) {
        var current = size;
        ensureCapacity(current + 1);
        writeSlot(current, value);
        size = current + 1;
    }

    @Override
    public void insert(int index, T value) {
        var current = size;
        if (index < 0 || index > current) {
            throw new IndexOutOfBoundsException("insert index " + index + " outside [0, " + current + "]");
        }
        ensureCapacity(current + 1);
        for (var i = current; i > index; i--) {
            writeSlot(i, readSlot(i - 1));
        }
        writeSlot(index, value);
        size = current + 1;
    }

    @Override
    public void remove(int index) {
        var current = size;
        Objects.checkIndex(index, current);
        for (var i = index; i < current - 1; i++) {
            writeSlot(i, readSlot(i + 1));
        }
        size = current - 1;
        writeSlot(current - 1, null);
    }

    @Override
    public int removeIf(Predicate<? super T> filter) {
        Objects.requireNonNull(filter, "filter");
        var current = size;
        var write = 0;
        var read = 0;
        try {
            for (; read < current; read++) {
                var value = readSlot(read);
                if (filter.test(value)) {
                    continue;
                }
                if (write != read) {
                    writeSlot(write, value);
                }
                write++;
            }
        } finally {
            // If the filter threw, slots from the failing one onward are kept.
            for (; read < current; read++, write++) {
                if (write != read) {
                    writeSlot(write, readSlot(read));
                }
            }
            size = write;
            for (var i = write; i < current; i++) {
                writeSlot(i, null);
            }
        }
        return current - write;
    }

    @Override
    public void truncate(int newSize) {
        var current = size;
        if (newSize < 0 || newSize > current) {
            throw new IndexOutOfBoundsException("truncate size " + newSize + " outside [0, " + current + "]");
        }
        size = newSize;
        for (var i = newSize; i < current; i++) {
            writeSlot(i, null);
        }
    }

    @Override
    public void clear() {
        truncate(0);
    }
}
