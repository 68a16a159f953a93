package io.stew.storage;

import io.stew.core.StewConfiguration;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReferenceArray;

/**
 * Slot storage split into fixed-size pages.
 * <p>
 * Pages are published with CAS and never replaced, so growth never moves a live slot:
 * a reader positioned on slot {@code i} keeps reading the same page cell however many
 * slots are appended afterwards. The page directory doubles on demand up to
 * {@code maxPages}; a grown directory references the same page arrays as the old one.
 * <p>
 * <b>Thread-safety:</b>
 * <ul>
 *   <li>Writers: single writer expected (or external synchronization)</li>
 *   <li>Readers: many concurrent readers through volatile page cells</li>
 * </ul>
 *
 * @param <T> slot value type
 */
public final class PagedSlotStorage<T> extends AbstractSlotStorage<T> {

    private static final int INITIAL_DIRECTORY = 16;

    private final int pageSize;
    private final int maxPages;
    private final int capacity;
    private volatile AtomicReferenceArray<AtomicReferenceArray<T>> pages;
    private final AtomicInteger allocatedPages = new AtomicInteger(0);

    /**
     * Create a PagedSlotStorage.
     *
     * @param pageSize     slots per page (must be positive)
     * @param maxPages     maximum pages (must be positive)
     * @param initialPages pages allocated up front (must be positive and &lt;= maxPages)
     */
    public PagedSlotStorage(int pageSize, int maxPages, int initialPages) {
        if (pageSize <= 0) {
            throw new IllegalArgumentException("pageSize must be positive: " + pageSize);
        }
        if (maxPages <= 0) {
            throw new IllegalArgumentException("maxPages must be positive: " + maxPages);
        }
        if (initialPages <= 0) {
            throw new IllegalArgumentException("initialPages must be positive: " + initialPages);
        }
        if (initialPages > maxPages) {
            throw new IllegalArgumentException("initialPages exceeds maxPages: " + initialPages);
        }
        var total = (long) pageSize * (long) maxPages;
        if (total > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("capacity exceeds Integer.MAX_VALUE: " + total);
        }
        this.pageSize = pageSize;
        this.maxPages = maxPages;
        this.capacity = (int) total;
        this.pages = new AtomicReferenceArray<>(Math.min(maxPages, Math.max(initialPages, INITIAL_DIRECTORY)));
        for (var pageId = 0; pageId < initialPages; pageId++) {
            getOrCreatePage(pageId);
        }
    }

    public PagedSlotStorage(StewConfiguration configuration) {
        this(configuration.pageSize(), configuration.maxPages(), configuration.initialPages());
    }

    public int pageSize() {
        return pageSize;
    }

    public int maxPages() {
        return maxPages;
    }

    /**
     * Get currently allocated pages.
     */
    public int allocatedPages() {
        return allocatedPages.get();
    }

    /**
     * Current length of the page directory.
     */
    public int directoryLength() {
        return pages.length();
    }

    @Override
    public int capacity() {
        return capacity;
    }

    @Override
    protected T readSlot(int index) {
        return pages.get(index / pageSize).get(index % pageSize);
    }

    @Override
    protected void writeSlot(int index, T value) {
        pages.get(index / pageSize).set(index % pageSize, value);
    }

    @Override
    protected void ensureCapacity(int required) {
        if (required > capacity) {
            throw new IllegalStateException("Slot storage capacity exceeded: " + capacity);
        }
        getOrCreatePage((required - 1) / pageSize);
    }

    private AtomicReferenceArray<T> getOrCreatePage(int pageId) {
        var directory = pageId < pages.length() ? pages : growDirectory(pageId + 1);
        var existing = directory.get(pageId);
        if (existing != null) {
            return existing;
        }
        var created = new AtomicReferenceArray<T>(pageSize);
        if (directory.compareAndSet(pageId, null, created)) {
            allocatedPages.incrementAndGet();
            return created;
        }
        return directory.get(pageId);
    }

    // Single writer: the copy is published before any slot on the new pages is.
    private AtomicReferenceArray<AtomicReferenceArray<T>> growDirectory(int required) {
        var current = pages;
        var length = (int) Math.min(maxPages, Math.max(required, (long) current.length() * 2));
        var grown = new AtomicReferenceArray<AtomicReferenceArray<T>>(length);
        for (var pageId = 0; pageId < current.length(); pageId++) {
            grown.set(pageId, current.get(pageId));
        }
        pages = grown;
        return grown;
    }
}
