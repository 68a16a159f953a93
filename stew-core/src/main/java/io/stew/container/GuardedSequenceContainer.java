package io.stew.container;

import io.stew.core.StewConfiguration;
import io.stew.lock.LockContractException;
import io.stew.lock.LockGuard;
import io.stew.lock.LockObserver;
import io.stew.lock.ReferenceCountedLock;
import io.stew.storage.SlotStorage;
import io.stew.storage.SlotStorageFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Reference-counted sequence container whose readers keep stable positions while a writer mutates it.
 * <p>
 * Readers hold the container's {@link ReferenceCountedLock} and iterate the locked view. The first hold
 * captures the view over the slots present at that moment; until the last hold is released the number
 * of slots in that range never changes:
 * <ul>
 *   <li>erasing or clearing inside the range tombstones slots with the element traits' empty value;</li>
 *   <li>inserting inside the range is refused;</li>
 *   <li>slots appended after the range may be inserted and erased freely, subject to the
 *       configured {@link StewConfiguration.AppendPolicy}.</li>
 * </ul>
 * When the last hold is released every slot failing the validity predicate is physically removed.
 * <p>
 * <b>Thread-safety:</b> any number of readers; one writer at a time. Mutations run under the lock's
 * transition mutex and never overlap the lifecycle hooks.
 * <pre>
 * try (LockGuard guard = container.guard()) {
 *     for (String element : container.getLockedView().orElseThrow()) {
 *         ...
 *     }
 * }
 * </pre>
 *
 * @param <T> element type
 */
public class GuardedSequenceContainer<T> implements LockObserver {

    private static final Logger log = LoggerFactory.getLogger(GuardedSequenceContainer.class);

    private final StewConfiguration configuration;
    private final ElementTraits<T> traits;
    private final SlotStorage<T> storage;
    private final ReferenceCountedLock lock;

    private volatile View<T> lockedView;

    public GuardedSequenceContainer(ElementTraits<T> traits) {
        this(traits, StewConfiguration.defaults());
    }

    public GuardedSequenceContainer(ElementTraits<T> traits, StewConfiguration configuration) {
        this.traits = Objects.requireNonNull(traits, "traits");
        this.configuration = Objects.requireNonNull(configuration, "configuration");
        this.storage = SlotStorageFactory.create(configuration);
        this.lock = new ReferenceCountedLock(this);
    }

    public StewConfiguration configuration() {
        return configuration;
    }

    public ElementTraits<T> elementTraits() {
        return traits;
    }

    // Locking

    public void lock() {
        lock.lock();
    }

    public boolean tryLock() {
        return lock.tryLock();
    }

    public void unlock() {
        lock.unlock();
    }

    /**
     * Take a hold released by closing the returned guard.
     */
    public LockGuard guard() {
        return LockGuard.acquire(lock);
    }

    /**
     * Run {@code reader} against the locked view while holding the lock.
     */
    public <R> R read(Function<? super View<T>, ? extends R> reader) {
        try (var guard = guard()) {
            var view = getLockedView()
                    .orElseThrow(() -> new LockContractException("no stable view while lock is held"));
            return reader.apply(view);
        }
    }

    public int holdCount() {
        return lock.holdCount();
    }

    @Override
    public void onFirstAcquire() {
        acquireFirstLock();
    }

    @Override
    public void onLastRelease() {
        releaseLastLock();
    }

    /**
     * Capture the stable view over the current slots. Does nothing if one is already captured.
     *
     * @return the stable view
     */
    public View<T> acquireFirstLock() {
        var view = lockedView;
        if (view == null) {
            view = new View<>(storage, traits, 0, storage.size());
            lockedView = view;
            log.debug("Captured stable view over {} slots", view.slotCount());
        }
        return view;
    }

    /**
     * Physically remove every invalid slot, then discard the stable view. The view is discarded
     * even if the validity predicate throws; slots it did not reach are kept.
     *
     * @throws LockContractException if no stable view is held
     */
    public void releaseLastLock() {
        if (lockedView == null) {
            throw new LockContractException("releaseLastLock() without a stable view");
        }
        var before = storage.size();
        try {
            var removed = storage.removeIf(element -> !traits.isValid(element));
            log.debug("Released stable view, compacted {} of {} slots", removed, before);
        } finally {
            lockedView = null;
        }
    }

    public boolean isLocked() {
        return lockedView != null;
    }

    /**
     * @return the stable view, empty when unlocked
     */
    public Optional<View<T>> getLockedView() {
        return Optional.ofNullable(lockedView);
    }

    // Writer access

    /**
     * Fresh view over every slot currently stored. Meant for the writer; readers use the locked view.
     */
    public View<T> view() {
        return new View<>(storage, traits, 0, storage.size());
    }

    /**
     * @return writable cursor at the first valid slot
     */
    public Cursor<T> begin() {
        var size = storage.size();
        return FilteringCursor.forward(storage, traits, 0, 0, size, true);
    }

    public Cursor<T> end() {
        var size = storage.size();
        return FilteringCursor.at(storage, traits, size, 0, size, false, true);
    }

    /**
     * @return writable cursor pinned to slot {@code index}, valid or not
     */
    public Cursor<T> cursorAt(int index) {
        var size = storage.size();
        if (index < 0 || index > size) {
            throw new IndexOutOfBoundsException("index " + index + " outside [0, " + size + "]");
        }
        return FilteringCursor.at(storage, traits, index, 0, size, false, true);
    }

    /**
     * @return number of physical slots, tombstones included
     */
    public int slotCount() {
        return storage.size();
    }

    /**
     * @return number of valid elements
     */
    public int size() {
        return view().size();
    }

    public boolean isEmpty() {
        return view().isEmpty();
    }

    // Modifiers

    /**
     * Clears the container. While locked every slot is tombstoned and the slot count is kept;
     * the last unlock removes them.
     */
    public void clear() {
        lock.runExclusive(() -> {
            if (lockedView == null) {
                storage.clear();
                return;
            }
            var end = storage.size();
            for (var i = 0; i < end; i++) {
                storage.set(i, traits.emptyValue());
            }
        });
    }

    /**
     * Inserts an item before {@code position}.
     *
     * @param position forward cursor of this container; {@link #end()} appends
     * @param item     the item to insert
     * @return cursor at the inserted item, or empty if the position lies inside the locked view
     *         (or the append policy refuses growth while locked)
     */
    public Optional<Cursor<T>> insert(ConstCursor<T> position, T item) {
        var index = ownedIndex(position);
        return lock.<Optional<Cursor<T>>>exclusive(() -> {
            var view = lockedView;
            if (view != null) {
                if (view.inRange(index)) {
                    log.debug("Rejected insert at slot {}: inside stable view of {} slots", index, view.slotCount());
                    return Optional.empty();
                }
                if (!growthAllowedWhileLocked()) {
                    log.debug("Rejected insert at slot {}: {} while locked", index, configuration.appendPolicy());
                    return Optional.empty();
                }
            }
            storage.insert(index, item);
            return Optional.of(FilteringCursor.forward(storage, traits, index, 0, storage.size(), true));
        });
    }

    /**
     * Erases or resets the item at {@code position}.
     * <ul>
     *   <li>Inside the locked view the slot is tombstoned and a cursor pinned to it is returned.</li>
     *   <li>Outside the locked view the slot is removed and nothing is returned.</li>
     *   <li>Unlocked, the slot is removed and a cursor at the following element is returned.</li>
     * </ul>
     *
     * @param position forward cursor of this container, not at its end
     * @return the continuation cursor, empty for removals outside the locked view
     * @throws IllegalArgumentException if {@code position} is an end cursor
     */
    public Optional<Cursor<T>> erase(ConstCursor<T> position) {
        var index = ownedIndex(position);
        if (position.isEnd()) {
            throw new IllegalArgumentException("cannot erase at an end cursor: " + position);
        }
        return lock.<Optional<Cursor<T>>>exclusive(() -> eraseAt(index));
    }

    /**
     * Erases the first valid element equal to {@code item}, following the rules of
     * {@link #erase(ConstCursor)}. Lookup and erase happen atomically with respect to
     * lock transitions, so the slot cannot be shifted by a compaction in between.
     *
     * @param item the item to erase
     * @return true if an element was found
     */
    public boolean remove(T item) {
        return lock.<Boolean>exclusive(() -> {
            var found = view().find(item);
            if (found.isEnd()) {
                return false;
            }
            eraseAt(found.index());
            return true;
        });
    }

    private Optional<Cursor<T>> eraseAt(int index) {
        var view = lockedView;
        if (view != null) {
            if (view.inRange(index)) {
                storage.set(index, traits.emptyValue());
                return Optional.of(FilteringCursor.at(storage, traits, index, 0, storage.size(), false, true));
            }
            storage.remove(index);
            return Optional.empty();
        }
        storage.remove(index);
        return Optional.of(FilteringCursor.forward(storage, traits, index, 0, storage.size(), true));
    }

    /**
     * Adds an element at the end of the container.
     *
     * @param element the element to add
     * @return false if the append policy refuses growth while locked
     */
    public boolean pushBack(T element) {
        return lock.<Boolean>exclusive(() -> {
            if (lockedView != null && !growthAllowedWhileLocked()) {
                log.debug("Rejected append: {} while locked", configuration.appendPolicy());
                return false;
            }
            storage.add(element);
            return true;
        });
    }

    private boolean growthAllowedWhileLocked() {
        return configuration.appendPolicy() == StewConfiguration.AppendPolicy.ALLOW;
    }

    private int ownedIndex(ConstCursor<T> position) {
        Objects.requireNonNull(position, "position");
        if (!(position instanceof FilteringCursor<T> cursor) || !cursor.isOver(storage)) {
            throw new IllegalArgumentException("cursor does not belong to this container: " + position);
        }
        if (cursor.isReverse()) {
            throw new IllegalArgumentException("reverse cursors cannot address a mutation: " + position);
        }
        return cursor.index();
    }

    @Override
    public String toString() {
        return "GuardedSequenceContainer{slots=" + storage.size()
                + ", holds=" + lock.holdCount()
                + ", locked=" + isLocked() + "}";
    }
}
