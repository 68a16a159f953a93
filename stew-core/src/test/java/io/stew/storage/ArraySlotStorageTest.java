package io.stew.storage;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static io.stew.storage.PagedSlotStorageTest.contents;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ArraySlotStorageTest {

    @Test
    @DisplayName("growth should copy slots into a larger array")
    void add_shouldGrowByCopying() {
        var storage = new ArraySlotStorage<Integer>(2);

        for (var i = 0; i < 5; i++) {
            storage.add(i);
        }

        assertThat(storage.allocatedSlots()).isGreaterThanOrEqualTo(5);
        assertThat(contents(storage)).containsExactly(0, 1, 2, 3, 4);
    }

    @Test
    @DisplayName("insert that triggers growth should keep order")
    void insert_shouldKeepOrderAcrossGrowth() {
        var storage = new ArraySlotStorage<String>(2);
        storage.add("a");
        storage.add("c");

        storage.insert(1, "b");

        assertThat(contents(storage)).containsExactly("a", "b", "c");
    }

    @Test
    @DisplayName("removeIf and remove should behave like the paged storage")
    void removal_shouldMatchPagedStorage() {
        var storage = new ArraySlotStorage<String>(4);
        storage.add("a");
        storage.add("");
        storage.add("b");
        storage.add("c");

        storage.removeIf(String::isEmpty);
        storage.remove(0);

        assertThat(contents(storage)).containsExactly("b", "c");
    }

    @Test
    @DisplayName("constructor should reject non-positive capacity")
    void constructor_shouldRejectNonPositiveCapacity() {
        assertThatThrownBy(() -> new ArraySlotStorage<String>(0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("initialCapacity must be positive");
    }
}
