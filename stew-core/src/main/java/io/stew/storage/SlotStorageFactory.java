package io.stew.storage;

import io.stew.core.StewConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates the slot storage selected by a {@link StewConfiguration}.
 */
public final class SlotStorageFactory {

    private static final Logger log = LoggerFactory.getLogger(SlotStorageFactory.class);

    private SlotStorageFactory() {
    }

    public static <T> SlotStorage<T> create(StewConfiguration configuration) {
        return switch (configuration.storageType()) {
            case PAGED -> {
                log.debug("Using paged slot storage (pageSize={}, maxPages={})",
                        configuration.pageSize(), configuration.maxPages());
                yield new PagedSlotStorage<>(configuration);
            }
            case ARRAY -> {
                log.debug("Using array slot storage (initialCapacity={})",
                        configuration.pageSize() * configuration.initialPages());
                yield new ArraySlotStorage<>(configuration.pageSize() * configuration.initialPages());
            }
        };
    }
}
