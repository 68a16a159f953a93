package io.stew.core;

import java.util.Locale;

/**
 * Immutable configuration for guarded containers.
 * <p>
 * Use the builder pattern to create custom configurations:
 * <pre>
 * StewConfiguration config = StewConfiguration.builder()
 *     .storageType(StorageType.PAGED)
 *     .pageSize(256)
 *     .build();
 * </pre>
 * <p>
 * All configuration is immutable once built.
 *
 * @see io.stew.container.GuardedSequenceContainer
 */
public final class StewConfiguration {

    /**
     * System property selecting the default storage type ({@code paged} or {@code array}).
     */
    public static final String STORAGE_PROPERTY = "stew.storage";

    // Slot storage strategy
    private final StorageType storageType;
    private final AppendPolicy appendPolicy;

    // Paged storage sizing
    private final int pageSize;
    private final int maxPages;
    private final int initialPages;

    private StewConfiguration(Builder builder, int maxPages) {
        this.storageType = builder.storageType;
        this.appendPolicy = builder.appendPolicy != null
                ? builder.appendPolicy
                : builder.storageType.defaultAppendPolicy();
        this.pageSize = builder.pageSize;
        this.maxPages = maxPages;
        this.initialPages = builder.initialPages;
    }

    /**
     * Create a new builder for StewConfiguration.
     *
     * @return a new Builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Default configuration, honouring the {@value #STORAGE_PROPERTY} system property.
     *
     * @return configuration with default sizing
     */
    public static StewConfiguration defaults() {
        return builder()
                .storageType(StorageType.fromSystemProperty())
                .build();
    }

    /**
     * Get the slot storage strategy.
     *
     * @return the storage type (PAGED or ARRAY)
     */
    public StorageType storageType() {
        return storageType;
    }

    /**
     * Get the policy applied to appends while a stable view is held.
     *
     * @return the append policy
     */
    public AppendPolicy appendPolicy() {
        return appendPolicy;
    }

    /**
     * Get the page size for paged storage.
     *
     * @return page size (number of slots per page)
     */
    public int pageSize() {
        return pageSize;
    }

    /**
     * Get the maximum number of pages for paged storage. Unless set explicitly this is the
     * largest count whose capacity still fits an {@code int} index.
     *
     * @return max pages
     */
    public int maxPages() {
        return maxPages;
    }

    /**
     * Get the number of pages allocated up front.
     * For array storage this is the initial capacity in pages.
     *
     * @return initial pages
     */
    public int initialPages() {
        return initialPages;
    }

    /**
     * Total slot capacity of paged storage.
     *
     * @return pageSize * maxPages
     */
    public int capacity() {
        return pageSize * maxPages;
    }

    @Override
    public String toString() {
        return "StewConfiguration{storageType=" + storageType
                + ", appendPolicy=" + appendPolicy
                + ", pageSize=" + pageSize
                + ", maxPages=" + maxPages
                + ", initialPages=" + initialPages + "}";
    }

    /**
     * Slot storage strategy enum.
     */
    public enum StorageType {
        /**
         * Fixed-size pages published once and never moved.
         * Live slots keep their location when the storage grows.
         */
        PAGED,

        /**
         * Single contiguous array, copied into a larger one on growth.
         * Slots relocate on growth, so growth is refused while locked.
         */
        ARRAY;

        AppendPolicy defaultAppendPolicy() {
            return this == PAGED ? AppendPolicy.ALLOW : AppendPolicy.REJECT_WHILE_LOCKED;
        }

        /**
         * Resolve the storage type from the {@value #STORAGE_PROPERTY} system property.
         *
         * @return the configured storage type, PAGED when unset
         * @throws IllegalArgumentException if the property names an unknown type
         */
        public static StorageType fromSystemProperty() {
            var value = System.getProperty(STORAGE_PROPERTY, "paged");
            return switch (value.toLowerCase(Locale.ROOT)) {
                case "paged", "page", "default" -> PAGED;
                case "array", "contiguous" -> ARRAY;
                default -> throw new IllegalArgumentException(
                        "Unknown storage type: " + value + ". Use 'paged' or 'array'");
            };
        }
    }

    /**
     * Behaviour of appends and out-of-view inserts while a stable view is held.
     */
    public enum AppendPolicy {
        /**
         * Appends always go through. Requires storage that never relocates live slots.
         */
        ALLOW,

        /**
         * Any write that grows the storage is refused while locked.
         */
        REJECT_WHILE_LOCKED
    }

    /**
     * Builder for StewConfiguration.
     * <p>
     * Provides a fluent API for building configuration instances.
     */
    public static class Builder {
        private StorageType storageType = StorageType.PAGED;
        private AppendPolicy appendPolicy;
        private int pageSize = 1024;
        private Integer maxPages;
        private int initialPages = 1;

        private Builder() {
        }

        /**
         * Set the slot storage strategy.
         *
         * @param storageType the storage strategy
         * @return this builder for method chaining
         */
        public Builder storageType(StorageType storageType) {
            this.storageType = storageType;
            return this;
        }

        /**
         * Set the append policy. When unset, PAGED storage allows appends
         * and ARRAY storage rejects them while locked.
         *
         * @param appendPolicy the append policy
         * @return this builder for method chaining
         */
        public Builder appendPolicy(AppendPolicy appendPolicy) {
            this.appendPolicy = appendPolicy;
            return this;
        }

        /**
         * Set the page size.
         *
         * @param pageSize number of slots per page
         * @return this builder for method chaining
         */
        public Builder pageSize(int pageSize) {
            this.pageSize = pageSize;
            return this;
        }

        /**
         * Set the maximum number of pages.
         *
         * @param maxPages the maximum number of pages
         * @return this builder for method chaining
         */
        public Builder maxPages(int maxPages) {
            this.maxPages = maxPages;
            return this;
        }

        /**
         * Set the number of pages allocated up front.
         *
         * @param initialPages the initial number of pages
         * @return this builder for method chaining
         */
        public Builder initialPages(int initialPages) {
            this.initialPages = initialPages;
            return this;
        }

        /**
         * Build the immutable StewConfiguration.
         *
         * @return a new StewConfiguration instance
         * @throws IllegalArgumentException if sizing is invalid or the storage type
         *                                  cannot honour the append policy
         */
        public StewConfiguration build() {
            if (storageType == null) {
                throw new IllegalArgumentException("storageType required");
            }
            if (pageSize <= 0) {
                throw new IllegalArgumentException("pageSize must be positive: " + pageSize);
            }
            int pages = maxPages != null ? maxPages : Integer.MAX_VALUE / pageSize;
            if (pages <= 0) {
                throw new IllegalArgumentException("maxPages must be positive: " + pages);
            }
            if (initialPages <= 0) {
                throw new IllegalArgumentException("initialPages must be positive: " + initialPages);
            }
            if (initialPages > pages) {
                throw new IllegalArgumentException("initialPages exceeds maxPages: " + initialPages);
            }
            var capacity = (long) pageSize * (long) pages;
            if (capacity > Integer.MAX_VALUE) {
                throw new IllegalArgumentException("capacity exceeds Integer.MAX_VALUE: " + capacity);
            }
            if (storageType == StorageType.ARRAY && appendPolicy == AppendPolicy.ALLOW) {
                throw new IllegalArgumentException(
                        "ARRAY storage relocates slots on growth; use REJECT_WHILE_LOCKED");
            }
            return new StewConfiguration(this, pages);
        }
    }
}
