package io.tabletree.core;

import io.tabletree.filter.FilterRegistry;
import io.tabletree.kernel.AggregationRegistry;

/**
 * Immutable configuration shared by every table of a {@link TableArena}.
 * <p>
 * Use the builder to create custom configurations:
 * <pre>
 * TableTreeConfiguration config = TableTreeConfiguration.builder()
 *     .maximumDepth(20)
 *     .build();
 * </pre>
 *
 * @see TableArena
 */
public final class TableTreeConfiguration {

    /** Default ceiling on sub-table nesting. */
    public static final int DEFAULT_MAXIMUM_DEPTH = 15;

    private final int maximumDepth;
    private final AggregationRegistry aggregationRegistry;
    private final FilterRegistry filterRegistry;

    private TableTreeConfiguration(Builder builder) {
        this.maximumDepth = builder.maximumDepth;
        this.aggregationRegistry = builder.aggregationRegistry != null
                ? builder.aggregationRegistry
                : AggregationRegistry.defaults();
        this.filterRegistry = builder.filterRegistry != null
                ? builder.filterRegistry
                : FilterRegistry.defaults();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static TableTreeConfiguration defaults() {
        return builder().build();
    }

    /**
     * Deepest sub-table level a traversal may reach. The root table is level 0.
     *
     * @return maximum depth, at least 1
     */
    public int maximumDepth() {
        return maximumDepth;
    }

    /**
     * Operators available to {@code DataTable#setColumnAggregationOperation}.
     */
    public AggregationRegistry aggregationRegistry() {
        return aggregationRegistry;
    }

    /**
     * Filters available to {@code DataTable#filter(String, Object...)}.
     */
    public FilterRegistry filterRegistry() {
        return filterRegistry;
    }

    /**
     * Copy of this configuration whose maximum depth is at least {@code atLeast}.
     */
    public TableTreeConfiguration withMaximumDepthAtLeast(int atLeast) {
        return builder()
                .maximumDepth(Math.max(Math.max(atLeast, maximumDepth), 1))
                .aggregationRegistry(aggregationRegistry)
                .filterRegistry(filterRegistry)
                .build();
    }

    public static class Builder {
        private int maximumDepth = DEFAULT_MAXIMUM_DEPTH;
        private AggregationRegistry aggregationRegistry;
        private FilterRegistry filterRegistry;

        private Builder() {
        }

        public Builder maximumDepth(int maximumDepth) {
            if (maximumDepth < 1) {
                throw new IllegalArgumentException("maximumDepth must be at least 1");
            }
            this.maximumDepth = maximumDepth;
            return this;
        }

        public Builder aggregationRegistry(AggregationRegistry aggregationRegistry) {
            this.aggregationRegistry = aggregationRegistry;
            return this;
        }

        public Builder filterRegistry(FilterRegistry filterRegistry) {
            this.filterRegistry = filterRegistry;
            return this;
        }

        public TableTreeConfiguration build() {
            return new TableTreeConfiguration(this);
        }
    }
}
