package io.tabletree.kernel;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-column choice of aggregation operator. Columns without an explicit entry are summed.
 */
public final class AggregationPolicy {

    private static final AggregationPolicy SUM_EVERYTHING =
            new AggregationPolicy(AggregationRegistry.defaults(), Map.of());

    private final AggregationRegistry registry;
    private final Map<String, String> operationsByColumn;

    public AggregationPolicy(AggregationRegistry registry, Map<String, String> operationsByColumn) {
        if (registry == null) {
            throw new IllegalArgumentException("registry required");
        }
        this.registry = registry;
        this.operationsByColumn = operationsByColumn == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(operationsByColumn));
    }

    public static AggregationPolicy sumEverything() {
        return SUM_EVERYTHING;
    }

    public AggregationOperation operationFor(String column) {
        String name = operationsByColumn.get(column);
        if (name == null) {
            return StandardAggregation.SUM;
        }
        return registry.resolve(name);
    }

    public Map<String, String> operationsByColumn() {
        return operationsByColumn;
    }

    public AggregationRegistry registry() {
        return registry;
    }
}
