package io.tabletree.kernel;

import io.tabletree.core.TableTreeException;

import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of aggregation operators by name, with support for client-registered custom operators.
 * Names are case-insensitive.
 */
public final class AggregationRegistry {

    private final Map<String, AggregationOperation> operations = new ConcurrentHashMap<>();

    private AggregationRegistry() {
    }

    /**
     * Registry holding {@code sum}, {@code min} and {@code max}.
     */
    public static AggregationRegistry defaults() {
        AggregationRegistry registry = new AggregationRegistry();
        for (StandardAggregation aggregation : StandardAggregation.values()) {
            registry.register(aggregation.operationName(), aggregation);
        }
        return registry;
    }

    public AggregationRegistry register(String name, AggregationOperation operation) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name required");
        }
        if (operation == null) {
            throw new IllegalArgumentException("operation required");
        }
        operations.put(normalize(name), operation);
        return this;
    }

    public boolean contains(String name) {
        return name != null && operations.containsKey(normalize(name));
    }

    public AggregationOperation resolve(String name) {
        AggregationOperation operation = name == null ? null : operations.get(normalize(name));
        if (operation == null) {
            throw new TableTreeException("Unknown operation '" + name + "'.");
        }
        return operation;
    }

    public Set<String> names() {
        return Set.copyOf(operations.keySet());
    }

    private static String normalize(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }
}
