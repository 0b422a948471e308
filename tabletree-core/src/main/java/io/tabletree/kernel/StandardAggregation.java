package io.tabletree.kernel;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Built-in aggregation operators, registered under their lower-case names.
 */
public enum StandardAggregation implements AggregationOperation {

    SUM("sum") {
        @Override
        public Object aggregate(Object current, Object incoming) {
            return sum(current, incoming);
        }
    },

    MIN("min") {
        @Override
        public Object aggregate(Object current, Object incoming) {
            if (Values.isEmpty(current)) {
                return incoming;
            }
            if (Values.isEmpty(incoming)) {
                return current;
            }
            if (current instanceof Number c && incoming instanceof Number i) {
                return Values.compare(i, c) < 0 ? i : c;
            }
            return current;
        }
    },

    MAX("max") {
        @Override
        public Object aggregate(Object current, Object incoming) {
            if (current == null) {
                return incoming;
            }
            if (incoming == null) {
                return current;
            }
            if (current instanceof Number c && incoming instanceof Number i) {
                return Values.compare(i, c) > 0 ? i : c;
            }
            return current;
        }
    };

    private final String operationName;

    StandardAggregation(String operationName) {
        this.operationName = operationName;
    }

    public String operationName() {
        return operationName;
    }

    private static Object sum(Object current, Object incoming) {
        if (incoming instanceof Number in) {
            if (current == null) {
                return in;
            }
            if (current instanceof Number cur) {
                return Values.add(cur, in);
            }
            return current;
        }
        if (incoming == null) {
            return current;
        }
        if (current == null) {
            return incoming;
        }
        if (current instanceof Map<?, ?> cur && incoming instanceof Map<?, ?> in) {
            Map<Object, Object> merged = new LinkedHashMap<>(cur);
            for (Map.Entry<?, ?> entry : in.entrySet()) {
                merged.put(entry.getKey(), sum(merged.get(entry.getKey()), entry.getValue()));
            }
            return merged;
        }
        return current;
    }
}
