package io.tabletree.storage;

import io.tabletree.core.ConversionException;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Maps "simple" nested collections to rows.
 * <p>
 * Two shapes are understood:
 * <ul>
 * <li>only scalar values: a list (or a map keyed 0..n-1) gives one single-column row per value,
 * any other map gives one row whose columns are the map entries;</li>
 * <li>otherwise each entry is a row: a nested map or list becomes the columns, a scalar becomes a
 * one-column row named after its key.</li>
 * </ul>
 * A nested map under a non-numeric key, or a row that itself contains a collection, cannot be
 * converted without losing information and fails with {@link ConversionException}. Rows converted
 * before the failure have already been handed to the sink.
 */
final class SimpleArrayConverter {

    private SimpleArrayConverter() {
    }

    static void convert(Object array, Consumer<Row> sink) {
        Map<Object, Object> entries = asOrderedMap(array);
        if (entries.isEmpty()) {
            return;
        }

        boolean onlyScalars = entries.values().stream().allMatch(SimpleArrayConverter::isScalar);
        if (onlyScalars) {
            if (isSequential(entries)) {
                for (Object value : entries.values()) {
                    Map<String, Object> columns = new LinkedHashMap<>();
                    columns.put("0", value);
                    sink.accept(new Row(columns));
                }
            } else {
                sink.accept(new Row(stringKeys(entries)));
            }
            return;
        }

        for (Map.Entry<Object, Object> entry : entries.entrySet()) {
            Object key = entry.getKey();
            Object value = entry.getValue();
            if (isCollection(value)) {
                if (!isIntegralKey(key)) {
                    throw new ConversionException("Data structure is not convertible: key '" + key
                            + "' holds a nested collection");
                }
                Map<Object, Object> columns = asOrderedMap(value);
                for (Object column : columns.values()) {
                    if (isCollection(column)) {
                        throw new ConversionException("Data structure is not convertible: row '" + key
                                + "' contains a nested collection");
                    }
                }
                sink.accept(new Row(stringKeys(columns)));
            } else {
                Map<String, Object> columns = new LinkedHashMap<>();
                columns.put(String.valueOf(key), value);
                sink.accept(new Row(columns));
            }
        }
    }

    private static Map<Object, Object> asOrderedMap(Object array) {
        Map<Object, Object> entries = new LinkedHashMap<>();
        if (array instanceof Map<?, ?> map) {
            entries.putAll(map);
        } else if (array instanceof List<?> list) {
            for (int i = 0; i < list.size(); i++) {
                entries.put(i, list.get(i));
            }
        } else if (array instanceof Collection<?> collection) {
            int i = 0;
            for (Object value : collection) {
                entries.put(i++, value);
            }
        } else if (array != null) {
            throw new ConversionException("Data structure is not convertible: " + array.getClass().getName());
        }
        return entries;
    }

    private static boolean isSequential(Map<Object, Object> entries) {
        int expected = 0;
        for (Object key : entries.keySet()) {
            if (!isIntegralKey(key) || Long.parseLong(String.valueOf(key)) != expected) {
                return false;
            }
            expected++;
        }
        return true;
    }

    private static boolean isIntegralKey(Object key) {
        if (key instanceof Integer || key instanceof Long || key instanceof Short || key instanceof Byte) {
            return true;
        }
        if (key instanceof String string) {
            try {
                Long.parseLong(string);
                return true;
            } catch (NumberFormatException e) {
                return false;
            }
        }
        return false;
    }

    private static boolean isCollection(Object value) {
        return value instanceof Map<?, ?> || value instanceof Collection<?> || (value != null && value.getClass().isArray());
    }

    private static boolean isScalar(Object value) {
        return value == null
                || value instanceof Number
                || value instanceof String
                || value instanceof Boolean
                || value instanceof Character;
    }

    private static Map<String, Object> stringKeys(Map<Object, Object> entries) {
        Map<String, Object> columns = new LinkedHashMap<>();
        for (Map.Entry<Object, Object> entry : entries.entrySet()) {
            columns.put(String.valueOf(entry.getKey()), entry.getValue());
        }
        return columns;
    }
}
