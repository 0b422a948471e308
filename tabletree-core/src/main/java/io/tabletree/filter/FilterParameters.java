package io.tabletree.filter;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;

/**
 * Positional parameters of a named filter, with typed accessors.
 */
public final class FilterParameters {

    private final Object[] values;

    public FilterParameters(Object... values) {
        this.values = values == null ? new Object[0] : values.clone();
    }

    public int size() {
        return values.length;
    }

    public boolean isPresent(int position) {
        return position < values.length && values[position] != null;
    }

    public Object get(int position) {
        if (!isPresent(position)) {
            throw new IllegalArgumentException("Missing filter parameter at position " + position);
        }
        return values[position];
    }

    public Object get(int position, Object defaultValue) {
        return isPresent(position) ? values[position] : defaultValue;
    }

    public <T> T get(int position, Class<T> type) {
        Object value = get(position);
        if (!type.isInstance(value)) {
            throw new IllegalArgumentException("Filter parameter " + position + " must be a "
                    + type.getSimpleName() + ", got " + value.getClass().getSimpleName());
        }
        return type.cast(value);
    }

    public String getString(int position) {
        return String.valueOf(get(position));
    }

    public String getString(int position, String defaultValue) {
        return isPresent(position) ? String.valueOf(values[position]) : defaultValue;
    }

    public int getInt(int position) {
        return toInt(position, get(position));
    }

    public int getInt(int position, int defaultValue) {
        return isPresent(position) ? toInt(position, values[position]) : defaultValue;
    }

    public double getDouble(int position, double defaultValue) {
        if (!isPresent(position)) {
            return defaultValue;
        }
        Object value = values[position];
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        try {
            return Double.parseDouble(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Filter parameter " + position + " is not a number: " + value, e);
        }
    }

    public boolean getBoolean(int position, boolean defaultValue) {
        if (!isPresent(position)) {
            return defaultValue;
        }
        Object value = values[position];
        if (value instanceof Boolean bool) {
            return bool;
        }
        return Boolean.parseBoolean(value.toString().trim());
    }

    /**
     * A list of names given either as a collection or as a comma-separated string.
     *
     * @return the names, empty if the parameter is absent
     */
    public List<String> getStringList(int position) {
        if (!isPresent(position)) {
            return new ArrayList<>();
        }
        Object value = values[position];
        List<String> names = new ArrayList<>();
        if (value instanceof Collection<?> collection) {
            for (Object item : collection) {
                names.add(String.valueOf(item));
            }
        } else {
            for (String item : value.toString().split(",")) {
                if (!item.isBlank()) {
                    names.add(item.trim());
                }
            }
        }
        return names;
    }

    private static int toInt(int position, Object value) {
        if (value instanceof Number number) {
            return number.intValue();
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Filter parameter " + position + " is not an integer: " + value, e);
        }
    }

    @Override
    public String toString() {
        return Arrays.toString(values);
    }
}
