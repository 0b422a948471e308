package io.tabletree.filter;

import io.tabletree.core.TableTreeException;
import io.tabletree.storage.DataTable;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Filters by name. Names are case-insensitive.
 */
public final class FilterRegistry {

    private final Map<String, FilterFactory> factories = new ConcurrentHashMap<>();

    private FilterRegistry() {
    }

    public static FilterRegistry empty() {
        return new FilterRegistry();
    }

    /**
     * Registry holding the built-in filters.
     */
    @SuppressWarnings("unchecked")
    public static FilterRegistry defaults() {
        return new FilterRegistry()
                .register(SortFilter.NAME, (table, p) -> new SortFilter(
                        p.getString(0),
                        p.getString(1, SortFilter.ORDER_DESC),
                        p.getBoolean(2, true),
                        p.getBoolean(3, false)))
                .register(LimitFilter.NAME, (table, p) -> new LimitFilter(
                        p.getInt(0),
                        p.getInt(1, -1),
                        p.getBoolean(2, false)))
                .register(AddSummaryRowFilter.NAME, (table, p) -> new AddSummaryRowFilter(
                        p.getInt(0),
                        p.get(1, DataTable.LABEL_SUMMARY_ROW),
                        p.getString(2, null),
                        p.getBoolean(3, true)))
                .register(PatternFilter.NAME, (table, p) -> new PatternFilter(
                        p.getString(0),
                        p.getString(1),
                        p.getBoolean(2, false)))
                .register(ExcludeLowPopulationFilter.NAME, (table, p) -> new ExcludeLowPopulationFilter(
                        p.getString(0),
                        p.getDouble(1, 0),
                        p.getDouble(2, 0)))
                .register(ColumnDeleteFilter.NAME, (table, p) -> new ColumnDeleteFilter(
                        p.getStringList(0),
                        p.isPresent(1) ? p.getStringList(1) : null))
                .register(ColumnCallbackAddColumnFilter.NAME, (table, p) -> new ColumnCallbackAddColumnFilter(
                        p.getStringList(0),
                        p.getString(1),
                        (Function<List<Object>, Object>) p.get(2, Function.class)));
    }

    public FilterRegistry register(String name, FilterFactory factory) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name required");
        }
        if (factory == null) {
            throw new IllegalArgumentException("factory required");
        }
        factories.put(normalize(name), factory);
        return this;
    }

    public boolean contains(String name) {
        return name != null && factories.containsKey(normalize(name));
    }

    /**
     * @throws TableTreeException if no filter is registered under {@code name}
     */
    public Filter create(String name, DataTable table, FilterParameters parameters) {
        FilterFactory factory = name == null ? null : factories.get(normalize(name));
        if (factory == null) {
            throw new TableTreeException("Unknown filter '" + name + "'.");
        }
        return factory.create(table, parameters);
    }

    public Set<String> names() {
        return Set.copyOf(factories.keySet());
    }

    private static String normalize(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }
}
