package io.tabletree.filter;

import io.tabletree.storage.DataTable;
import io.tabletree.storage.Row;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Adds a column computed from other columns of the same row, e.g. a ratio of two metrics.
 */
public class ColumnCallbackAddColumnFilter extends AbstractFilter {

    public static final String NAME = "ColumnCallbackAddColumn";

    private final List<String> sourceColumns;
    private final String newColumn;
    private final Function<List<Object>, Object> function;

    /**
     * @param function receives the source column values in order, null for a missing column
     */
    public ColumnCallbackAddColumnFilter(List<String> sourceColumns, String newColumn,
                                         Function<List<Object>, Object> function) {
        if (sourceColumns == null || sourceColumns.isEmpty()) {
            throw new IllegalArgumentException("sourceColumns required");
        }
        if (newColumn == null || newColumn.isBlank()) {
            throw new IllegalArgumentException("newColumn required");
        }
        if (function == null) {
            throw new IllegalArgumentException("function required");
        }
        this.sourceColumns = List.copyOf(sourceColumns);
        this.newColumn = newColumn;
        this.function = function;
    }

    @Override
    protected void filterTable(DataTable table, int depth) {
        for (Row row : table.getRows()) {
            List<Object> values = new ArrayList<>(sourceColumns.size());
            for (String name : sourceColumns) {
                values.add(row.getColumn(name));
            }
            row.setColumn(newColumn, function.apply(values));
            filterSubTable(row, depth);
        }
    }
}
