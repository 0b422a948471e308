package io.tabletree.filter;

import io.tabletree.storage.DataTable;
import io.tabletree.storage.Row;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Deletes the given columns, or every column but the given ones, from all rows.
 */
public class ColumnDeleteFilter extends AbstractFilter {

    public static final String NAME = "ColumnDelete";

    private final Set<String> columnsToRemove;
    private final Set<String> columnsToKeep;

    /**
     * @param columnsToRemove columns to delete
     * @param columnsToKeep   if not null, every other column is deleted as well
     */
    public ColumnDeleteFilter(Collection<String> columnsToRemove, Collection<String> columnsToKeep) {
        this.columnsToRemove = columnsToRemove == null ? Set.of() : Set.copyOf(columnsToRemove);
        this.columnsToKeep = columnsToKeep == null ? null : Set.copyOf(columnsToKeep);
    }

    @Override
    protected void filterTable(DataTable table, int depth) {
        for (Row row : table.getRows()) {
            List<String> names = new ArrayList<>(row.getColumns().keySet());
            for (String name : names) {
                if (columnsToRemove.contains(name) || (columnsToKeep != null && !columnsToKeep.contains(name))) {
                    row.deleteColumn(name);
                }
            }
            filterSubTable(row, depth);
        }
    }
}
