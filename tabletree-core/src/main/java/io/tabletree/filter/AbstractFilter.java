package io.tabletree.filter;

import io.tabletree.core.RecursionLimitException;
import io.tabletree.storage.DataTable;
import io.tabletree.storage.Row;

/**
 * Base class of the built-in filters. Keeps the recursion flag and walks sub-tables with a depth
 * counter so that a cyclic sub-table reference fails instead of looping.
 */
public abstract class AbstractFilter implements Filter {

    private boolean recursive;

    @Override
    public final void filter(DataTable table) {
        if (table == null) {
            throw new IllegalArgumentException("table required");
        }
        filterTable(table, 0);
    }

    @Override
    public void enableRecursive(boolean enabled) {
        this.recursive = enabled;
    }

    public boolean isRecursive() {
        return recursive;
    }

    protected abstract void filterTable(DataTable table, int depth);

    /**
     * Apply this filter to the sub-table of {@code row}, if recursion is enabled and it has one.
     */
    protected void filterSubTable(Row row, int depth) {
        if (!recursive) {
            return;
        }
        DataTable subtable = row.getSubtable();
        if (subtable == null) {
            return;
        }
        int maximumDepth = subtable.getArena().getConfiguration().maximumDepth();
        if (depth + 1 > maximumDepth) {
            throw new RecursionLimitException(maximumDepth);
        }
        filterTable(subtable, depth + 1);
    }
}
