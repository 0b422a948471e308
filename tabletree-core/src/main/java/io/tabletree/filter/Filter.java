package io.tabletree.filter;

import io.tabletree.storage.DataTable;

/**
 * Transforms a table in place: deletes rows, adds or removes columns, reorders.
 */
public interface Filter {

    void filter(DataTable table);

    /**
     * Also apply this filter to the sub-tables of the rows it keeps.
     */
    void enableRecursive(boolean enabled);
}
