package io.tabletree.filter;

import io.tabletree.storage.DataTable;

/**
 * Ad-hoc filter invoked with the table followed by its parameters.
 */
@FunctionalInterface
public interface FilterFunction {

    void apply(DataTable table, Object... parameters);
}
