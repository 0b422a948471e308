package io.tabletree.filter;

import io.tabletree.storage.DataTable;

/**
 * Builds a configured {@link Filter} from positional parameters.
 */
@FunctionalInterface
public interface FilterFactory {

    Filter create(DataTable table, FilterParameters parameters);
}
