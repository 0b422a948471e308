package io.tabletree.storage;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A row whose columns are the aggregate of its sub-table's rows.
 * <p>
 * Rows created by {@link DataTable#walkPath} are summary rows so that their totals can be rebuilt
 * once the path below them has been filled in.
 */
public class SummaryRow extends Row {

    public SummaryRow() {
    }

    /**
     * Attach {@code subtable} and sum its rows into this row.
     */
    public SummaryRow(DataTable subtable) {
        if (subtable != null) {
            setSubtable(subtable);
            sumTable(subtable);
        }
    }

    /**
     * Reset every column except the label to the sum of the sub-table's rows, using the
     * sub-table's aggregation operations.
     */
    public void recalculate() {
        DataTable subtable = getSubtable();
        if (subtable == null) {
            return;
        }
        Map<String, Object> kept = new LinkedHashMap<>();
        if (hasColumn(LABEL)) {
            kept.put(LABEL, getLabel());
        }
        setColumns(kept);
        sumTable(subtable);
    }

    private void sumTable(DataTable table) {
        for (Row row : table.getRows()) {
            sumRow(row, false, table.aggregationPolicy());
        }
    }
}
