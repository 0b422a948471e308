package io.tabletree.filter;

import io.tabletree.storage.DataTable;
import io.tabletree.storage.Row;

/**
 * Keeps {@code limit} rows starting at {@code offset}. The row count before the cut is saved on the
 * table for pagination.
 */
public class LimitFilter extends AbstractFilter {

    public static final String NAME = "Limit";

    private final int offset;
    private final int limit;
    private final boolean keepSummaryRow;

    /**
     * @param offset         first row to keep
     * @param limit          number of rows to keep, -1 for all
     * @param keepSummaryRow put the summary row back after the cut
     */
    public LimitFilter(int offset, int limit, boolean keepSummaryRow) {
        if (offset < 0) {
            throw new IllegalArgumentException("offset must not be negative");
        }
        this.offset = offset;
        this.limit = limit;
        this.keepSummaryRow = keepSummaryRow;
    }

    @Override
    protected void filterTable(DataTable table, int depth) {
        table.setRowsCountBeforeLimitFilter();
        Row summaryRow = keepSummaryRow ? table.getSummaryRow() : null;

        if (offset > 0) {
            table.deleteRowsOffset(0, offset);
        }
        if (limit >= 0) {
            table.deleteRowsOffset(limit, null);
        }
        if (summaryRow != null) {
            table.addSummaryRow(summaryRow);
        }

        for (Row row : table.getRows()) {
            filterSubTable(row, depth);
        }
    }
}
