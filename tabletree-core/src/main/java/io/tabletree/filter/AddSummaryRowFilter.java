package io.tabletree.filter;

import io.tabletree.kernel.AggregationPolicy;
import io.tabletree.storage.DataTable;
import io.tabletree.storage.Row;

import java.util.List;

/**
 * Folds every row from position {@code startRowToSummarize} on, summary row included, into a new
 * summary row.
 */
public class AddSummaryRowFilter extends AbstractFilter {

    public static final String NAME = "AddSummaryRow";

    private final int startRowToSummarize;
    private final Object summaryLabel;
    private final String sortColumn;
    private final boolean deleteRows;

    public AddSummaryRowFilter(int startRowToSummarize) {
        this(startRowToSummarize, DataTable.LABEL_SUMMARY_ROW, null, true);
    }

    /**
     * @param startRowToSummarize position of the first row to fold
     * @param summaryLabel        label of the new summary row
     * @param sortColumn          if not null, sort descending by this column first
     * @param deleteRows          delete the folded rows
     */
    public AddSummaryRowFilter(int startRowToSummarize, Object summaryLabel, String sortColumn, boolean deleteRows) {
        if (startRowToSummarize < 0) {
            throw new IllegalArgumentException("startRowToSummarize must not be negative");
        }
        this.startRowToSummarize = startRowToSummarize;
        this.summaryLabel = summaryLabel;
        this.sortColumn = sortColumn;
        this.deleteRows = deleteRows;
    }

    @Override
    protected void filterTable(DataTable table, int depth) {
        if (sortColumn != null) {
            new SortFilter(sortColumn).filter(table);
        }
        if (table.getRowsCount() > startRowToSummarize + 1) {
            List<Row> rows = table.getRows();
            AggregationPolicy policy = table.aggregationPolicy();
            Row newRow = new Row();
            newRow.setColumn(Row.LABEL, DataTable.LABEL_SUMMARY_ROW);
            for (int i = startRowToSummarize; i < rows.size(); i++) {
                newRow.sumRow(rows.get(i), false, policy);
            }
            newRow.setColumn(Row.LABEL, summaryLabel);
            if (deleteRows) {
                table.deleteRowsOffset(startRowToSummarize, null);
            }
            table.addSummaryRow(newRow);
        }

        for (Row row : table.getRowsWithoutSummaryRow()) {
            filterSubTable(row, depth);
        }
    }
}
