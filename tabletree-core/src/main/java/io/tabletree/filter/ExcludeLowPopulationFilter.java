package io.tabletree.filter;

import io.tabletree.storage.DataTable;
import io.tabletree.storage.Row;

import java.util.Map;

/**
 * Deletes rows whose numeric column is below a threshold. Rows missing the column count as 0. The
 * summary row is kept.
 */
public class ExcludeLowPopulationFilter extends AbstractFilter {

    public static final String NAME = "ExcludeLowPopulation";

    private final String column;
    private final double minimumValue;
    private final double minimumPercentage;

    /**
     * @param minimumPercentage if above 0, the threshold is raised to this share (0..1) of the column
     *                          total when that is larger than {@code minimumValue}
     */
    public ExcludeLowPopulationFilter(String column, double minimumValue, double minimumPercentage) {
        if (column == null || column.isBlank()) {
            throw new IllegalArgumentException("column required");
        }
        if (minimumPercentage < 0 || minimumPercentage > 1) {
            throw new IllegalArgumentException("minimumPercentage must be between 0 and 1");
        }
        this.column = column;
        this.minimumValue = minimumValue;
        this.minimumPercentage = minimumPercentage;
    }

    @Override
    protected void filterTable(DataTable table, int depth) {
        double threshold = minimumValue;
        if (minimumPercentage > 0) {
            double total = 0;
            for (Row row : table.getRowsWithoutSummaryRow()) {
                total += valueOf(row);
            }
            threshold = Math.max(threshold, total * minimumPercentage);
        }

        for (Map.Entry<Integer, Row> entry : table.getRowsById().entrySet()) {
            if (entry.getKey() == DataTable.ID_SUMMARY_ROW) {
                continue;
            }
            Row row = entry.getValue();
            if (valueOf(row) < threshold) {
                table.deleteRow(entry.getKey());
            } else {
                filterSubTable(row, depth);
            }
        }
    }

    private double valueOf(Row row) {
        Object value = row.getColumn(column);
        return value instanceof Number number ? number.doubleValue() : 0;
    }
}
