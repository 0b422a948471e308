package io.tabletree.filter;

import io.tabletree.storage.DataTable;
import io.tabletree.storage.Row;

import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Keeps rows whose column (or, when the row has no such column, metadata) matches a regular
 * expression, ignoring case.
 */
public class PatternFilter extends AbstractFilter {

    public static final String NAME = "Pattern";

    private final String column;
    private final Pattern pattern;
    private final boolean invert;

    /**
     * @param invert keep the rows that do not match instead
     */
    public PatternFilter(String column, String regex, boolean invert) {
        if (column == null || column.isBlank()) {
            throw new IllegalArgumentException("column required");
        }
        if (regex == null) {
            throw new IllegalArgumentException("regex required");
        }
        try {
            this.pattern = Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
        } catch (PatternSyntaxException e) {
            throw new IllegalArgumentException("Invalid pattern: " + regex, e);
        }
        this.column = column;
        this.invert = invert;
    }

    @Override
    protected void filterTable(DataTable table, int depth) {
        for (Map.Entry<Integer, Row> entry : table.getRowsById().entrySet()) {
            Row row = entry.getValue();
            if (matches(row) == invert) {
                table.deleteRow(entry.getKey());
            } else {
                filterSubTable(row, depth);
            }
        }
    }

    private boolean matches(Row row) {
        Object value = row.hasColumn(column) ? row.getColumn(column) : row.getMetadata(column);
        return value != null && pattern.matcher(value.toString()).find();
    }
}
