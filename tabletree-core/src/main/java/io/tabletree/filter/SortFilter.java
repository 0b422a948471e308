package io.tabletree.filter;

import io.tabletree.kernel.Values;
import io.tabletree.storage.DataTable;
import io.tabletree.storage.Row;

import java.util.Comparator;
import java.util.Locale;

/**
 * Sorts rows by one column.
 * <p>
 * Rows with a numeric value come first, then rows with any other value, then rows missing the
 * column; the order only applies within each group. Equal rows keep their relative order.
 */
public class SortFilter extends AbstractFilter {

    public static final String NAME = "Sort";
    public static final String ORDER_ASC = "asc";
    public static final String ORDER_DESC = "desc";

    private final String column;
    private final boolean descending;
    private final boolean naturalSort;
    private final boolean recursiveSort;

    public SortFilter(String column) {
        this(column, ORDER_DESC, true, false);
    }

    /**
     * @param column        column to sort by
     * @param order         "asc" or "desc"
     * @param naturalSort   compare strings so that "item 9" sorts before "item 10"
     * @param recursiveSort also sort every sub-table
     */
    public SortFilter(String column, String order, boolean naturalSort, boolean recursiveSort) {
        if (column == null || column.isBlank()) {
            throw new IllegalArgumentException("column required");
        }
        if (!ORDER_ASC.equalsIgnoreCase(order) && !ORDER_DESC.equalsIgnoreCase(order)) {
            throw new IllegalArgumentException("order must be 'asc' or 'desc', got " + order);
        }
        this.column = column;
        this.descending = ORDER_DESC.equalsIgnoreCase(order);
        this.naturalSort = naturalSort;
        this.recursiveSort = recursiveSort;
    }

    @Override
    protected void filterTable(DataTable table, int depth) {
        if (recursiveSort) {
            table.enableRecursiveSort();
        }
        table.sort(comparator(), column);
    }

    Comparator<Row> comparator() {
        return (left, right) -> {
            Object a = left.getColumn(column);
            Object b = right.getColumn(column);
            int groupA = group(a);
            int groupB = group(b);
            if (groupA != groupB) {
                return Integer.compare(groupA, groupB);
            }
            int result;
            if (groupA == 0) {
                result = Values.compare((Number) a, (Number) b);
            } else if (groupA == 1) {
                result = naturalSort
                        ? compareNatural(a.toString(), b.toString())
                        : a.toString().compareTo(b.toString());
            } else {
                return 0;
            }
            return descending ? -result : result;
        };
    }

    private static int group(Object value) {
        if (value == null) {
            return 2;
        }
        return value instanceof Number ? 0 : 1;
    }

    /**
     * Case-insensitive comparison treating runs of digits as numbers.
     */
    static int compareNatural(String left, String right) {
        String a = left.toLowerCase(Locale.ROOT);
        String b = right.toLowerCase(Locale.ROOT);
        int i = 0;
        int j = 0;
        while (i < a.length() && j < b.length()) {
            char ca = a.charAt(i);
            char cb = b.charAt(j);
            if (Character.isDigit(ca) && Character.isDigit(cb)) {
                int startA = i;
                int startB = j;
                while (i < a.length() && Character.isDigit(a.charAt(i))) {
                    i++;
                }
                while (j < b.length() && Character.isDigit(b.charAt(j))) {
                    j++;
                }
                String digitsA = stripLeadingZeros(a.substring(startA, i));
                String digitsB = stripLeadingZeros(b.substring(startB, j));
                if (digitsA.length() != digitsB.length()) {
                    return Integer.compare(digitsA.length(), digitsB.length());
                }
                int cmp = digitsA.compareTo(digitsB);
                if (cmp != 0) {
                    return cmp;
                }
            } else {
                if (ca != cb) {
                    return Character.compare(ca, cb);
                }
                i++;
                j++;
            }
        }
        return Integer.compare(a.length() - i, b.length() - j);
    }

    private static String stripLeadingZeros(String digits) {
        int k = 0;
        while (k < digits.length() - 1 && digits.charAt(k) == '0') {
            k++;
        }
        return digits.substring(k);
    }
}
