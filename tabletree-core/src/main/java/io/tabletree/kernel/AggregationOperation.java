package io.tabletree.kernel;

/**
 * Combines the value a row already holds for a column with the value of the row being summed into it.
 */
@FunctionalInterface
public interface AggregationOperation {

    /**
     * @param current  value held by the receiving row, {@code null} if the column is absent
     * @param incoming value held by the row being summed in
     * @return the new value of the column
     */
    Object aggregate(Object current, Object incoming);
}
