package io.tabletree.storage;

/**
 * Outcome of {@link DataTable#walkPath}.
 *
 * @param row   the row reached; for a full table this is the summary row the new row was folded
 *              into, null when a segment could not be found
 * @param table the table {@code row} belongs to, or the table where the walk stopped
 * @param index number of segments walked; equals the path length on success
 * @param found true if every segment was resolved
 */
public record PathWalkResult(Row row, DataTable table, int index, boolean found) {

    static PathWalkResult notFound(DataTable table, int index) {
        return new PathWalkResult(null, table, index, false);
    }

    /**
     * True when a missing row could not be created because its table was full and the walk
     * stopped on that table's summary row.
     */
    public boolean isPartial() {
        return !found && row != null;
    }
}
