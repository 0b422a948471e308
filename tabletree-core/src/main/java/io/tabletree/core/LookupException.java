package io.tabletree.core;

/**
 * Thrown when a table id cannot be resolved through a {@link TableArena}, either because it was never
 * registered or because the table has been marked deleted.
 */
public class LookupException extends TableTreeException {

    private final int tableId;

    public LookupException(int tableId, String message) {
        super(message);
        this.tableId = tableId;
    }

    public int getTableId() {
        return tableId;
    }
}
