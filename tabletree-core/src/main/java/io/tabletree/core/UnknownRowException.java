package io.tabletree.core;

public class UnknownRowException extends TableTreeException {

    private final int rowId;

    public UnknownRowException(int rowId) {
        super("Trying to delete unknown row with id " + rowId);
        this.rowId = rowId;
    }

    public int getRowId() {
        return rowId;
    }
}
