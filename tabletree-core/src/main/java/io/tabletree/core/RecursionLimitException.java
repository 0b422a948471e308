package io.tabletree.core;

/**
 * Thrown when a depth-tracked traversal of sub-tables goes deeper than the configured maximum.
 * Usually means a row references a sub-table that is one of its own ancestors.
 */
public class RecursionLimitException extends TableTreeException {

    private final int maximumDepth;

    public RecursionLimitException(int maximumDepth) {
        super("Maximum recursion level of " + maximumDepth + " reached. "
                + "Maybe a row references a sub-table that already belongs to one of its parent tables?");
        this.maximumDepth = maximumDepth;
    }

    public int getMaximumDepth() {
        return maximumDepth;
    }
}
