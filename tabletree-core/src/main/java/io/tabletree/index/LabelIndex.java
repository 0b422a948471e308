package io.tabletree.index;

import java.util.HashMap;
import java.util.Map;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

/**
 * Label to row-id lookup for a single table.
 * <p>
 * The index is either {@link State#FRESH} or {@link State#STALE}. Independently, continuous
 * maintenance can be switched on: once it is, appends patch a fresh index in place instead of
 * invalidating it. Lookups on a stale index rebuild it as a whole.
 * <p>
 * Duplicate labels resolve to the last row written, both when rebuilding and when patching.
 * Keys are the string form of the label.
 */
public final class LabelIndex {

    public enum State {
        FRESH,
        STALE
    }

    private final Map<String, Integer> rowIdsByLabel = new HashMap<>();
    private State state = State.STALE;
    private boolean continuous;

    public State state() {
        return state;
    }

    public boolean isStale() {
        return state == State.STALE;
    }

    public boolean isContinuous() {
        return continuous;
    }

    /**
     * Switch on continuous maintenance. There is no way back: a table that was queried by label
     * once is expected to be queried again.
     */
    public void enableContinuousMaintenance() {
        continuous = true;
    }

    public void markStale() {
        state = State.STALE;
    }

    /**
     * Rebuild from scratch. {@code source} must feed every (label, rowId) pair in row order.
     */
    public void rebuild(Consumer<BiConsumer<String, Integer>> source) {
        rowIdsByLabel.clear();
        source.accept(rowIdsByLabel::put);
        state = State.FRESH;
    }

    /**
     * Record a row that was just appended. Patches the index when it is fresh and continuous
     * maintenance is on, otherwise marks it stale.
     *
     * @return true if the index was patched
     */
    public boolean onAppend(String labelKey, int rowId) {
        if (state == State.FRESH && continuous) {
            if (labelKey != null) {
                rowIdsByLabel.put(labelKey, rowId);
            }
            return true;
        }
        state = State.STALE;
        return false;
    }

    /**
     * Direct write, used for the summary row. Leaves the state untouched.
     */
    public void put(String labelKey, int rowId) {
        if (labelKey == null) {
            throw new IllegalArgumentException("labelKey required");
        }
        rowIdsByLabel.put(labelKey, rowId);
    }

    /**
     * @return the row id, or null if the label is unknown
     */
    public Integer lookup(String labelKey) {
        if (labelKey == null) {
            return null;
        }
        return rowIdsByLabel.get(labelKey);
    }

    public int size() {
        return rowIdsByLabel.size();
    }

    public void clear() {
        rowIdsByLabel.clear();
        state = State.STALE;
    }
}
