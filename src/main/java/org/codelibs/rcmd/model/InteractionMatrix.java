package org.codelibs.rcmd.model;

import java.util.Arrays;
import java.util.Map;
import java.util.Set;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableTable;
import com.google.common.collect.Ordering;
import com.google.common.collect.Table;

/**
 * <p>
 * Item by user interaction counts. Rows are item IDs and columns are user IDs,
 * both kept in ascending order. A cell with no observed interaction is absent,
 * which is not the same as a zero count until {@link #fillAbsent()} has been
 * applied.
 * </p>
 *
 * <p>
 * Instances are immutable. Pruning and filling return new matrices.
 * </p>
 */
public final class InteractionMatrix {

    private final long[] itemIDs;

    private final long[] userIDs;

    private final ImmutableTable<Long, Long, Integer> cells;

    private final boolean filled;

    private InteractionMatrix(final long[] itemIDs, final long[] userIDs,
            final ImmutableTable<Long, Long, Integer> cells, final boolean filled) {
        this.itemIDs = itemIDs;
        this.userIDs = userIDs;
        this.cells = cells;
        this.filled = filled;
    }

    /**
     * @param counts item ID to user ID to interaction count; counts must not be negative
     */
    public static InteractionMatrix of(final Table<Long, Long, Integer> counts) {
        Preconditions.checkArgument(counts != null, "counts is null");
        final long[] itemIDs = toSortedArray(counts.rowKeySet());
        final long[] userIDs = toSortedArray(counts.columnKeySet());
        final ImmutableTable.Builder<Long, Long, Integer> builder = newBuilder();
        for (final Table.Cell<Long, Long, Integer> cell : counts.cellSet()) {
            Preconditions.checkArgument(
                    cell.getValue() != null && cell.getValue() >= 0,
                    "negative count for item %s and user %s",
                    cell.getRowKey(), cell.getColumnKey());
            builder.put(cell);
        }
        return new InteractionMatrix(itemIDs, userIDs, builder.build(), false);
    }

    public long[] getItemIDs() {
        return itemIDs.clone();
    }

    public long[] getUserIDs() {
        return userIDs.clone();
    }

    public int getNumItems() {
        return itemIDs.length;
    }

    public int getNumUsers() {
        return userIDs.length;
    }

    public boolean isFilled() {
        return filled;
    }

    public boolean isEmpty() {
        return itemIDs.length == 0;
    }

    public boolean hasItem(final long itemID) {
        return Arrays.binarySearch(itemIDs, itemID) >= 0;
    }

    public boolean hasUser(final long userID) {
        return Arrays.binarySearch(userIDs, userID) >= 0;
    }

    /**
     * @return the count, or null when the cell is absent
     */
    public Integer get(final long itemID, final long userID) {
        return cells.get(itemID, userID);
    }

    /**
     * @return present cells of the item row keyed by user ID, ascending
     */
    public Map<Long, Integer> getItemRow(final long itemID) {
        return cells.row(itemID);
    }

    /**
     * @return present cells of the user column keyed by item ID, ascending
     */
    public Map<Long, Integer> getUserColumn(final long userID) {
        return cells.column(userID);
    }

    /**
     * @return counts of the item over all users in ascending user order, absent cells as 0
     */
    public double[] getItemVector(final long itemID) {
        final double[] vector = new double[userIDs.length];
        final Map<Long, Integer> row = cells.row(itemID);
        for (int i = 0; i < userIDs.length; i++) {
            final Integer value = row.get(userIDs[i]);
            if (value != null) {
                vector[i] = value;
            }
        }
        return vector;
    }

    public InteractionMatrix withoutItems(final Set<Long> droppedItemIDs) {
        if (droppedItemIDs.isEmpty()) {
            return this;
        }
        final ImmutableTable.Builder<Long, Long, Integer> builder = newBuilder();
        for (final Table.Cell<Long, Long, Integer> cell : cells.cellSet()) {
            if (!droppedItemIDs.contains(cell.getRowKey())) {
                builder.put(cell);
            }
        }
        return new InteractionMatrix(remove(itemIDs, droppedItemIDs), userIDs,
                builder.build(), filled);
    }

    public InteractionMatrix withoutUsers(final Set<Long> droppedUserIDs) {
        if (droppedUserIDs.isEmpty()) {
            return this;
        }
        final ImmutableTable.Builder<Long, Long, Integer> builder = newBuilder();
        for (final Table.Cell<Long, Long, Integer> cell : cells.cellSet()) {
            if (!droppedUserIDs.contains(cell.getColumnKey())) {
                builder.put(cell);
            }
        }
        return new InteractionMatrix(itemIDs, remove(userIDs, droppedUserIDs),
                builder.build(), filled);
    }

    public InteractionMatrix fillAbsent() {
        final ImmutableTable.Builder<Long, Long, Integer> builder = newBuilder();
        for (final long itemID : itemIDs) {
            final Map<Long, Integer> row = cells.row(itemID);
            for (final long userID : userIDs) {
                final Integer value = row.get(userID);
                builder.put(itemID, userID, value == null ? 0 : value);
            }
        }
        return new InteractionMatrix(itemIDs, userIDs, builder.build(), true);
    }

    private static ImmutableTable.Builder<Long, Long, Integer> newBuilder() {
        return ImmutableTable.<Long, Long, Integer> builder()
                .orderRowsBy(Ordering.natural())
                .orderColumnsBy(Ordering.natural());
    }

    private static long[] toSortedArray(final Set<Long> ids) {
        final long[] array = new long[ids.size()];
        int i = 0;
        for (final Long id : ids) {
            array[i++] = id;
        }
        Arrays.sort(array);
        return array;
    }

    private static long[] remove(final long[] ids, final Set<Long> removed) {
        return Arrays.stream(ids).filter(id -> !removed.contains(id))
                .toArray();
    }

    @Override
    public String toString() {
        return "InteractionMatrix[items:" + itemIDs.length + ",users:"
                + userIDs.length + ",filled:" + filled + ']';
    }
}
