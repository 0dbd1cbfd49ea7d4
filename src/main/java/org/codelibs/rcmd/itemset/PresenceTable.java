package org.codelibs.rcmd.itemset;

import java.util.Arrays;

/**
 * One-hot encoded transactions: one row per transaction, one boolean column per
 * distinct item ID, columns in ascending item ID order.
 */
public final class PresenceTable {

    private final long[] itemIDs;

    private final boolean[][] rows;

    PresenceTable(final long[] itemIDs, final boolean[][] rows) {
        this.itemIDs = itemIDs;
        this.rows = rows;
    }

    public long[] getItemIDs() {
        return itemIDs.clone();
    }

    public long getItemID(final int column) {
        return itemIDs[column];
    }

    public int getNumItems() {
        return itemIDs.length;
    }

    public int getNumTransactions() {
        return rows.length;
    }

    /**
     * @return columns set in the row, ascending
     */
    public int[] getPresentColumns(final int row) {
        final boolean[] values = rows[row];
        final int[] columns = new int[values.length];
        int count = 0;
        for (int i = 0; i < values.length; i++) {
            if (values[i]) {
                columns[count++] = i;
            }
        }
        return Arrays.copyOf(columns, count);
    }

    /**
     * @return number of transactions containing each item, by column
     */
    public int[] getColumnCounts() {
        final int[] counts = new int[itemIDs.length];
        for (final boolean[] row : rows) {
            for (int i = 0; i < row.length; i++) {
                if (row[i]) {
                    counts[i]++;
                }
            }
        }
        return counts;
    }

    @Override
    public String toString() {
        return "PresenceTable[transactions:" + rows.length + ",items:"
                + itemIDs.length + ']';
    }
}
