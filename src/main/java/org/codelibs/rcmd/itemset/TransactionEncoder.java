package org.codelibs.rcmd.itemset;

import java.util.Arrays;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

import org.codelibs.rcmd.model.Transaction;

import com.google.common.base.Preconditions;
import com.google.common.primitives.Longs;

public final class TransactionEncoder {

    private TransactionEncoder() {
    }

    public static PresenceTable encode(final List<Transaction> transactions) {
        Preconditions.checkArgument(transactions != null,
                "transactions is null");

        final SortedSet<Long> distinctItems = new TreeSet<>();
        for (final Transaction transaction : transactions) {
            distinctItems.addAll(transaction.getItems());
        }
        final long[] itemIDs = Longs.toArray(distinctItems);

        final boolean[][] rows = new boolean[transactions.size()][itemIDs.length];
        for (int i = 0; i < rows.length; i++) {
            for (final Long itemID : transactions.get(i).getItems()) {
                rows[i][Arrays.binarySearch(itemIDs, itemID)] = true;
            }
        }
        return new PresenceTable(itemIDs, rows);
    }
}
