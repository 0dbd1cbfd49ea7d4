package org.codelibs.rcmd.preprocess;

import java.util.List;
import java.util.Map;
import java.util.Set;

import org.codelibs.rcmd.exception.AllItemsPrunedException;
import org.codelibs.rcmd.exception.EmptyInteractionDataException;
import org.codelibs.rcmd.model.InteractionMatrix;
import org.codelibs.rcmd.model.Transaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

/**
 * Prunes low-signal rows before modelling. Inputs are never modified.
 */
public final class SparsityReducer {

    private static final Logger log = LoggerFactory
            .getLogger(SparsityReducer.class);

    /** Cells at or below this count are weak signals. */
    static final int WEAK_SIGNAL_MAX_COUNT = 1;

    /** Items with at most this many weak-signal cells are dropped. */
    static final int MAX_WEAK_SIGNAL_CELLS_TO_DROP = 2;

    private SparsityReducer() {
    }

    /**
     * <p>
     * Drops every item row having at most two present cells with a count of one
     * or less, then every user column left without any present cell, and fills
     * the remaining absent cells with 0.
     * </p>
     *
     * <p>
     * The item rule is applied literally. It can also drop items that almost
     * every user interacted with more than once.
     * </p>
     *
     * @throws AllItemsPrunedException if no item survives
     */
    public static InteractionMatrix reduce(final InteractionMatrix matrix) {
        Preconditions.checkArgument(matrix != null, "matrix is null");

        final ImmutableSet.Builder<Long> droppedItems = ImmutableSet.builder();
        for (final long itemID : matrix.getItemIDs()) {
            int weakCells = 0;
            for (final Integer value : matrix.getItemRow(itemID).values()) {
                if (value <= WEAK_SIGNAL_MAX_COUNT) {
                    weakCells++;
                }
            }
            if (weakCells <= MAX_WEAK_SIGNAL_CELLS_TO_DROP) {
                droppedItems.add(itemID);
            }
        }
        final Set<Long> itemIDs = droppedItems.build();
        log.info("Dropping {} items", itemIDs.size());
        final InteractionMatrix withoutItems = matrix.withoutItems(itemIDs);
        if (withoutItems.isEmpty()) {
            throw new AllItemsPrunedException("All " + matrix.getNumItems()
                    + " items were pruned.");
        }

        final ImmutableSet.Builder<Long> droppedUsers = ImmutableSet.builder();
        for (final long userID : withoutItems.getUserIDs()) {
            final Map<Long, Integer> column = withoutItems
                    .getUserColumn(userID);
            if (column.isEmpty()) {
                droppedUsers.add(userID);
            }
        }
        final Set<Long> userIDs = droppedUsers.build();
        log.info("Dropping {} users", userIDs.size());

        final InteractionMatrix processed = withoutItems.withoutUsers(userIDs)
                .fillAbsent();
        log.info("Pre-processing on the raw user-item matrix complete: {}",
                processed);
        return processed;
    }

    /**
     * Keeps the transactions with at least {@code minBasketSize} order lines,
     * repeated items counted each time.
     *
     * @throws EmptyInteractionDataException if no transaction is kept
     */
    public static List<Transaction> reduce(
            final List<Transaction> transactions, final int minBasketSize) {
        Preconditions.checkArgument(transactions != null,
                "transactions is null");
        Preconditions.checkArgument(minBasketSize >= 1,
                "minBasketSize must be at least 1");

        final ImmutableList.Builder<Transaction> builder = ImmutableList
                .builder();
        int dropped = 0;
        for (final Transaction transaction : transactions) {
            if (transaction.getLineCount() < minBasketSize) {
                dropped++;
            } else {
                builder.add(transaction);
            }
        }
        final List<Transaction> kept = builder.build();
        log.info("Dropping {} orders with less than {} items", dropped,
                minBasketSize);
        if (kept.isEmpty()) {
            throw new EmptyInteractionDataException("No order has at least "
                    + minBasketSize + " items.");
        }
        return kept;
    }
}
