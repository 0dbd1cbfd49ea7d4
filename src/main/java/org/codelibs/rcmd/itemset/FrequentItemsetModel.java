package org.codelibs.rcmd.itemset;

import java.util.List;

import org.codelibs.rcmd.exception.InsufficientSupportItemsetsException;
import org.codelibs.rcmd.model.FrequentItemset;
import org.codelibs.rcmd.model.Transaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableList;

/**
 * Encodes transactions, mines frequent itemsets and keeps only the itemsets
 * longer than {@code minLengthFilter}. Shorter itemsets are discarded.
 */
public class FrequentItemsetModel {

    private static final Logger log = LoggerFactory
            .getLogger(FrequentItemsetModel.class);

    private final FPGrowth miner;

    private final int minLengthFilter;

    public FrequentItemsetModel(final double minSupport, final int maxLength,
            final int minLengthFilter) {
        Preconditions.checkArgument(minLengthFilter >= 0,
                "minLengthFilter must not be negative");
        miner = new FPGrowth(minSupport, maxLength);
        this.minLengthFilter = minLengthFilter;
    }

    /**
     * @return surviving itemsets, ordered by length then items
     * @throws InsufficientSupportItemsetsException if no itemset is longer than the filter
     */
    public List<FrequentItemset> compute(final List<Transaction> transactions) {
        Preconditions.checkArgument(transactions != null,
                "transactions is null");
        final Stopwatch stopwatch = Stopwatch.createStarted();

        final PresenceTable table = TransactionEncoder.encode(transactions);
        log.info("Transactions encoded: {}", table);

        final List<FrequentItemset> itemsets = miner.mine(table);
        final ImmutableList.Builder<FrequentItemset> builder = ImmutableList
                .builder();
        for (final FrequentItemset itemset : itemsets) {
            if (itemset.length() > minLengthFilter) {
                builder.add(itemset);
            }
        }
        final List<FrequentItemset> filtered = builder.build();
        log.info("Kept {} of {} itemsets longer than {} items in {}",
                filtered.size(), itemsets.size(), minLengthFilter, stopwatch);
        if (filtered.isEmpty()) {
            throw new InsufficientSupportItemsetsException(
                    "No frequent itemset has more than " + minLengthFilter
                            + " items.");
        }
        return filtered;
    }
}
