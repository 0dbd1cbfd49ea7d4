package org.codelibs.rcmd.recommender;

import org.codelibs.rcmd.similarity.ItemSimilarity;

import com.google.common.collect.HashBasedTable;
import com.google.common.collect.Table;

/**
 * Similarities given by hand; unset pairs are 0.
 */
class FixedItemSimilarity implements ItemSimilarity {

    private final Table<Long, Long, Double> values = HashBasedTable.create();

    private final long[] itemIDs;

    FixedItemSimilarity(final long... itemIDs) {
        this.itemIDs = itemIDs;
    }

    FixedItemSimilarity set(final long itemID1, final long itemID2,
            final double value) {
        values.put(itemID1, itemID2, value);
        values.put(itemID2, itemID1, value);
        return this;
    }

    @Override
    public double itemSimilarity(final long itemID1, final long itemID2) {
        if (itemID1 == itemID2) {
            return Double.NaN;
        }
        final Double value = values.get(itemID1, itemID2);
        return value == null ? 0.0 : value;
    }

    @Override
    public double[] itemSimilarities(final long itemID1, final long[] itemID2s) {
        final double[] result = new double[itemID2s.length];
        for (int i = 0; i < itemID2s.length; i++) {
            result[i] = itemSimilarity(itemID1, itemID2s[i]);
        }
        return result;
    }

    long[] getItemIDs() {
        return itemIDs.clone();
    }
}
