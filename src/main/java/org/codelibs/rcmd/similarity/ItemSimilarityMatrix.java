package org.codelibs.rcmd.similarity;

import java.util.Arrays;

import com.google.common.base.Preconditions;

/**
 * <p>
 * Precomputed, symmetric item by item similarities. Only the upper triangle is
 * computed and mirrored, so {@code itemSimilarity(a, b) == itemSimilarity(b, a)}
 * holds exactly. The diagonal is {@link Double#NaN}.
 * </p>
 */
public final class ItemSimilarityMatrix implements ItemSimilarity {

    private final long[] itemIDs;

    private final double[][] similarities;

    private ItemSimilarityMatrix(final long[] itemIDs,
            final double[][] similarities) {
        this.itemIDs = itemIDs;
        this.similarities = similarities;
    }

    /**
     * @param itemIDs item IDs in ascending order
     */
    public static ItemSimilarityMatrix compute(final long[] itemIDs,
            final ItemSimilarity similarity) {
        Preconditions.checkArgument(itemIDs != null, "itemIDs is null");
        Preconditions.checkArgument(similarity != null, "similarity is null");
        final long[] ids = itemIDs.clone();
        Arrays.sort(ids);
        final int size = ids.length;
        final double[][] values = new double[size][size];
        for (int i = 0; i < size; i++) {
            values[i][i] = Double.NaN;
            final double[] upper = similarity.itemSimilarities(ids[i],
                    Arrays.copyOfRange(ids, i + 1, size));
            for (int j = i + 1; j < size; j++) {
                values[i][j] = upper[j - i - 1];
                values[j][i] = upper[j - i - 1];
            }
        }
        return new ItemSimilarityMatrix(ids, values);
    }

    public long[] getItemIDs() {
        return itemIDs.clone();
    }

    public int getNumItems() {
        return itemIDs.length;
    }

    public boolean hasItem(final long itemID) {
        return Arrays.binarySearch(itemIDs, itemID) >= 0;
    }

    @Override
    public double itemSimilarity(final long itemID1, final long itemID2) {
        return similarities[indexOf(itemID1)][indexOf(itemID2)];
    }

    @Override
    public double[] itemSimilarities(final long itemID1, final long[] itemID2s) {
        final double[] row = similarities[indexOf(itemID1)];
        final double[] result = new double[itemID2s.length];
        for (int i = 0; i < itemID2s.length; i++) {
            result[i] = row[indexOf(itemID2s[i])];
        }
        return result;
    }

    private int indexOf(final long itemID) {
        final int index = Arrays.binarySearch(itemIDs, itemID);
        Preconditions.checkArgument(index >= 0, "unknown item %s", itemID);
        return index;
    }

    @Override
    public String toString() {
        return "ItemSimilarityMatrix[items:" + itemIDs.length + ']';
    }
}
