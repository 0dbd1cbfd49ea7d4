package org.codelibs.rcmd.similarity;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

public class PairwiseSimilarityModelTest {

    @Test
    public void compute() {
        final PairwiseSimilarityModel model = new PairwiseSimilarityModel(
                SimilarityMetric.COSINE);
        assertEquals(SimilarityMetric.COSINE, model.getMetric());
        final ItemSimilarityMatrix matrix = model.compute(SimilarityTestUtils
                .createMatrix());

        final long[] itemIDs = matrix.getItemIDs();
        assertArrayEquals(new long[] { 1, 2, 3, 4 }, itemIDs);
        for (final long itemID1 : itemIDs) {
            assertTrue(Double.isNaN(matrix.itemSimilarity(itemID1, itemID1)));
            for (final long itemID2 : itemIDs) {
                if (itemID1 != itemID2) {
                    final double value = matrix.itemSimilarity(itemID1,
                            itemID2);
                    assertEquals(value,
                            matrix.itemSimilarity(itemID2, itemID1), 0.0);
                    assertTrue(value >= 0.0 && value <= 1.0);
                }
            }
        }
        assertEquals(0.28284, matrix.itemSimilarity(2, 1), 1.0e-5);
    }

    @Test
    public void similarItems() {
        final ItemSimilarityMatrix matrix = new PairwiseSimilarityModel(
                SimilarityMetric.JACCARD).compute(SimilarityTestUtils
                .createMatrix());

        final double[] values = matrix.itemSimilarities(2, new long[] { 1,
                2, 4 });
        assertEquals(1.0 / 3.0, values[0], 1.0e-12);
        assertTrue(Double.isNaN(values[1]));
        assertEquals(0.0, values[2], 0.0);
        assertEquals(4, matrix.getNumItems());
        assertTrue(matrix.hasItem(4));
        assertFalse(matrix.hasItem(5));
    }
}
