package org.codelibs.rcmd.similarity;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

public class TanimotoCoefficientSimilarityTest {

    @Test
    public void similarity() {
        final ItemSimilarity similarity = new TanimotoCoefficientSimilarity(
                SimilarityTestUtils.createMatrix());

        // users {1,3} and {1,2}
        assertEquals(1.0 / 3.0, similarity.itemSimilarity(1, 2), 1.0e-12);
        assertEquals(similarity.itemSimilarity(2, 1),
                similarity.itemSimilarity(1, 2), 0.0);
        assertEquals(0.0, similarity.itemSimilarity(1, 3), 0.0);
        assertTrue(Double.isNaN(similarity.itemSimilarity(2, 2)));
    }

    @Test
    public void emptyVectors() {
        final ItemSimilarity similarity = new TanimotoCoefficientSimilarity(
                SimilarityTestUtils.createMatrix());

        assertEquals(1.0, similarity.itemSimilarity(3, 4), 0.0);
    }
}
