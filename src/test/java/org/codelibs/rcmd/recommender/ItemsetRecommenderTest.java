package org.codelibs.rcmd.recommender;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.List;

import org.codelibs.rcmd.exception.RecommendationGenerationException;
import org.codelibs.rcmd.model.FrequentItemset;
import org.codelibs.rcmd.model.ModelType;
import org.codelibs.rcmd.model.Recommendation;
import org.junit.Test;

import com.google.common.collect.Lists;

public class ItemsetRecommenderTest {

    private static final List<FrequentItemset> ITEMSETS = Arrays.asList(
            new FrequentItemset(Arrays.asList(1L, 2L, 3L), 0.5),
            new FrequentItemset(Arrays.asList(1L, 4L, 5L), 0.4),
            new FrequentItemset(Arrays.asList(1L, 6L, 7L, 8L), 0.4),
            new FrequentItemset(Arrays.asList(1L, 9L, 10L), 0.3),
            new FrequentItemset(Arrays.asList(2L, 3L, 11L), 0.2));

    @Test
    public void unionOfTopItemsets() {
        final List<Recommendation> recommendations = new ItemsetRecommender(
                ITEMSETS, 3).recommend(1);

        // {1,2,3}, then {1,6,7,8} before {1,4,5}; {1,9,10} is not used
        assertEquals(Arrays.asList(2L, 3L, 4L, 5L, 6L, 7L, 8L),
                itemIDs(recommendations));
        for (final Recommendation recommendation : recommendations) {
            assertEquals(1, recommendation.getSourceEntityID());
            assertEquals(ModelType.ITEMSET, recommendation.getModelType());
            assertNull(recommendation.getScore());
        }
    }

    @Test
    public void singleItemset() {
        final List<Recommendation> recommendations = new ItemsetRecommender(
                ITEMSETS, 3).recommend(11);

        assertEquals(Arrays.asList(2L, 3L), itemIDs(recommendations));
    }

    @Test
    public void topItemsets() {
        final List<Recommendation> recommendations = new ItemsetRecommender(
                ITEMSETS, 1).recommend(1);

        assertEquals(Arrays.asList(2L, 3L), itemIDs(recommendations));
    }

    @Test
    public void candidates() {
        assertArrayEquals(
                new long[] { 1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11 },
                new ItemsetRecommender(ITEMSETS, 3).getEntityIDs());
    }

    @Test
    public void unknownItem() {
        try {
            new ItemsetRecommender(ITEMSETS, 3).recommend(12);
            fail();
        } catch (final RecommendationGenerationException e) {
            assertEquals(12, e.getEntityID());
        }
    }

    private static List<Long> itemIDs(final List<Recommendation> recommendations) {
        final List<Long> itemIDs = Lists.newArrayList();
        for (final Recommendation recommendation : recommendations) {
            itemIDs.add(recommendation.getRecommendedItemID());
        }
        return itemIDs;
    }
}
