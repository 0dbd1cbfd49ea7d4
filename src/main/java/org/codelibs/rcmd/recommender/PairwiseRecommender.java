package org.codelibs.rcmd.recommender;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.codelibs.rcmd.exception.RecommendationGenerationException;
import org.codelibs.rcmd.model.InteractionMatrix;
import org.codelibs.rcmd.model.ModelType;
import org.codelibs.rcmd.model.Recommendation;
import org.codelibs.rcmd.similarity.ItemSimilarityMatrix;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;
import com.google.common.primitives.Longs;

/**
 * <p>
 * Recommends items to a user from the items most similar to the items the user
 * interacted with most.
 * </p>
 *
 * <p>
 * The user's top {@code howMany} items by count (ties by ascending item ID) are
 * the seeds. Each seed contributes the single other item most similar to it
 * (ties by ascending item ID). Contributions are collected by recommended item
 * in seed order and a later seed pointing at an item already collected
 * overwrites its score, so a user can receive fewer than {@code howMany}
 * recommendations.
 * </p>
 */
public class PairwiseRecommender implements Recommender {

    private static final Logger log = LoggerFactory
            .getLogger(PairwiseRecommender.class);

    static final int SCORE_SCALE = 5;

    private final InteractionMatrix matrix;

    private final ItemSimilarityMatrix similarity;

    private final int howMany;

    public PairwiseRecommender(final InteractionMatrix matrix,
            final ItemSimilarityMatrix similarity, final int howMany) {
        Preconditions.checkArgument(matrix != null, "matrix is null");
        Preconditions.checkArgument(similarity != null, "similarity is null");
        Preconditions.checkArgument(howMany >= 1, "howMany must be at least 1");
        this.matrix = matrix;
        this.similarity = similarity;
        this.howMany = howMany;
    }

    @Override
    public long[] getEntityIDs() {
        return matrix.getUserIDs();
    }

    @Override
    public ModelType getModelType() {
        return ModelType.PAIRWISE;
    }

    @Override
    public List<Recommendation> recommend(final long userID) {
        if (!matrix.hasUser(userID)) {
            throw new RecommendationGenerationException(userID,
                    "No interactions for user " + userID);
        }
        log.debug("Recommending items for user ID '{}'", userID);

        final List<RecommendedItem> seeds = getSeedItems(userID);
        final long[] candidateIDs = similarity.getItemIDs();

        // last write wins for an item recommended from several seeds
        final Map<Long, Double> recommendedItems = new LinkedHashMap<>();
        for (final RecommendedItem seed : seeds) {
            final long seedID = seed.getItemID();
            if (!similarity.hasItem(seedID)) {
                throw new RecommendationGenerationException(userID,
                        "No similarity row for item " + seedID);
            }
            final List<RecommendedItem> mostSimilar = TopItems.getTopItems(1,
                    candidateIDs, itemID -> itemID == seedID
                            || itemID == userID ? Double.NaN : similarity
                            .itemSimilarity(seedID, itemID));
            if (mostSimilar.isEmpty()) {
                throw new RecommendationGenerationException(userID,
                        "No item is comparable with item " + seedID);
            }
            final RecommendedItem item = mostSimilar.get(0);
            recommendedItems.put(item.getItemID(), round(item.getValue()));
        }

        final List<Recommendation> recommendations = Lists
                .newArrayListWithCapacity(recommendedItems.size());
        for (final Map.Entry<Long, Double> entry : recommendedItems.entrySet()) {
            recommendations.add(Recommendation.pairwise(userID,
                    entry.getKey(), entry.getValue()));
        }
        return recommendations;
    }

    /**
     * @return the user's most interacted items, at most {@code howMany}
     */
    List<RecommendedItem> getSeedItems(final long userID) {
        final Map<Long, Integer> counts = matrix.getUserColumn(userID);
        final List<Long> interacted = Lists.newArrayList();
        for (final Map.Entry<Long, Integer> entry : counts.entrySet()) {
            if (entry.getValue() != 0) {
                interacted.add(entry.getKey());
            }
        }
        return TopItems.getTopItems(howMany, Longs.toArray(interacted),
                itemID -> counts.get(itemID));
    }

    static double round(final double value) {
        return BigDecimal.valueOf(value)
                .setScale(SCORE_SCALE, RoundingMode.HALF_UP).doubleValue();
    }

    @Override
    public String toString() {
        return "PairwiseRecommender[matrix:" + matrix + ",similarity:"
                + similarity + ",howMany:" + howMany + ']';
    }
}
