package org.codelibs.rcmd.recommender;

import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

import org.codelibs.rcmd.exception.RecommendationGenerationException;
import org.codelibs.rcmd.model.FrequentItemset;
import org.codelibs.rcmd.model.ModelType;
import org.codelibs.rcmd.model.Recommendation;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.primitives.Longs;

/**
 * <p>
 * Recommends, for an item, the other members of the strongest frequent
 * itemsets containing it.
 * </p>
 *
 * <p>
 * Itemsets containing the candidate are ranked by support, then length (both
 * descending, remaining ties by items). The members of the top
 * {@code topItemsets} are united, the candidate is removed and one unscored
 * recommendation is emitted per member in ascending item ID order.
 * </p>
 */
public class ItemsetRecommender implements Recommender {

    private final List<FrequentItemset> itemsets;

    private final int topItemsets;

    private final long[] candidateIDs;

    public ItemsetRecommender(final List<FrequentItemset> itemsets,
            final int topItemsets) {
        Preconditions.checkArgument(itemsets != null, "itemsets is null");
        Preconditions.checkArgument(topItemsets >= 1,
                "topItemsets must be at least 1");
        this.itemsets = ImmutableList.copyOf(itemsets);
        this.topItemsets = topItemsets;
        final SortedSet<Long> ids = new TreeSet<>();
        for (final FrequentItemset itemset : itemsets) {
            ids.addAll(itemset.getItems());
        }
        candidateIDs = Longs.toArray(ids);
    }

    @Override
    public long[] getEntityIDs() {
        return candidateIDs.clone();
    }

    @Override
    public ModelType getModelType() {
        return ModelType.ITEMSET;
    }

    @Override
    public List<Recommendation> recommend(final long itemID) {
        final List<FrequentItemset> containing = Lists.newArrayList();
        for (final FrequentItemset itemset : itemsets) {
            if (itemset.contains(itemID)) {
                containing.add(itemset);
            }
        }
        if (containing.isEmpty()) {
            throw new RecommendationGenerationException(itemID,
                    "No frequent itemset contains item " + itemID);
        }
        containing.sort(FrequentItemset.BY_SUPPORT_THEN_LENGTH);

        final SortedSet<Long> members = new TreeSet<>();
        for (final FrequentItemset itemset : containing.subList(0,
                Math.min(topItemsets, containing.size()))) {
            members.addAll(itemset.getItems());
        }
        members.remove(itemID);

        final List<Recommendation> recommendations = Lists
                .newArrayListWithCapacity(members.size());
        for (final Long member : members) {
            recommendations.add(Recommendation.itemset(itemID, member));
        }
        return recommendations;
    }

    @Override
    public String toString() {
        return "ItemsetRecommender[itemsets:" + itemsets.size()
                + ",topItemsets:" + topItemsets + ']';
    }
}
