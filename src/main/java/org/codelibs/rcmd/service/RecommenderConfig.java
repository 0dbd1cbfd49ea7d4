package org.codelibs.rcmd.service;

import java.util.Collections;
import java.util.Map;

import org.codelibs.rcmd.RcmdConstants;
import org.codelibs.rcmd.exception.UnsupportedSimilarityMetricException;
import org.codelibs.rcmd.similarity.SimilarityMetric;
import org.codelibs.rcmd.util.SettingsUtils;

import com.google.common.base.Preconditions;

/**
 * Options of a batch run. Keys are the constants in {@link RcmdConstants};
 * missing keys take their defaults.
 */
public class RecommenderConfig {

    private final SimilarityMetric similarityMetric;

    private final int topNRecommendations;

    private final double minSupport;

    private final int maxItemsetLength;

    private final int minItemsetLengthFilter;

    private final int minBasketSize;

    private final int topItemsetsPerCandidate;

    private RecommenderConfig(final Map<String, Object> settings) {
        similarityMetric = SimilarityMetric.of(SettingsUtils.getString(
                settings, RcmdConstants.SIMILARITY_METRIC,
                SimilarityMetric.COSINE.getName()));
        topNRecommendations = SettingsUtils.getInt(settings,
                RcmdConstants.TOP_N_RECOMMENDATIONS,
                RcmdConstants.DEFAULT_TOP_N_RECOMMENDATIONS);
        minSupport = SettingsUtils.getDouble(settings,
                RcmdConstants.MIN_SUPPORT, RcmdConstants.DEFAULT_MIN_SUPPORT);
        maxItemsetLength = SettingsUtils.getInt(settings,
                RcmdConstants.MAX_ITEMSET_LENGTH,
                RcmdConstants.DEFAULT_MAX_ITEMSET_LENGTH);
        minItemsetLengthFilter = SettingsUtils.getInt(settings,
                RcmdConstants.MIN_ITEMSET_LENGTH_FILTER,
                RcmdConstants.DEFAULT_MIN_ITEMSET_LENGTH_FILTER);
        minBasketSize = SettingsUtils.getInt(settings,
                RcmdConstants.MIN_BASKET_SIZE,
                RcmdConstants.DEFAULT_MIN_BASKET_SIZE);
        topItemsetsPerCandidate = SettingsUtils.getInt(settings,
                RcmdConstants.TOP_ITEMSETS_PER_CANDIDATE,
                RcmdConstants.DEFAULT_TOP_ITEMSETS_PER_CANDIDATE);

        Preconditions.checkArgument(topNRecommendations >= 1,
                "%s must be at least 1: %s",
                RcmdConstants.TOP_N_RECOMMENDATIONS, topNRecommendations);
        Preconditions.checkArgument(minSupport > 0.0 && minSupport <= 1.0,
                "%s must be in (0, 1]: %s", RcmdConstants.MIN_SUPPORT,
                minSupport);
        Preconditions.checkArgument(maxItemsetLength >= 1,
                "%s must be at least 1: %s",
                RcmdConstants.MAX_ITEMSET_LENGTH, maxItemsetLength);
        Preconditions.checkArgument(minItemsetLengthFilter >= 0,
                "%s must not be negative: %s",
                RcmdConstants.MIN_ITEMSET_LENGTH_FILTER,
                minItemsetLengthFilter);
        Preconditions.checkArgument(minBasketSize >= 1,
                "%s must be at least 1: %s", RcmdConstants.MIN_BASKET_SIZE,
                minBasketSize);
        Preconditions.checkArgument(topItemsetsPerCandidate >= 1,
                "%s must be at least 1: %s",
                RcmdConstants.TOP_ITEMSETS_PER_CANDIDATE,
                topItemsetsPerCandidate);
    }

    /**
     * @throws UnsupportedSimilarityMetricException if the metric is not cosine or jaccard
     * @throws IllegalArgumentException if an option is out of range
     */
    public static RecommenderConfig load(final Map<String, Object> settings) {
        return new RecommenderConfig(settings);
    }

    public static RecommenderConfig defaults() {
        return new RecommenderConfig(Collections.<String, Object> emptyMap());
    }

    public SimilarityMetric getSimilarityMetric() {
        return similarityMetric;
    }

    public int getTopNRecommendations() {
        return topNRecommendations;
    }

    public double getMinSupport() {
        return minSupport;
    }

    public int getMaxItemsetLength() {
        return maxItemsetLength;
    }

    public int getMinItemsetLengthFilter() {
        return minItemsetLengthFilter;
    }

    public int getMinBasketSize() {
        return minBasketSize;
    }

    public int getTopItemsetsPerCandidate() {
        return topItemsetsPerCandidate;
    }

    @Override
    public String toString() {
        return "RecommenderConfig[similarityMetric:" + similarityMetric
                + ",topNRecommendations:" + topNRecommendations
                + ",minSupport:" + minSupport + ",maxItemsetLength:"
                + maxItemsetLength + ",minItemsetLengthFilter:"
                + minItemsetLengthFilter + ",minBasketSize:" + minBasketSize
                + ",topItemsetsPerCandidate:" + topItemsetsPerCandidate + ']';
    }
}
