package org.codelibs.rcmd.model;

import java.util.Objects;

import com.google.common.base.Preconditions;

/**
 * One recommended item for a source entity (a user on the pairwise path, an
 * item on the itemset path). Score and rank are optional.
 */
public final class Recommendation {

    private final long sourceEntityID;

    private final long recommendedItemID;

    private final Double score;

    private final Integer rank;

    private final ModelType modelType;

    public Recommendation(final long sourceEntityID,
            final long recommendedItemID, final Double score,
            final Integer rank, final ModelType modelType) {
        Preconditions.checkArgument(sourceEntityID != recommendedItemID,
                "entity %s recommends itself", sourceEntityID);
        Preconditions.checkArgument(modelType != null, "modelType is null");
        this.sourceEntityID = sourceEntityID;
        this.recommendedItemID = recommendedItemID;
        this.score = score;
        this.rank = rank;
        this.modelType = modelType;
    }

    public static Recommendation pairwise(final long userID,
            final long itemID, final double score) {
        return new Recommendation(userID, itemID, score, null,
                ModelType.PAIRWISE);
    }

    public static Recommendation itemset(final long candidateItemID,
            final long itemID) {
        return new Recommendation(candidateItemID, itemID, null, null,
                ModelType.ITEMSET);
    }

    public long getSourceEntityID() {
        return sourceEntityID;
    }

    public long getRecommendedItemID() {
        return recommendedItemID;
    }

    public Double getScore() {
        return score;
    }

    public Integer getRank() {
        return rank;
    }

    public ModelType getModelType() {
        return modelType;
    }

    @Override
    public boolean equals(final Object obj) {
        if (!(obj instanceof Recommendation)) {
            return false;
        }
        final Recommendation other = (Recommendation) obj;
        return sourceEntityID == other.sourceEntityID
                && recommendedItemID == other.recommendedItemID
                && Objects.equals(score, other.score)
                && Objects.equals(rank, other.rank)
                && modelType == other.modelType;
    }

    @Override
    public int hashCode() {
        return Objects.hash(sourceEntityID, recommendedItemID, score, rank,
                modelType);
    }

    @Override
    public String toString() {
        return "Recommendation[source:" + sourceEntityID + ",item:"
                + recommendedItemID + ",score:" + score + ",rank:" + rank
                + ",type:" + modelType + ']';
    }
}
