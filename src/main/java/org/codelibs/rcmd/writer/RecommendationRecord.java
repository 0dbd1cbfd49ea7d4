package org.codelibs.rcmd.writer;

import java.util.Date;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import org.codelibs.rcmd.RcmdConstants;
import org.codelibs.rcmd.model.ModelType;

/**
 * A recommendation in the shape handed to persistence.
 */
public final class RecommendationRecord {

    private final long entityID;

    private final long recommendedItemID;

    private final Double score;

    private final ModelType modelType;

    private final Date updatedAt;

    private final boolean current;

    public RecommendationRecord(final long entityID,
            final long recommendedItemID, final Double score,
            final ModelType modelType, final Date updatedAt,
            final boolean current) {
        this.entityID = entityID;
        this.recommendedItemID = recommendedItemID;
        this.score = score;
        this.modelType = modelType;
        this.updatedAt = new Date(updatedAt.getTime());
        this.current = current;
    }

    public long getEntityID() {
        return entityID;
    }

    public long getRecommendedItemID() {
        return recommendedItemID;
    }

    public Double getScore() {
        return score;
    }

    public ModelType getModelType() {
        return modelType;
    }

    public Date getUpdatedAt() {
        return new Date(updatedAt.getTime());
    }

    public boolean isCurrent() {
        return current;
    }

    public Map<String, Object> toMap() {
        final Map<String, Object> rootObj = new LinkedHashMap<>();
        rootObj.put(RcmdConstants.ENTITY_ID_FIELD, entityID);
        rootObj.put(RcmdConstants.RECOMMENDED_ITEM_ID_FIELD, recommendedItemID);
        rootObj.put(RcmdConstants.SCORE_FIELD, score);
        rootObj.put(RcmdConstants.MODEL_TYPE_FIELD, modelType.getValue());
        rootObj.put(RcmdConstants.UPDATED_AT_FIELD, getUpdatedAt());
        rootObj.put(RcmdConstants.IS_CURRENT_FIELD, current);
        return rootObj;
    }

    @Override
    public boolean equals(final Object obj) {
        if (!(obj instanceof RecommendationRecord)) {
            return false;
        }
        final RecommendationRecord other = (RecommendationRecord) obj;
        return entityID == other.entityID
                && recommendedItemID == other.recommendedItemID
                && Objects.equals(score, other.score)
                && modelType == other.modelType
                && updatedAt.equals(other.updatedAt)
                && current == other.current;
    }

    @Override
    public int hashCode() {
        return Objects.hash(entityID, recommendedItemID, score, modelType,
                updatedAt, current);
    }

    @Override
    public String toString() {
        return toMap().toString();
    }
}
