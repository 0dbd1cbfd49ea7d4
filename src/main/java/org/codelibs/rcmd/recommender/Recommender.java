package org.codelibs.rcmd.recommender;

import java.util.List;

import org.codelibs.rcmd.exception.RecommendationGenerationException;
import org.codelibs.rcmd.model.ModelType;
import org.codelibs.rcmd.model.Recommendation;

/**
 * Produces the recommendations of one source entity at a time.
 */
public interface Recommender {

    /**
     * @return every entity this recommender can produce recommendations for, ascending
     */
    long[] getEntityIDs();

    /**
     * @param entityID source entity
     * @return recommendations of the entity, never containing the entity itself
     * @throws RecommendationGenerationException if the entity's recommendations cannot be produced
     */
    List<Recommendation> recommend(long entityID);

    ModelType getModelType();
}
