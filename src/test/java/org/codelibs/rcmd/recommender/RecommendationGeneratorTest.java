package org.codelibs.rcmd.recommender;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.codelibs.rcmd.exception.RecommendationGenerationException;
import org.codelibs.rcmd.model.ModelType;
import org.codelibs.rcmd.model.Recommendation;
import org.junit.Test;

import com.google.common.collect.Lists;

public class RecommendationGeneratorTest {

    @Test
    public void isolateFailures() {
        final Recommender recommender = new Recommender() {
            @Override
            public long[] getEntityIDs() {
                return new long[] { 1, 2, 3, 4 };
            }

            @Override
            public List<Recommendation> recommend(final long entityID) {
                if (entityID == 2) {
                    throw new RecommendationGenerationException(entityID,
                            "no data");
                } else if (entityID == 3) {
                    throw new IllegalStateException("broken");
                } else if (entityID == 4) {
                    return Collections.emptyList();
                }
                return Arrays.asList(Recommendation.pairwise(entityID, 10,
                        0.5), Recommendation.pairwise(entityID, 11, 0.4));
            }

            @Override
            public ModelType getModelType() {
                return ModelType.PAIRWISE;
            }
        };

        final GenerationReport report = new RecommendationGenerator()
                .generate(recommender);

        assertEquals(2, report.getSuccessful());
        assertEquals(1, report.getNoRecommendation());
        assertEquals(2, report.getFailure());
        assertEquals(Arrays.asList(2L, 3L), Lists.newArrayList(report
                .getFailures().keySet()));
        assertTrue(report.getFailures().get(3L).getCause() instanceof IllegalStateException);
        assertEquals(2, report.getRecommendations().size());
        assertEquals(10, report.getRecommendations().get(0)
                .getRecommendedItemID());
        assertTrue(report.getMaxProcessingTime() <= report
                .getTotalProcessingTime());
        assertTrue(report.getAverageProcessingTime() <= report
                .getMaxProcessingTime());
    }
}
