package org.codelibs.rcmd.recommender;

import java.util.List;

import org.codelibs.rcmd.exception.RecommendationGenerationException;
import org.codelibs.rcmd.model.Recommendation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;

/**
 * Runs a {@link Recommender} over all of its entities. A failing entity is
 * recorded in the {@link GenerationReport} and the remaining entities are still
 * processed.
 */
public class RecommendationGenerator {

    private static final Logger logger = LoggerFactory
            .getLogger(RecommendationGenerator.class);

    public GenerationReport generate(final Recommender recommender) {
        Preconditions.checkArgument(recommender != null, "recommender is null");

        final GenerationReport report = new GenerationReport();
        final long startTime = System.currentTimeMillis();
        logger.info("Generating {} recommendations by {}",
                recommender.getModelType(), recommender);
        for (final long entityID : recommender.getEntityIDs()) {
            long time = System.nanoTime();
            try {
                final List<Recommendation> recommendations = recommender
                        .recommend(entityID);
                time = (System.nanoTime() - time) / 1000000;
                report.addSuccess(recommendations, time);
                if (logger.isDebugEnabled()) {
                    logger.debug("Entity {} => Time: {} ms, Result: {}",
                            entityID, time, recommendations);
                }
            } catch (final RecommendationGenerationException e) {
                time = (System.nanoTime() - time) / 1000000;
                logger.error("Entity {} could not be processed.", entityID, e);
                report.addFailure(e, time);
            } catch (final RuntimeException e) {
                time = (System.nanoTime() - time) / 1000000;
                logger.error("Entity {} could not be processed.", entityID, e);
                report.addFailure(new RecommendationGenerationException(
                        entityID, "Failed to recommend for " + entityID, e),
                        time);
            }
        }
        logger.info("Processed {} entities at {} ms: {}",
                report.getSuccessful() + report.getFailure(),
                System.currentTimeMillis() - startTime, report);
        return report;
    }
}
