package org.codelibs.rcmd.similarity;

import org.codelibs.rcmd.model.InteractionMatrix;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.base.Stopwatch;

/**
 * Builds the item by item similarity matrix of a processed interaction matrix.
 */
public class PairwiseSimilarityModel {

    private static final Logger log = LoggerFactory
            .getLogger(PairwiseSimilarityModel.class);

    private final SimilarityMetric metric;

    public PairwiseSimilarityModel(final SimilarityMetric metric) {
        Preconditions.checkArgument(metric != null, "metric is null");
        this.metric = metric;
    }

    public SimilarityMetric getMetric() {
        return metric;
    }

    public ItemSimilarityMatrix compute(final InteractionMatrix matrix) {
        Preconditions.checkArgument(matrix != null, "matrix is null");
        final Stopwatch stopwatch = Stopwatch.createStarted();
        final ItemSimilarityMatrix similarityMatrix = ItemSimilarityMatrix
                .compute(matrix.getItemIDs(), metric.create(matrix));
        log.info("Item similarity matrix generated with {}: {} items in {}",
                metric, similarityMatrix.getNumItems(), stopwatch);
        return similarityMatrix;
    }
}
