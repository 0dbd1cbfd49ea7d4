package org.codelibs.rcmd.similarity;

import java.util.Locale;

import org.codelibs.rcmd.exception.UnsupportedSimilarityMetricException;
import org.codelibs.rcmd.model.InteractionMatrix;

public enum SimilarityMetric {
    COSINE("cosine") {
        @Override
        public ItemSimilarity create(final InteractionMatrix matrix) {
            return new UncenteredCosineSimilarity(matrix);
        }
    },
    JACCARD("jaccard") {
        @Override
        public ItemSimilarity create(final InteractionMatrix matrix) {
            return new TanimotoCoefficientSimilarity(matrix);
        }
    };

    private final String name;

    SimilarityMetric(final String name) {
        this.name = name;
    }

    public abstract ItemSimilarity create(InteractionMatrix matrix);

    public String getName() {
        return name;
    }

    /**
     * @throws UnsupportedSimilarityMetricException if the name is neither cosine nor jaccard
     */
    public static SimilarityMetric of(final String name) {
        if (name != null) {
            final String value = name.trim().toLowerCase(Locale.ROOT);
            for (final SimilarityMetric metric : values()) {
                if (metric.name.equals(value)) {
                    return metric;
                }
            }
        }
        throw new UnsupportedSimilarityMetricException(
                "Unsupported similarity metric: " + name);
    }

    @Override
    public String toString() {
        return name;
    }
}
