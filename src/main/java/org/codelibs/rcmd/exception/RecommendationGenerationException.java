package org.codelibs.rcmd.exception;

/**
 * Thrown while producing the recommendations of a single entity. The batch
 * generator records it against {@link #getEntityID()} and moves on.
 */
public class RecommendationGenerationException extends RecommenderException {

    private static final long serialVersionUID = 1L;

    private final long entityID;

    public RecommendationGenerationException(final long entityID,
            final String message, final Throwable cause) {
        super(message, cause);
        this.entityID = entityID;
    }

    public RecommendationGenerationException(final long entityID,
            final String message) {
        super(message);
        this.entityID = entityID;
    }

    public long getEntityID() {
        return entityID;
    }

}
