package org.codelibs.rcmd.exception;

public class UnsupportedSimilarityMetricException extends RecommenderException {

    private static final long serialVersionUID = 1L;

    public UnsupportedSimilarityMetricException(final String message, final Throwable cause) {
        super(message, cause);
    }

    public UnsupportedSimilarityMetricException(final String message) {
        super(message);
    }

}
