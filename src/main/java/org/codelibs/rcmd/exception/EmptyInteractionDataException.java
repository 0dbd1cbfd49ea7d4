package org.codelibs.rcmd.exception;

public class EmptyInteractionDataException extends RecommenderException {

    private static final long serialVersionUID = 1L;

    public EmptyInteractionDataException(final String message, final Throwable cause) {
        super(message, cause);
    }

    public EmptyInteractionDataException(final String message) {
        super(message);
    }

}
