package org.codelibs.rcmd.exception;

public class InsufficientSupportItemsetsException extends RecommenderException {

    private static final long serialVersionUID = 1L;

    public InsufficientSupportItemsetsException(final String message, final Throwable cause) {
        super(message, cause);
    }

    public InsufficientSupportItemsetsException(final String message) {
        super(message);
    }

}
