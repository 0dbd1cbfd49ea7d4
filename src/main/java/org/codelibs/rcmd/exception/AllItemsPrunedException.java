package org.codelibs.rcmd.exception;

public class AllItemsPrunedException extends RecommenderException {

    private static final long serialVersionUID = 1L;

    public AllItemsPrunedException(final String message, final Throwable cause) {
        super(message, cause);
    }

    public AllItemsPrunedException(final String message) {
        super(message);
    }

}
