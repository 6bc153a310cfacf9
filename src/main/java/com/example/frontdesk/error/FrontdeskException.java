package com.example.frontdesk.error;

/**
 * Base of the service's failure taxonomy. Unchecked, like the rest of the Spring stack.
 */
public abstract class FrontdeskException extends RuntimeException {

    protected FrontdeskException(String message) {
        super(message);
    }

    protected FrontdeskException(String message, Throwable cause) {
        super(message, cause);
    }

    /** short machine-readable code used in API error bodies */
    public abstract String code();
}
