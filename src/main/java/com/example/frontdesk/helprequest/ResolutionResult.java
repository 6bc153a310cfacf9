package com.example.frontdesk.helprequest;

/**
 * Outcome of {@link HelpRequestLifecycle#resolveDetailed}.
 */
public enum ResolutionResult {
    RESOLVED,
    NOT_FOUND,
    /** request exists but is already RESOLVED or TIMEOUT */
    INVALID_TRANSITION;

    public boolean succeeded() {
        return this == RESOLVED;
    }
}
