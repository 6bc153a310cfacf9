package com.example.frontdesk.error;

import com.example.frontdesk.domain.enums.RequestStatus;

/**
 * Attempt to move a help request out of a terminal state.
 */
public class InvalidTransitionException extends FrontdeskException {

    private final Long requestId;
    private final RequestStatus current;

    public InvalidTransitionException(Long requestId, RequestStatus current, RequestStatus target) {
        super("help request " + requestId + " is " + current + ", cannot move to " + target);
        this.requestId = requestId;
        this.current = current;
    }

    public Long requestId() {
        return requestId;
    }

    public RequestStatus current() {
        return current;
    }

    @Override
    public String code() {
        return "invalid_transition";
    }
}
