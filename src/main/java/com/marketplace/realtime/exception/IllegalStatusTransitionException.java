package com.marketplace.realtime.exception;

import com.marketplace.realtime.model.RequestStatus;

public class IllegalStatusTransitionException extends IllegalStateException {

    private final RequestStatus from;
    private final RequestStatus to;

    public IllegalStatusTransitionException(RequestStatus from, RequestStatus to) {
        super("Illegal request status transition " + from + " -> " + to);
        this.from = from;
        this.to = to;
    }

    public RequestStatus getFrom() {
        return from;
    }

    public RequestStatus getTo() {
        return to;
    }
}
