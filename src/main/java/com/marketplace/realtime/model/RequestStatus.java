package com.marketplace.realtime.model;

import com.marketplace.realtime.exception.IllegalStatusTransitionException;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Lifecycle of a listing request. Wire values are the lowercase names stored in
 * the {@code listing_requests.status} column.
 */
public enum RequestStatus {
    PENDING("pending"),
    PRICE_PROPOSED("price_proposed"),
    ACCEPTED("accepted"),
    REJECTED("rejected"),
    IN_PROGRESS("in_progress"),
    AWAITING_COMPLETION_DETAILS("awaiting_completion_details"),
    AWAITING_CLIENT_CONFIRMATION("awaiting_client_confirmation"),
    AWAITING_PAYMENT("awaiting_payment"),
    COMPLETED("completed"),
    CANCELLED_BY_CLIENT("cancelled_by_client"),
    CANCELLED_BY_PROVIDER("cancelled_by_provider"),
    DISPUTED("disputed");

    private static final Map<RequestStatus, Set<RequestStatus>> TRANSITIONS = Map.of(
            PENDING, EnumSet.of(PRICE_PROPOSED, ACCEPTED, REJECTED, CANCELLED_BY_CLIENT, CANCELLED_BY_PROVIDER),
            PRICE_PROPOSED, EnumSet.of(ACCEPTED, REJECTED, CANCELLED_BY_CLIENT, CANCELLED_BY_PROVIDER),
            ACCEPTED, EnumSet.of(IN_PROGRESS, CANCELLED_BY_CLIENT, CANCELLED_BY_PROVIDER),
            IN_PROGRESS, EnumSet.of(AWAITING_COMPLETION_DETAILS, AWAITING_CLIENT_CONFIRMATION,
                    CANCELLED_BY_CLIENT, CANCELLED_BY_PROVIDER),
            AWAITING_COMPLETION_DETAILS, EnumSet.of(AWAITING_CLIENT_CONFIRMATION,
                    CANCELLED_BY_CLIENT, CANCELLED_BY_PROVIDER),
            AWAITING_CLIENT_CONFIRMATION, EnumSet.of(AWAITING_PAYMENT, DISPUTED,
                    CANCELLED_BY_CLIENT, CANCELLED_BY_PROVIDER),
            AWAITING_PAYMENT, EnumSet.of(COMPLETED, CANCELLED_BY_CLIENT, CANCELLED_BY_PROVIDER)
    );

    private final String wireValue;

    RequestStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }

    public boolean isTerminal() {
        return allowedTargets().isEmpty();
    }

    public Set<RequestStatus> allowedTargets() {
        return TRANSITIONS.getOrDefault(this, Collections.emptySet());
    }

    public boolean canTransitionTo(RequestStatus target) {
        return allowedTargets().contains(target);
    }

    /**
     * @throws IllegalStatusTransitionException if {@code target} is not reachable from this status
     */
    public void requireTransition(RequestStatus target) {
        if (!canTransitionTo(target)) {
            throw new IllegalStatusTransitionException(this, target);
        }
    }

    public static RequestStatus fromWire(String value) {
        if (value == null) {
            return null;
        }
        return Arrays.stream(values())
                .filter(status -> status.wireValue.equals(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown request status: " + value));
    }

    @Override
    public String toString() {
        return wireValue;
    }
}
