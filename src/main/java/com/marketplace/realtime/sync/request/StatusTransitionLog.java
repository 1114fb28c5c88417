package com.marketplace.realtime.sync.request;

import com.marketplace.realtime.model.RequestStatus;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Last status observed per request. Rejects duplicate deliveries and
 * late non-terminal statuses for requests that already reached a terminal one.
 */
class StatusTransitionLog {

    private static final int MAX_TRACKED = 1_000;

    private final Map<String, RequestStatus> lastSeen = new LinkedHashMap<>(64, 0.75f, true) {
        @Override
        protected boolean removeEldestEntry(Map.Entry<String, RequestStatus> eldest) {
            return size() > MAX_TRACKED;
        }
    };

    /**
     * @return {@code true} if the transition is new and was recorded
     */
    synchronized boolean record(String requestId, RequestStatus status) {
        RequestStatus previous = lastSeen.get(requestId);
        if (previous == status) {
            return false;
        }
        if (previous != null && previous.isTerminal() && !status.isTerminal()) {
            return false;
        }
        lastSeen.put(requestId, status);
        return true;
    }
}
