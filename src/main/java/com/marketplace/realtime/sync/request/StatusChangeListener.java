package com.marketplace.realtime.sync.request;

import com.marketplace.realtime.model.RequestStatus;

@FunctionalInterface
public interface StatusChangeListener {

    /**
     * @param oldStatus previous status, {@code null} when the feed did not carry it
     */
    void onStatusChange(String requestId, RequestStatus newStatus, RequestStatus oldStatus);
}
