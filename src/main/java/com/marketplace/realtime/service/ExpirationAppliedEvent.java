package com.marketplace.realtime.service;

import com.marketplace.realtime.model.Notification;

import java.util.List;

/**
 * Published inside the sweep transaction for every rule that changed rows.
 */
public record ExpirationAppliedEvent(String rule, List<ExpiredRequest> requests, List<Notification> notifications) {
}
