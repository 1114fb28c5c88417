package com.marketplace.realtime.service;

import java.util.List;

/**
 * Outcome of one expiration sweep.
 *
 * @param errors one entry per skipped row or failed rule
 */
public record ExpirationResult(
        int expiredPending,
        int expiredAccepted,
        int notificationsCreated,
        List<String> errors
) {

    public ExpirationResult {
        errors = List.copyOf(errors);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
