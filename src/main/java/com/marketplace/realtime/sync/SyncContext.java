package com.marketplace.realtime.sync;

import java.util.Objects;

/**
 * Collaborators every sync consumer is constructed with.
 */
public record SyncContext(CurrentUserProvider currentUser, QueryCache queryCache, NoticeDispatcher notices) {

    public SyncContext {
        Objects.requireNonNull(currentUser, "currentUser");
        Objects.requireNonNull(queryCache, "queryCache");
        Objects.requireNonNull(notices, "notices");
    }

    /**
     * @throws IllegalStateException when no user is signed in
     */
    public String requireUserId() {
        String userId = currentUser.currentUserId();
        if (userId == null || userId.isBlank()) {
            throw new IllegalStateException("Realtime sync requires a signed-in user");
        }
        return userId;
    }
}
