package com.marketplace.realtime.sync;

/**
 * Supplies the id of the user a sync consumer acts for.
 */
@FunctionalInterface
public interface CurrentUserProvider {

    /**
     * @return the user id, or {@code null} when nobody is signed in
     */
    String currentUserId();

    static CurrentUserProvider of(String userId) {
        return () -> userId;
    }
}
