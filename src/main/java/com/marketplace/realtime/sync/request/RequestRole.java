package com.marketplace.realtime.sync.request;

public enum RequestRole {
    CLIENT("client_id", "requests-client:"),
    PROVIDER("provider_id", "requests-provider:");

    private final String column;
    private final String channelPrefix;

    RequestRole(String column, String channelPrefix) {
        this.column = column;
        this.channelPrefix = channelPrefix;
    }

    /** Column of {@code listing_requests} holding the user in this role. */
    public String column() {
        return column;
    }

    public String channelName(String userId) {
        return channelPrefix + userId;
    }
}
