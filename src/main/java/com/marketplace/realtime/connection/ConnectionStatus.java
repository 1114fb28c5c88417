package com.marketplace.realtime.connection;

public enum ConnectionStatus {
    CONNECTING,
    CONNECTED,
    DISCONNECTED,
    RECONNECTING;

    public boolean isUp() {
        return this == CONNECTED || this == CONNECTING;
    }
}
