package com.marketplace.realtime.exception;

/**
 * Thrown when a channel filter expression cannot be parsed.
 */
public class InvalidChannelFilterException extends IllegalArgumentException {

    public InvalidChannelFilterException(String message) {
        super(message);
    }
}
