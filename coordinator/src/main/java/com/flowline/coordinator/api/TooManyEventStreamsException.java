package com.flowline.coordinator.api;

/**
 * Every event stream slot is taken. Clients should retry later.
 */
public class TooManyEventStreamsException extends RuntimeException {

    private final int limit;

    public TooManyEventStreamsException(int limit) {
        super("Too many open event streams (limit " + limit + ")");
        this.limit = limit;
    }

    public int getLimit() { return limit; }
}
