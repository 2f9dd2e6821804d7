package com.flagship.chain_webhooks.exception;

/**
 * The event queue is at capacity. The caller should retry later; the
 * webhook provider redelivers on 503.
 */
public class EventQueueFullException extends RuntimeException {

    private final int capacity;

    public EventQueueFullException(int capacity) {
        super("Event queue is full (capacity " + capacity + "), retry later");
        this.capacity = capacity;
    }

    public int getCapacity() {
        return capacity;
    }
}
