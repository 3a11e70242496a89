package com.flowline.coordinator.bus;

/**
 * Process-wide publish/subscribe over named topics.
 *
 * Delivery is a wake-up, not a message: subscribers learn that "something
 * changed" for a topic and must re-read the store to find out what. A
 * notification may be delivered more than once, or spuriously, but a
 * registered subscription is never silently skipped.
 */
public interface NotificationBus {

    /**
     * Broadcast a wake-up on {@code topic} to every process sharing the store.
     * Never waits for subscribers. Inside a transaction, delivery happens on commit.
     */
    void notify(String topic);

    /**
     * Register interest in {@code topic}. The caller owns the returned handle
     * and must {@link BusSubscription#close() close} it.
     */
    BusSubscription listen(String topic);

    /** Whether the physical listen connection is currently established. */
    boolean isConnected();
}
