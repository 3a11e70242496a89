package com.flowline.coordinator.bus;

import java.time.Duration;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * A registered interest in one topic.
 *
 * Notifications that arrive while nobody is waiting are remembered as a
 * single pending wake-up, so a signal sent between two {@link #await} calls
 * is not lost. Closing the handle wakes every waiter and deregisters it
 * from the bus.
 */
public final class BusSubscription implements AutoCloseable {

    private final String topic;
    private final Consumer<BusSubscription> onClose;

    private final ReentrantLock lock     = new ReentrantLock();
    private final Condition     signaled = lock.newCondition();

    private boolean pending  = false;
    private boolean released = false;

    public BusSubscription(String topic, Consumer<BusSubscription> onClose) {
        this.topic   = topic;
        this.onClose = onClose;
    }

    public String topic() {
        return topic;
    }

    /**
     * Block until the topic is notified, the timeout elapses, or the handle is closed.
     *
     * @return true if a notification was consumed; false on timeout or when closed
     */
    public boolean await(Duration timeout) throws InterruptedException {
        lock.lockInterruptibly();
        try {
            long remaining = timeout.toNanos();
            while (!pending && !released) {
                if (remaining <= 0L) {
                    return false;
                }
                remaining = signaled.awaitNanos(remaining);
            }
            if (released) {
                return false;
            }
            pending = false;
            return true;
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return released;
        } finally {
            lock.unlock();
        }
    }

    /** Idempotent. */
    @Override
    public void close() {
        lock.lock();
        try {
            if (released) {
                return;
            }
            released = true;
            signaled.signalAll();
        } finally {
            lock.unlock();
        }
        onClose.accept(this);
    }

    /** Record a wake-up for this topic and release any waiter. */
    public void signal() {
        lock.lock();
        try {
            if (released) {
                return;
            }
            pending = true;
            signaled.signalAll();
        } finally {
            lock.unlock();
        }
    }
}
