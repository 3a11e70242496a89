package com.flowline.coordinator.stream;

import com.flowline.coordinator.bus.BusSubscription;
import com.flowline.coordinator.event.BuildEvent;
import com.flowline.coordinator.event.StoredBuildEvent;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * A subscriber's cursor over one build's event log.
 *
 * {@link #next()} returns events in id order without gaps or duplicates and
 * blocks while the build is still running and has nothing new. It never
 * trusts a notification's content: every wake-up (bus signal, poll timer,
 * close) is followed by a fresh read of committed rows, so a lost
 * notification only delays delivery until the next poll.
 *
 * <p>Ending conditions are distinct:
 * <ul>
 *   <li>{@link EndOfBuildEventStreamException}: the build is finished and
 *       everything has been delivered;</li>
 *   <li>{@link BuildEventStreamClosedException}: this cursor was closed.</li>
 * </ul>
 *
 * <p>Concurrent callers of {@code next()} are served one at a time;
 * {@link #close()} does not wait for them and releases all of them.
 */
public class BuildEventStream implements AutoCloseable {

    private final long            buildId;
    private final BuildEventStore store;
    private final BusSubscription subscription;
    private final Duration        minPollInterval;
    private final Duration        maxPollInterval;

    private final ReentrantLock           lock   = new ReentrantLock();
    private final Deque<StoredBuildEvent> buffer = new ArrayDeque<>();
    private final AtomicBoolean           closed = new AtomicBoolean(false);

    // Guarded by lock.
    private int nextEventId;

    BuildEventStream(long buildId,
                     int fromEventId,
                     BuildEventStore store,
                     BusSubscription subscription,
                     Duration minPollInterval,
                     Duration maxPollInterval) {
        this.buildId         = buildId;
        this.nextEventId     = fromEventId;
        this.store           = store;
        this.subscription    = subscription;
        this.minPollInterval = minPollInterval;
        this.maxPollInterval = maxPollInterval;
    }

    public long getBuildId() {
        return buildId;
    }

    /**
     * Next event payload. See {@link #nextStored()}.
     */
    public BuildEvent next() {
        return nextStored().event();
    }

    /**
     * Next event together with its id, blocking until one is committed.
     *
     * @throws EndOfBuildEventStreamException  the build finished and all events were delivered
     * @throws BuildEventStreamClosedException the cursor was closed, or the waiting thread was
     *                                         interrupted (which closes the cursor)
     */
    public StoredBuildEvent nextStored() {
        ensureOpen();
        try {
            lock.lockInterruptibly();
        } catch (InterruptedException e) {
            throw interrupted();
        }
        try {
            Duration pollInterval = minPollInterval;
            while (true) {
                ensureOpen();

                StoredBuildEvent buffered = buffer.pollFirst();
                if (buffered != null) {
                    nextEventId = buffered.eventId() + 1;
                    return buffered;
                }

                // Completion is read before the events: the final status event
                // commits together with completed = true, so if we see the flag
                // the read below also sees every event.
                boolean completed = store.isCompleted(buildId);
                List<StoredBuildEvent> batch = store.readFrom(buildId, nextEventId);
                if (!batch.isEmpty()) {
                    buffer.addAll(batch);
                    pollInterval = minPollInterval;
                    continue;
                }
                if (completed) {
                    throw new EndOfBuildEventStreamException(buildId);
                }

                boolean notified;
                try {
                    notified = subscription.await(pollInterval);
                } catch (InterruptedException e) {
                    throw interrupted();
                }
                pollInterval = notified ? minPollInterval : backoff(pollInterval);
            }
        } finally {
            lock.unlock();
        }
    }

    /** Idempotent; wakes every caller blocked in {@link #next()}. */
    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            subscription.close();
        }
    }

    public boolean isClosed() {
        return closed.get();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private void ensureOpen() {
        if (closed.get()) {
            throw new BuildEventStreamClosedException(buildId);
        }
    }

    private BuildEventStreamClosedException interrupted() {
        Thread.currentThread().interrupt();
        close();
        return new BuildEventStreamClosedException(buildId);
    }

    private Duration backoff(Duration current) {
        Duration doubled = current.multipliedBy(2);
        return doubled.compareTo(maxPollInterval) > 0 ? maxPollInterval : doubled;
    }
}
