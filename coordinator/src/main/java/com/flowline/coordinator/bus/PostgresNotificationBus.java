package com.flowline.coordinator.bus;

import io.micrometer.core.instrument.MeterRegistry;
import org.postgresql.PGConnection;
import org.postgresql.PGNotification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.ResultSetExtractor;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.regex.Pattern;

/**
 * {@link NotificationBus} on top of PostgreSQL LISTEN/NOTIFY.
 *
 * <p>All logical topics share one physical channel: {@link #notify} sends
 * {@code pg_notify(channel, topic)} and a single background thread, which
 * owns the only LISTEN connection of this process, fans each payload out to
 * the local subscriptions registered for that topic. Every process running
 * a bus on the same database sees every notification.
 *
 * <p>Connection loss: the listener reconnects with exponential backoff
 * (min → max). After each successful (re)connect it signals every registered
 * topic once, since notifications sent while it was disconnected are gone.
 * Subscribers get at most one spurious wake-up per reconnect and never miss one.
 * Registrations live in this object, not on the connection, so they survive
 * reconnects, and {@link #notify} goes through the pool and never waits on
 * the listener.
 */
public class PostgresNotificationBus implements NotificationBus, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PostgresNotificationBus.class);

    private static final Pattern CHANNEL_NAME = Pattern.compile("[a-z_][a-z0-9_]{0,62}");

    // How often an idle listen connection is checked with isValid().
    private static final Duration HEALTH_CHECK_INTERVAL = Duration.ofSeconds(10);

    private final ListenConnectionFactory connections;
    private final JdbcTemplate            jdbc;
    private final String                  channel;
    private final Duration                pollInterval;
    private final Duration                minBackoff;
    private final Duration                maxBackoff;
    private final MeterRegistry           meterRegistry;

    private final ConcurrentMap<String, Set<BusSubscription>> subscriptions = new ConcurrentHashMap<>();

    private final ExecutorService listener = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "notification-bus-listener");
        t.setDaemon(true);
        return t;
    });

    private final AtomicBoolean  running = new AtomicBoolean(false);
    private final CountDownLatch stopped = new CountDownLatch(1);

    private volatile boolean connected = false;

    public PostgresNotificationBus(ListenConnectionFactory connections,
                                   JdbcTemplate jdbc,
                                   String channel,
                                   Duration pollInterval,
                                   Duration minBackoff,
                                   Duration maxBackoff,
                                   MeterRegistry meterRegistry) {
        if (!CHANNEL_NAME.matcher(channel).matches()) {
            throw new IllegalArgumentException("Invalid notification channel name: '" + channel + "'");
        }
        this.connections   = connections;
        this.jdbc          = jdbc;
        this.channel       = channel;
        this.pollInterval  = pollInterval;
        this.minBackoff    = minBackoff;
        this.maxBackoff    = maxBackoff;
        this.meterRegistry = meterRegistry;
    }

    // ------------------------------------------------------------------
    // Lifecycle
    // ------------------------------------------------------------------

    /** Start the listener thread. Idempotent. */
    public void start() {
        if (running.compareAndSet(false, true)) {
            log.info("Starting notification bus on channel '{}'", channel);
            listener.submit(this::runListener);
        }
    }

    /**
     * Stop listening. Subscriptions stay registered (they belong to their
     * owners), they simply stop receiving wake-ups.
     */
    @Override
    public void close() {
        if (!running.getAndSet(false)) {
            return;
        }
        stopped.countDown();
        listener.shutdown();
        try {
            if (!listener.awaitTermination(pollInterval.toMillis() * 4 + 1000, TimeUnit.MILLISECONDS)) {
                log.warn("Notification bus listener did not stop in time; interrupting");
                listener.shutdownNow();
            }
        } catch (InterruptedException e) {
            listener.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Notification bus on channel '{}' stopped", channel);
    }

    // ------------------------------------------------------------------
    // NotificationBus
    // ------------------------------------------------------------------

    @Override
    public void notify(String topic) {
        jdbc.query("SELECT pg_notify(?, ?)", (ResultSetExtractor<Void>) rs -> null, channel, topic);
    }

    @Override
    public BusSubscription listen(String topic) {
        BusSubscription subscription = new BusSubscription(topic, this::unregister);
        subscriptions.compute(topic, (t, subs) -> {
            Set<BusSubscription> set = subs != null ? subs : ConcurrentHashMap.newKeySet();
            set.add(subscription);
            return set;
        });
        return subscription;
    }

    @Override
    public boolean isConnected() {
        return connected;
    }

    /** Number of topics with at least one live subscription. */
    public int topicCount() {
        return subscriptions.size();
    }

    // ------------------------------------------------------------------
    // Fan-out
    // ------------------------------------------------------------------

    void dispatch(String topic) {
        meterRegistry.counter("flowline.bus.notifications").increment();
        Set<BusSubscription> subs = subscriptions.get(topic);
        if (subs != null) {
            subs.forEach(BusSubscription::signal);
        }
    }

    void signalAllRegistered() {
        subscriptions.forEach((topic, subs) -> subs.forEach(BusSubscription::signal));
    }

    private void unregister(BusSubscription subscription) {
        subscriptions.computeIfPresent(subscription.topic(), (t, subs) -> {
            subs.remove(subscription);
            return subs.isEmpty() ? null : subs;
        });
    }

    // ------------------------------------------------------------------
    // Listener loop
    // ------------------------------------------------------------------

    private void runListener() {
        Duration backoff = minBackoff;
        while (running.get()) {
            try {
                listenUntilStopped();
                backoff = minBackoff;
            } catch (SQLException | NotificationBusException e) {
                if (!running.get()) {
                    break;
                }
                meterRegistry.counter("flowline.bus.reconnects").increment();
                log.warn("Notification bus lost its connection on channel '{}', reconnecting in {}: {}",
                        channel, backoff, e.getMessage());
                if (awaitStop(backoff)) {
                    break;
                }
                backoff = nextBackoff(backoff);
            } catch (RuntimeException e) {
                log.error("Unexpected error in notification bus listener on channel '{}'", channel, e);
                if (awaitStop(backoff)) {
                    break;
                }
                backoff = nextBackoff(backoff);
            }
        }
    }

    /**
     * One connection's worth of listening. Returns normally only when the bus
     * is stopped; any connection problem surfaces as an exception.
     */
    private void listenUntilStopped() throws SQLException {
        try (Connection conn = connections.open()) {
            try (Statement stmt = conn.createStatement()) {
                stmt.execute("LISTEN " + channel);
            }
            PGConnection pg = conn.unwrap(PGConnection.class);
            connected = true;
            log.info("Listening for notifications on channel '{}'", channel);

            signalAllRegistered();

            long nextHealthCheck = System.nanoTime() + HEALTH_CHECK_INTERVAL.toNanos();
            while (running.get()) {
                PGNotification[] received = pg.getNotifications((int) pollInterval.toMillis());
                if (received != null && received.length > 0) {
                    for (PGNotification n : received) {
                        dispatch(n.getParameter());
                    }
                } else if (System.nanoTime() - nextHealthCheck >= 0) {
                    if (!conn.isValid(5)) {
                        throw new NotificationBusException("Listen connection on channel '" + channel + "' is no longer valid");
                    }
                    nextHealthCheck = System.nanoTime() + HEALTH_CHECK_INTERVAL.toNanos();
                }
            }
        } finally {
            connected = false;
        }
    }

    private boolean awaitStop(Duration delay) {
        try {
            return stopped.await(delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return true;
        }
    }

    private Duration nextBackoff(Duration current) {
        Duration doubled = current.multipliedBy(2);
        return doubled.compareTo(maxBackoff) > 0 ? maxBackoff : doubled;
    }
}
