package com.flowline.coordinator.stream;

import com.flowline.coordinator.bus.NotificationBus;
import com.flowline.coordinator.event.BuildEvent;
import com.flowline.coordinator.event.BuildEventCodec;
import com.flowline.coordinator.event.StoredBuildEvent;
import com.flowline.coordinator.model.Build;
import com.flowline.coordinator.model.BuildEventRecord;
import com.flowline.coordinator.repository.BuildEventRepository;
import com.flowline.coordinator.repository.BuildRepository;
import com.flowline.coordinator.service.BuildNotFoundException;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.util.List;

/**
 * Per-build append-only event log with live subscriptions.
 *
 * Appends lock the build row, take the next event id from it, insert the
 * event and publish a wake-up on the build's topic, all in one transaction.
 * Because NOTIFY is delivered at commit, a subscriber that wakes up always
 * finds the new row when it re-reads.
 */
@Service
public class BuildEventStore {

    private static final Logger log = LoggerFactory.getLogger(BuildEventStore.class);

    private final BuildRepository      buildRepo;
    private final BuildEventRepository eventRepo;
    private final BuildEventCodec      codec;
    private final NotificationBus      bus;
    private final MeterRegistry        meterRegistry;
    private final int                  batchSize;
    private final Duration             minPollInterval;
    private final Duration             maxPollInterval;

    public BuildEventStore(BuildRepository buildRepo,
                           BuildEventRepository eventRepo,
                           BuildEventCodec codec,
                           NotificationBus bus,
                           MeterRegistry meterRegistry,
                           @Value("${flowline.events.batch-size:100}") int batchSize,
                           @Value("${flowline.events.min-poll-interval:100ms}") Duration minPollInterval,
                           @Value("${flowline.events.max-poll-interval:5s}") Duration maxPollInterval) {
        this.buildRepo       = buildRepo;
        this.eventRepo       = eventRepo;
        this.codec           = codec;
        this.bus             = bus;
        this.meterRegistry   = meterRegistry;
        this.batchSize       = batchSize;
        this.minPollInterval = minPollInterval;
        this.maxPollInterval = maxPollInterval;
    }

    /** Bus topic carrying wake-ups for one build's events. */
    public static String topicFor(long buildId) {
        return "build_events_" + buildId;
    }

    // ------------------------------------------------------------------
    // Writing
    // ------------------------------------------------------------------

    /**
     * Append an event to the build's log and wake its subscribers.
     *
     * Joins the caller's transaction when there is one (lifecycle transitions
     * append their status event this way), so either everything commits or
     * nothing is appended.
     *
     * @return the event id assigned to the new event
     * @throws BuildNotFoundException if the build does not exist
     */
    @Transactional
    public int append(long buildId, BuildEvent event) {
        Build build = buildRepo.findByIdForUpdate(buildId)
                .orElseThrow(() -> new BuildNotFoundException(buildId));

        int eventId = build.claimNextEventId();
        eventRepo.save(codec.encode(buildId, eventId, event));
        bus.notify(topicFor(buildId));

        meterRegistry.counter("flowline.build.events.appended",
                "type", event.eventType().typeName()).increment();
        log.debug("Appended {} event {} to build {}", event.eventType().typeName(), eventId, buildId);
        return eventId;
    }

    // ------------------------------------------------------------------
    // Reading
    // ------------------------------------------------------------------

    /**
     * Open a cursor positioned at {@code fromEventId} (0 = from the start).
     * The cursor listens on the build's topic before its first read.
     *
     * @throws BuildNotFoundException if the build does not exist
     */
    public BuildEventStream subscribe(long buildId, int fromEventId) {
        if (fromEventId < 0) {
            throw new IllegalArgumentException("fromEventId must be >= 0, got " + fromEventId);
        }
        if (!buildRepo.existsById(buildId)) {
            throw new BuildNotFoundException(buildId);
        }
        return new BuildEventStream(buildId, fromEventId, this,
                bus.listen(topicFor(buildId)), minPollInterval, maxPollInterval);
    }

    /** Committed events with id >= fromEventId, oldest first, at most one batch. */
    public List<StoredBuildEvent> readFrom(long buildId, int fromEventId) {
        List<BuildEventRecord> rows = eventRepo.findByBuildIdAndEventIdGreaterThanEqualOrderByEventIdAsc(
                buildId, fromEventId, PageRequest.of(0, batchSize));
        return rows.stream().map(codec::decode).toList();
    }

    /** A build that no longer exists has no more events to offer either. */
    public boolean isCompleted(long buildId) {
        return buildRepo.findCompletedById(buildId).orElse(true);
    }
}
