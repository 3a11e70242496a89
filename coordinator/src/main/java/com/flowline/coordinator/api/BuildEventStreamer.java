package com.flowline.coordinator.api;

import com.flowline.coordinator.api.dto.BuildEventMessage;
import com.flowline.coordinator.event.StoredBuildEvent;
import com.flowline.coordinator.stream.BuildEventStore;
import com.flowline.coordinator.stream.BuildEventStream;
import com.flowline.coordinator.stream.BuildEventStreamClosedException;
import com.flowline.coordinator.stream.EndOfBuildEventStreamException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Pumps a build's event cursor into a server-sent event stream.
 *
 * Each open stream holds one thread blocked in {@link BuildEventStream#next()}.
 * When the client disconnects or the emitter times out the cursor is closed,
 * which releases that thread. At most {@code flowline.events.max-streams}
 * streams are open at once; further requests are refused with
 * {@link TooManyEventStreamsException}.
 */
@Component
public class BuildEventStreamer implements DisposableBean {

    private static final Logger log = LoggerFactory.getLogger(BuildEventStreamer.class);

    static final String END_EVENT = "end";

    private final AtomicInteger threadCount = new AtomicInteger();

    private final ThreadPoolExecutor pumps;
    private final BuildEventStore    eventStore;
    private final Duration           timeout;
    private final int                maxStreams;

    public BuildEventStreamer(BuildEventStore eventStore,
                              @Value("${flowline.events.stream-timeout:30m}") Duration timeout,
                              @Value("${flowline.events.max-streams:200}") int maxStreams) {
        this.eventStore = eventStore;
        this.timeout    = timeout;
        this.maxStreams = maxStreams;
        // No queue: a stream either gets a pump thread now or is refused.
        this.pumps = new ThreadPoolExecutor(0, maxStreams, 60L, TimeUnit.SECONDS,
                new SynchronousQueue<>(), r -> {
                    Thread t = new Thread(r, "build-event-stream-" + threadCount.incrementAndGet());
                    t.setDaemon(true);
                    return t;
                });
    }

    /**
     * Open a stream starting at {@code fromEventId}. The cursor is opened
     * before returning, so an unknown build fails the request instead of
     * the stream.
     *
     * @throws TooManyEventStreamsException if every pump thread is busy
     */
    public SseEmitter stream(long buildId, int fromEventId) {
        BuildEventStream cursor = eventStore.subscribe(buildId, fromEventId);
        SseEmitter emitter = new SseEmitter(timeout.toMillis());
        emitter.onCompletion(cursor::close);
        emitter.onTimeout(cursor::close);
        emitter.onError(e -> cursor.close());

        try {
            pumps.execute(() -> pump(cursor, emitter));
        } catch (RejectedExecutionException e) {
            cursor.close();
            log.warn("Refused event stream of build {}: {} streams already open", buildId, maxStreams);
            throw new TooManyEventStreamsException(maxStreams);
        }
        log.debug("Streaming events of build {} from event {}", buildId, fromEventId);
        return emitter;
    }

    private void pump(BuildEventStream cursor, SseEmitter emitter) {
        try {
            while (true) {
                StoredBuildEvent stored = cursor.nextStored();
                emitter.send(SseEmitter.event()
                        .id(Integer.toString(stored.eventId()))
                        .name(stored.event().eventType().typeName())
                        .data(BuildEventMessage.from(stored), MediaType.APPLICATION_JSON));
            }
        } catch (EndOfBuildEventStreamException e) {
            sendEnd(cursor, emitter);
        } catch (BuildEventStreamClosedException e) {
            log.debug("Event stream of build {} closed by its client", cursor.getBuildId());
        } catch (IOException | IllegalStateException e) {
            // Client gone or emitter already completed.
            log.debug("Event stream of build {} aborted: {}", cursor.getBuildId(), e.getMessage());
            emitter.completeWithError(e);
        } catch (RuntimeException e) {
            log.error("Event stream of build {} failed", cursor.getBuildId(), e);
            emitter.completeWithError(e);
        } finally {
            cursor.close();
        }
    }

    private void sendEnd(BuildEventStream cursor, SseEmitter emitter) {
        try {
            emitter.send(SseEmitter.event().name(END_EVENT).data(""));
            emitter.complete();
        } catch (IOException | IllegalStateException e) {
            log.debug("Could not send end of stream for build {}: {}", cursor.getBuildId(), e.getMessage());
            emitter.completeWithError(e);
        }
    }

    @Override
    public void destroy() {
        pumps.shutdownNow();
    }
}
