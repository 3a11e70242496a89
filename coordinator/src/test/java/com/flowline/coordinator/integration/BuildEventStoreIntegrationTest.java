package com.flowline.coordinator.integration;

import com.flowline.coordinator.event.BuildEvent;
import com.flowline.coordinator.event.LogEvent;
import com.flowline.coordinator.event.StatusEvent;
import com.flowline.coordinator.event.StoredBuildEvent;
import com.flowline.coordinator.model.Build;
import com.flowline.coordinator.model.BuildStatus;
import com.flowline.coordinator.service.BuildNotFoundException;
import com.flowline.coordinator.service.BuildService;
import com.flowline.coordinator.stream.BuildEventStore;
import com.flowline.coordinator.stream.BuildEventStream;
import com.flowline.coordinator.stream.BuildEventStreamClosedException;
import com.flowline.coordinator.stream.EndOfBuildEventStreamException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BuildEventStoreIntegrationTest extends PostgresIntegrationTest {

    @Autowired BuildEventStore eventStore;
    @Autowired BuildService    buildService;

    ExecutorService pool;
    long buildId;

    @BeforeEach
    void setUp() {
        pool = Executors.newFixedThreadPool(8);
        buildId = buildService.createOneOffBuild(MAIN_TEAM_ID).getId();
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    @Test
    void concurrentAppends_getGaplessUniqueIds() throws Exception {
        List<Callable<Integer>> appends = IntStream.range(0, 200)
                .<Callable<Integer>>mapToObj(i -> () -> eventStore.append(buildId, new LogEvent("line " + i)))
                .toList();

        List<Integer> ids = new ArrayList<>();
        for (Future<Integer> f : pool.invokeAll(appends, 60, TimeUnit.SECONDS)) {
            ids.add(f.get());
        }

        assertThat(ids).containsExactlyInAnyOrderElementsOf(IntStream.range(0, 200).boxed().toList());
        List<Integer> stored = jdbcTemplate.queryForList(
                "SELECT event_id FROM build_events WHERE build_id = ? ORDER BY event_id", Integer.class, buildId);
        assertThat(stored).containsExactlyElementsOf(IntStream.range(0, 200).boxed().toList());
    }

    @Test
    void cursorFromStart_deliversEachAppendAsItCommits() throws Exception {
        try (BuildEventStream stream = eventStore.subscribe(buildId, 0)) {
            Future<BuildEvent> first = pool.submit(stream::next);
            Thread.sleep(200);
            assertThat(first).isNotDone();

            eventStore.append(buildId, new LogEvent("some "));
            assertThat(first.get(5, TimeUnit.SECONDS)).isEqualTo(new LogEvent("some "));

            eventStore.append(buildId, new LogEvent("log"));
            assertThat(pool.submit(stream::next).get(5, TimeUnit.SECONDS)).isEqualTo(new LogEvent("log"));

            eventStore.append(buildId, new LogEvent("log 2"));
            assertThat(pool.submit(stream::next).get(5, TimeUnit.SECONDS)).isEqualTo(new LogEvent("log 2"));
        }
    }

    @Test
    void cursorFromOffset_skipsEarlierEvents() {
        eventStore.append(buildId, new LogEvent("some "));
        eventStore.append(buildId, new LogEvent("log"));
        eventStore.append(buildId, new LogEvent("log 2"));
        buildService.abort(buildId);

        try (BuildEventStream stream = eventStore.subscribe(buildId, 1)) {
            assertThat(stream.next()).isEqualTo(new LogEvent("log"));
            assertThat(stream.next()).isEqualTo(new LogEvent("log 2"));
            assertThat(stream.next()).isInstanceOf(StatusEvent.class);
            assertThatThrownBy(stream::next).isInstanceOf(EndOfBuildEventStreamException.class);
        }
    }

    @Test
    void finishedBuild_endsStreamAfterFinalStatus() throws Exception {
        buildService.start(buildId, "test-engine", null);

        try (BuildEventStream stream = eventStore.subscribe(buildId, 0)) {
            assertThat(stream.next()).isEqualTo(new StatusEvent(BuildStatus.STARTED, startTimeOf(buildId)));

            Future<StoredBuildEvent> waiting = pool.submit(stream::nextStored);
            Thread.sleep(100);
            buildService.finish(buildId, BuildStatus.SUCCEEDED);

            StoredBuildEvent last = waiting.get(5, TimeUnit.SECONDS);
            Build finished = buildService.getBuild(buildId).orElseThrow();
            assertThat(last.eventId()).isEqualTo(1);
            assertThat(last.event()).isEqualTo(
                    new StatusEvent(BuildStatus.SUCCEEDED, finished.getEndTime().getEpochSecond()));
            assertThatThrownBy(stream::next).isInstanceOf(EndOfBuildEventStreamException.class);
            assertThat(stream.isClosed()).isFalse();
        }
    }

    @Test
    void closingCursor_releasesBlockedReader() throws Exception {
        BuildEventStream stream = eventStore.subscribe(buildId, 0);
        Future<BuildEvent> blocked = pool.submit(stream::next);
        Thread.sleep(200);

        stream.close();

        assertThatThrownBy(() -> blocked.get(5, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(BuildEventStreamClosedException.class);
        assertThatThrownBy(stream::next).isInstanceOf(BuildEventStreamClosedException.class);
    }

    @Test
    void unknownBuild_cannotBeAppendedToOrSubscribed() {
        assertThatThrownBy(() -> eventStore.append(9999L, new LogEvent("x")))
                .isInstanceOf(BuildNotFoundException.class);
        assertThatThrownBy(() -> eventStore.subscribe(9999L, 0))
                .isInstanceOf(BuildNotFoundException.class);
    }

    private long startTimeOf(long id) {
        return buildService.getBuild(id).orElseThrow().getStartTime().getEpochSecond();
    }
}
