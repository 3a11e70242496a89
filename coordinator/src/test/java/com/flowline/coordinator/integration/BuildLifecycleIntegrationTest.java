package com.flowline.coordinator.integration;

import com.flowline.coordinator.event.ErrorEvent;
import com.flowline.coordinator.event.StatusEvent;
import com.flowline.coordinator.event.StoredBuildEvent;
import com.flowline.coordinator.model.Build;
import com.flowline.coordinator.model.BuildStatus;
import com.flowline.coordinator.model.PipelineConfig;
import com.flowline.coordinator.model.PipelineConfig.JobConfig;
import com.flowline.coordinator.model.PipelinePauseState;
import com.flowline.coordinator.service.BuildService;
import com.flowline.coordinator.service.BuildTransitionException;
import com.flowline.coordinator.service.JobNotFoundException;
import com.flowline.coordinator.service.PipelineConfigService;
import com.flowline.coordinator.stream.BuildEventStore;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BuildLifecycleIntegrationTest extends PostgresIntegrationTest {

    @Autowired BuildService          buildService;
    @Autowired BuildEventStore       eventStore;
    @Autowired PipelineConfigService configService;

    @Test
    void oneOffBuilds_areNamedFromSharedSequence() {
        Build first  = buildService.createOneOffBuild(MAIN_TEAM_ID);
        Build second = buildService.createOneOffBuild(MAIN_TEAM_ID);

        assertThat(first.getName()).isEqualTo("1");
        assertThat(second.getName()).isEqualTo("2");
        assertThat(first.getStatus()).isEqualTo(BuildStatus.PENDING);
        assertThat(buildService.getConfig(first.getId())).isEmpty();
    }

    @Test
    void concurrentStarts_haveExactlyOneWinner() throws Exception {
        long id = buildService.createOneOffBuild(MAIN_TEAM_ID).getId();
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Callable<Boolean>> starts = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                String engine = "engine-" + i;
                starts.add(() -> buildService.start(id, engine, null));
            }
            int winners = 0;
            for (Future<Boolean> f : pool.invokeAll(starts, 30, TimeUnit.SECONDS)) {
                if (f.get()) {
                    winners++;
                }
            }
            assertThat(winners).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }

        List<StoredBuildEvent> events = eventStore.readFrom(id, 0);
        assertThat(events).hasSize(1);
        assertThat(events.get(0).event()).isInstanceOf(StatusEvent.class);
        assertThat(buildService.getBuild(id).orElseThrow().getStatus()).isEqualTo(BuildStatus.STARTED);
    }

    @Test
    void finish_recordsEndTimeAndCompletes() {
        long id = buildService.createOneOffBuild(MAIN_TEAM_ID).getId();
        buildService.start(id, "k8s", "{\"pod\":\"b-1\"}");

        buildService.finish(id, BuildStatus.FAILED);

        Build build = buildService.getBuild(id).orElseThrow();
        assertThat(build.getStatus()).isEqualTo(BuildStatus.FAILED);
        assertThat(build.isCompleted()).isTrue();
        assertThat(build.getEngine()).isEqualTo("k8s");
        assertThat(build.getEngineMetadata()).isEqualTo("{\"pod\":\"b-1\"}");
        assertThat(eventStore.readFrom(id, 0)).extracting(StoredBuildEvent::event).containsExactly(
                new StatusEvent(BuildStatus.STARTED, build.getStartTime().getEpochSecond()),
                new StatusEvent(BuildStatus.FAILED, build.getEndTime().getEpochSecond()));
    }

    @Test
    void finish_pendingBuild_isRejectedWithoutSideEffects() {
        long id = buildService.createOneOffBuild(MAIN_TEAM_ID).getId();

        assertThatThrownBy(() -> buildService.finish(id, BuildStatus.SUCCEEDED))
                .isInstanceOf(BuildTransitionException.class);

        Build build = buildService.getBuild(id).orElseThrow();
        assertThat(build.getStatus()).isEqualTo(BuildStatus.PENDING);
        assertThat(build.isCompleted()).isFalse();
        assertThat(eventStore.readFrom(id, 0)).isEmpty();
    }

    @Test
    void markAsFailed_appendsErrorAndErroredStatus() {
        long id = buildService.createOneOffBuild(MAIN_TEAM_ID).getId();
        buildService.start(id, "k8s", null);

        buildService.markAsFailed(id, new IllegalStateException("worker lost"));

        Build build = buildService.getBuild(id).orElseThrow();
        assertThat(build.getStatus()).isEqualTo(BuildStatus.ERRORED);
        assertThat(eventStore.readFrom(id, 0)).extracting(StoredBuildEvent::event).containsExactly(
                new StatusEvent(BuildStatus.STARTED, build.getStartTime().getEpochSecond()),
                new ErrorEvent("worker lost"),
                new StatusEvent(BuildStatus.ERRORED, build.getEndTime().getEpochSecond()));
    }

    @Test
    void terminalStatus_isAbsorbing() {
        long id = buildService.createOneOffBuild(MAIN_TEAM_ID).getId();
        buildService.abort(id);

        assertThat(buildService.start(id, "k8s", null)).isFalse();
        assertThatThrownBy(() -> buildService.abort(id)).isInstanceOf(BuildTransitionException.class);
        assertThatThrownBy(() -> buildService.markAsFailed(id, new RuntimeException("late")))
                .isInstanceOf(BuildTransitionException.class);

        assertThat(buildService.getBuild(id).orElseThrow().getStatus()).isEqualTo(BuildStatus.ABORTED);
        assertThat(eventStore.readFrom(id, 0)).hasSize(1);
    }

    @Test
    void jobBuilds_areNumberedPerJob() {
        long pipelineId = configService.saveConfig(MAIN_TEAM_ID, "ci",
                new PipelineConfig(List.of(new JobConfig("unit"), new JobConfig("deploy")), List.of()),
                0L, PipelinePauseState.UNPAUSED).pipeline().getId();

        Build unit1   = buildService.createJobBuild(pipelineId, "unit");
        Build unit2   = buildService.createJobBuild(pipelineId, "unit");
        Build deploy1 = buildService.createJobBuild(pipelineId, "deploy");

        assertThat(unit1.getName()).isEqualTo("1");
        assertThat(unit2.getName()).isEqualTo("2");
        assertThat(deploy1.getName()).isEqualTo("1");
        assertThat(buildService.getConfig(unit1.getId()).orElseThrow().config().jobNames())
                .containsExactly("unit", "deploy");
        assertThatThrownBy(() -> buildService.createJobBuild(pipelineId, "missing"))
                .isInstanceOf(JobNotFoundException.class);
    }
}
