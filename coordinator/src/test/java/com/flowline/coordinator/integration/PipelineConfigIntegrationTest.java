package com.flowline.coordinator.integration;

import com.flowline.coordinator.model.PipelineConfig;
import com.flowline.coordinator.model.PipelineConfig.JobConfig;
import com.flowline.coordinator.model.PipelineConfig.ResourceConfig;
import com.flowline.coordinator.model.PipelinePauseState;
import com.flowline.coordinator.model.SaveConfigResult;
import com.flowline.coordinator.model.SavedPipelineConfig;
import com.flowline.coordinator.service.ConfigVersionConflictException;
import com.flowline.coordinator.service.PipelineConfigService;
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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PipelineConfigIntegrationTest extends PostgresIntegrationTest {

    static final PipelineConfig V1 = new PipelineConfig(
            List.of(new JobConfig("unit"), new JobConfig("deploy")),
            List.of(new ResourceConfig("repo", "git")));

    static final PipelineConfig V2 = new PipelineConfig(
            List.of(new JobConfig("unit")),
            List.of(new ResourceConfig("repo", "git")));

    @Autowired PipelineConfigService configService;

    @Test
    void freshPipeline_isCreatedAtVersionOneWhateverTheExpectedVersion() {
        SaveConfigResult result = configService.saveConfig(MAIN_TEAM_ID, "ci", V1, 42L, PipelinePauseState.PAUSED);

        assertThat(result.created()).isTrue();
        assertThat(result.pipeline().getVersion()).isEqualTo(1L);
        assertThat(result.pipeline().isPaused()).isTrue();
        assertThat(configService.getConfig(MAIN_TEAM_ID, "ci").config()).isEqualTo(V1);
    }

    @Test
    void matchingVersion_incrementsByOneAndKeepsPausedState() {
        configService.saveConfig(MAIN_TEAM_ID, "ci", V1, 0L, PipelinePauseState.PAUSED);

        SaveConfigResult result = configService.saveConfig(MAIN_TEAM_ID, "ci", V2, 1L, PipelinePauseState.UNPAUSED);

        assertThat(result.created()).isFalse();
        SavedPipelineConfig saved = configService.getConfig(MAIN_TEAM_ID, "ci");
        assertThat(saved.version()).isEqualTo(2L);
        assertThat(saved.paused()).isTrue();
        assertThat(saved.config()).isEqualTo(V2);
    }

    @Test
    void staleVersion_conflictsAndChangesNothing() {
        configService.saveConfig(MAIN_TEAM_ID, "ci", V1, 0L, PipelinePauseState.PAUSED);
        configService.saveConfig(MAIN_TEAM_ID, "ci", V1, 1L, PipelinePauseState.PAUSED);

        assertThatThrownBy(() -> configService.saveConfig(MAIN_TEAM_ID, "ci", V2, 1L, PipelinePauseState.PAUSED))
                .isInstanceOf(ConfigVersionConflictException.class)
                .hasMessageContaining("version 2");

        SavedPipelineConfig saved = configService.getConfig(MAIN_TEAM_ID, "ci");
        assertThat(saved.version()).isEqualTo(2L);
        assertThat(saved.config()).isEqualTo(V1);
        assertThat(activeJobs()).containsExactly("deploy", "unit");
    }

    @Test
    void concurrentSaversWithSameVersion_exactlyOneWins() throws Exception {
        configService.saveConfig(MAIN_TEAM_ID, "ci", V1, 0L, PipelinePauseState.PAUSED);

        ExecutorService pool = Executors.newFixedThreadPool(6);
        int wins = 0;
        int conflicts = 0;
        try {
            List<Callable<SaveConfigResult>> savers = new ArrayList<>();
            for (int i = 0; i < 6; i++) {
                savers.add(() -> configService.saveConfig(MAIN_TEAM_ID, "ci", V2, 1L, PipelinePauseState.PAUSED));
            }
            for (Future<SaveConfigResult> f : pool.invokeAll(savers, 30, TimeUnit.SECONDS)) {
                try {
                    f.get();
                    wins++;
                } catch (ExecutionException e) {
                    assertThat(e.getCause()).isInstanceOf(ConfigVersionConflictException.class);
                    conflicts++;
                }
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(wins).isEqualTo(1);
        assertThat(conflicts).isEqualTo(5);
        assertThat(configService.getConfig(MAIN_TEAM_ID, "ci").version()).isEqualTo(2L);
    }

    @Test
    void save_synchronisesJobRows() {
        configService.saveConfig(MAIN_TEAM_ID, "ci", V1, 0L, PipelinePauseState.PAUSED);
        assertThat(activeJobs()).containsExactly("deploy", "unit");

        configService.saveConfig(MAIN_TEAM_ID, "ci", V2, 1L, PipelinePauseState.PAUSED);
        assertThat(activeJobs()).containsExactly("unit");

        configService.saveConfig(MAIN_TEAM_ID, "ci", V1, 2L, PipelinePauseState.PAUSED);
        assertThat(activeJobs()).containsExactly("deploy", "unit");
        assertThat(jdbcTemplate.queryForObject("SELECT count(*) FROM jobs", Integer.class)).isEqualTo(2);
    }

    @Test
    void pauseAndUnpause_flipOnlyThePausedFlag() {
        configService.saveConfig(MAIN_TEAM_ID, "ci", V1, 0L, PipelinePauseState.UNPAUSED);

        configService.pause(MAIN_TEAM_ID, "ci");
        assertThat(configService.getConfig(MAIN_TEAM_ID, "ci").paused()).isTrue();

        configService.unpause(MAIN_TEAM_ID, "ci");
        SavedPipelineConfig saved = configService.getConfig(MAIN_TEAM_ID, "ci");
        assertThat(saved.paused()).isFalse();
        assertThat(saved.version()).isEqualTo(1L);
    }

    private List<String> activeJobs() {
        return jdbcTemplate.queryForList(
                "SELECT name FROM jobs WHERE active ORDER BY name", String.class);
    }
}
