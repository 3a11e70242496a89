package com.flowline.coordinator.api;

import com.flowline.coordinator.model.PipelineConfig;
import com.flowline.coordinator.model.PipelineConfig.JobConfig;
import com.flowline.coordinator.model.PipelinePauseState;
import com.flowline.coordinator.model.SaveConfigResult;
import com.flowline.coordinator.model.SavedPipelineConfig;
import com.flowline.coordinator.model.Team;
import com.flowline.coordinator.service.ConfigVersionConflictException;
import com.flowline.coordinator.service.PipelineConfigService;
import com.flowline.coordinator.service.PipelineNotFoundException;
import com.flowline.coordinator.service.TeamService;
import com.flowline.coordinator.support.TestEntities;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(PipelineController.class)
class PipelineControllerTest {

    static final String CONFIG_JSON = """
            {"jobs":[{"name":"unit"}],"resources":[{"name":"repo","type":"git"}]}
            """;

    @Autowired MockMvc mockMvc;

    @MockitoBean PipelineConfigService configService;
    @MockitoBean TeamService           teamService;

    @BeforeEach
    void setUp() {
        when(teamService.getByName("main")).thenReturn(TestEntities.set(new Team("main"), "id", 1L));
    }

    @Test
    void getConfig_returnsConfigWithVersionHeader() throws Exception {
        when(configService.getConfig(1L, "ci")).thenReturn(new SavedPipelineConfig(
                new PipelineConfig(List.of(new JobConfig("unit")), List.of()), 3L, true));

        mockMvc.perform(get("/api/v1/teams/main/pipelines/ci/config"))
                .andExpect(status().isOk())
                .andExpect(header().string("X-Config-Version", "3"))
                .andExpect(jsonPath("$.config.jobs[0].name").value("unit"))
                .andExpect(jsonPath("$.paused").value(true));
    }

    @Test
    void getConfig_unknownPipeline_returns404() throws Exception {
        when(configService.getConfig(1L, "nope")).thenThrow(new PipelineNotFoundException(1L, "nope"));

        mockMvc.perform(get("/api/v1/teams/main/pipelines/nope/config"))
                .andExpect(status().isNotFound());
    }

    @Test
    void saveConfig_newPipeline_returns201() throws Exception {
        when(configService.saveConfig(eq(1L), eq("ci"), any(PipelineConfig.class), eq(0L), eq(PipelinePauseState.PAUSED)))
                .thenReturn(new SaveConfigResult(TestEntities.pipeline(10L, 1L, "ci", 1L, true, CONFIG_JSON), true));

        mockMvc.perform(put("/api/v1/teams/main/pipelines/ci/config")
                        .header("X-Config-Version", "0")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(CONFIG_JSON))
                .andExpect(status().isCreated())
                .andExpect(header().string("X-Config-Version", "1"))
                .andExpect(jsonPath("$.created").value(true));
    }

    @Test
    void saveConfig_existingPipeline_returns200WithNewVersion() throws Exception {
        when(configService.saveConfig(eq(1L), eq("ci"), any(PipelineConfig.class), eq(3L), eq(PipelinePauseState.UNPAUSED)))
                .thenReturn(new SaveConfigResult(TestEntities.pipeline(10L, 1L, "ci", 4L, false, CONFIG_JSON), false));

        mockMvc.perform(put("/api/v1/teams/main/pipelines/ci/config")
                        .param("paused", "false")
                        .header("X-Config-Version", "3")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(CONFIG_JSON))
                .andExpect(status().isOk())
                .andExpect(header().string("X-Config-Version", "4"))
                .andExpect(jsonPath("$.version").value(4));
    }

    @Test
    void saveConfig_staleVersion_returns409() throws Exception {
        when(configService.saveConfig(eq(1L), eq("ci"), any(PipelineConfig.class), eq(2L), any()))
                .thenThrow(new ConfigVersionConflictException(1L, "ci", 2L, 5L));

        mockMvc.perform(put("/api/v1/teams/main/pipelines/ci/config")
                        .header("X-Config-Version", "2")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(CONFIG_JSON))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.expectedVersion").value(2))
                .andExpect(jsonPath("$.actualVersion").value(5));
    }

    @Test
    void saveConfig_missingVersionHeader_returns400() throws Exception {
        mockMvc.perform(put("/api/v1/teams/main/pipelines/ci/config")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(CONFIG_JSON))
                .andExpect(status().isBadRequest());
        verify(configService, never()).saveConfig(anyLong(), any(), any(), anyLong(), any());
    }

    @Test
    void saveConfig_jobWithoutName_returns400() throws Exception {
        when(configService.saveConfig(eq(1L), eq("ci"), any(PipelineConfig.class), eq(1L), any()))
                .thenThrow(new IllegalArgumentException("Job #1 of pipeline 'ci' has no name"));

        mockMvc.perform(put("/api/v1/teams/main/pipelines/ci/config")
                        .header("X-Config-Version", "1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"jobs\":[{\"name\":\"\"}]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail").value("Job #1 of pipeline 'ci' has no name"));
    }

    @Test
    void pauseAndUnpause_return204() throws Exception {
        mockMvc.perform(put("/api/v1/teams/main/pipelines/ci/pause"))
                .andExpect(status().isNoContent());
        mockMvc.perform(put("/api/v1/teams/main/pipelines/ci/unpause"))
                .andExpect(status().isNoContent());

        verify(configService).pause(1L, "ci");
        verify(configService).unpause(1L, "ci");
    }
}
