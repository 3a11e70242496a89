package com.flowline.coordinator.api;

import com.flowline.coordinator.api.dto.PipelineConfigResponse;
import com.flowline.coordinator.api.dto.SaveConfigResponse;
import com.flowline.coordinator.model.PipelineConfig;
import com.flowline.coordinator.model.PipelinePauseState;
import com.flowline.coordinator.model.SaveConfigResult;
import com.flowline.coordinator.model.SavedPipelineConfig;
import com.flowline.coordinator.service.PipelineConfigService;
import com.flowline.coordinator.service.TeamService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST API for pipeline configs.
 *
 * The config version travels in the X-Config-Version header: GET returns the
 * current one, PUT must send back the one it edited. A stale version is
 * answered with 409 and the editor has to re-read before saving again.
 */
@RestController
@RequestMapping("/api/v1/teams/{team}/pipelines/{name}")
public class PipelineController {

    static final String CONFIG_VERSION_HEADER = "X-Config-Version";

    private final PipelineConfigService configService;
    private final TeamService           teamService;

    public PipelineController(PipelineConfigService configService, TeamService teamService) {
        this.configService = configService;
        this.teamService   = teamService;
    }

    @GetMapping("/config")
    public ResponseEntity<PipelineConfigResponse> getConfig(@PathVariable String team, @PathVariable String name) {
        SavedPipelineConfig saved = configService.getConfig(teamId(team), name);
        return ResponseEntity.ok()
                .header(CONFIG_VERSION_HEADER, Long.toString(saved.version()))
                .body(PipelineConfigResponse.from(saved));
    }

    /**
     * Save a config. New pipelines start paused unless {@code paused=false}
     * is passed; existing pipelines keep their paused state.
     *
     * HTTP 201: pipeline created
     * HTTP 200: pipeline updated
     * HTTP 409: X-Config-Version is stale
     * HTTP 400: X-Config-Version missing
     */
    @PutMapping("/config")
    public ResponseEntity<SaveConfigResponse> saveConfig(@PathVariable String team,
                                                         @PathVariable String name,
                                                         @RequestHeader(CONFIG_VERSION_HEADER) long expectedVersion,
                                                         @RequestParam(value = "paused", defaultValue = "true") boolean paused,
                                                         @RequestBody PipelineConfig config) {
        SaveConfigResult result = configService.saveConfig(teamId(team), name, config, expectedVersion,
                paused ? PipelinePauseState.PAUSED : PipelinePauseState.UNPAUSED);
        return ResponseEntity.status(result.created() ? HttpStatus.CREATED : HttpStatus.OK)
                .header(CONFIG_VERSION_HEADER, Long.toString(result.pipeline().getVersion()))
                .body(SaveConfigResponse.from(result));
    }

    @PutMapping("/pause")
    public ResponseEntity<Void> pause(@PathVariable String team, @PathVariable String name) {
        configService.pause(teamId(team), name);
        return ResponseEntity.noContent().build();
    }

    @PutMapping("/unpause")
    public ResponseEntity<Void> unpause(@PathVariable String team, @PathVariable String name) {
        configService.unpause(teamId(team), name);
        return ResponseEntity.noContent().build();
    }

    private long teamId(String team) {
        return teamService.getByName(team).getId();
    }
}
