package com.flowline.coordinator.api;

import com.flowline.coordinator.api.dto.BuildResponse;
import com.flowline.coordinator.model.Build;
import com.flowline.coordinator.model.BuildResources;
import com.flowline.coordinator.model.Team;
import com.flowline.coordinator.service.BuildService;
import com.flowline.coordinator.service.ResourceLedgerService;
import com.flowline.coordinator.service.TeamService;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * REST API for builds.
 *
 * POST /api/v1/teams/{team}/builds    create a one-off build
 * GET  /api/v1/builds/{id}            current state of a build
 * GET  /api/v1/builds/{id}/events     live event log as server-sent events
 * GET  /api/v1/builds/{id}/resources  inputs and explicit outputs
 * PUT  /api/v1/builds/{id}/abort      abort a pending or running build
 */
@RestController
@RequestMapping("/api/v1")
public class BuildController {

    private final BuildService          buildService;
    private final TeamService           teamService;
    private final ResourceLedgerService ledgerService;
    private final BuildEventStreamer    streamer;

    public BuildController(BuildService buildService,
                           TeamService teamService,
                           ResourceLedgerService ledgerService,
                           BuildEventStreamer streamer) {
        this.buildService  = buildService;
        this.teamService   = teamService;
        this.ledgerService = ledgerService;
        this.streamer      = streamer;
    }

    @PostMapping("/teams/{team}/builds")
    public ResponseEntity<BuildResponse> createOneOff(@PathVariable String team) {
        Team owner = teamService.getByName(team);
        Build build = buildService.createOneOffBuild(owner.getId());
        return ResponseEntity.status(HttpStatus.CREATED).body(BuildResponse.from(build));
    }

    @GetMapping("/builds/{id}")
    public BuildResponse getBuild(@PathVariable long id) {
        return buildService.getBuild(id)
                .map(BuildResponse::from)
                .orElseThrow(() -> new ResponseStatusException(
                        HttpStatus.NOT_FOUND, "Build not found: " + id));
    }

    /**
     * Stream the build's events. A reconnecting EventSource sends the id of
     * the last event it saw in Last-Event-ID and resumes right after it;
     * otherwise {@code from} picks the first event id (default 0).
     *
     * Example:
     *   curl -N http://localhost:8080/api/v1/builds/42/events
     */
    @GetMapping(value = "/builds/{id}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter streamEvents(@PathVariable long id,
                                   @RequestHeader(value = "Last-Event-ID", required = false) Integer lastEventId,
                                   @RequestParam(value = "from", defaultValue = "0") int from) {
        int fromEventId = lastEventId != null ? lastEventId + 1 : from;
        return streamer.stream(id, fromEventId);
    }

    @GetMapping("/builds/{id}/resources")
    public BuildResources getResources(@PathVariable long id) {
        return ledgerService.getResources(id);
    }

    /** 204 on success, 409 when the build already ended. */
    @PutMapping("/builds/{id}/abort")
    public ResponseEntity<Void> abort(@PathVariable long id) {
        buildService.abort(id);
        return ResponseEntity.noContent().build();
    }
}
