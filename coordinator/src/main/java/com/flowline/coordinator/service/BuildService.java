package com.flowline.coordinator.service;

import com.flowline.coordinator.event.ErrorEvent;
import com.flowline.coordinator.event.StatusEvent;
import com.flowline.coordinator.model.Build;
import com.flowline.coordinator.model.BuildStatus;
import com.flowline.coordinator.model.Job;
import com.flowline.coordinator.model.Pipeline;
import com.flowline.coordinator.model.SavedPipelineConfig;
import com.flowline.coordinator.repository.BuildRepository;
import com.flowline.coordinator.repository.JobRepository;
import com.flowline.coordinator.repository.PipelineRepository;
import com.flowline.coordinator.repository.TeamRepository;
import com.flowline.coordinator.stream.BuildEventStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Build creation and the build lifecycle state machine.
 *
 * Every transition is a conditional UPDATE (see BuildRepository) followed by
 * the matching status event append, in one transaction. The UPDATE leaves the
 * build row locked, so the append that follows cannot interleave with another
 * transition on the same build.
 */
@Service
public class BuildService {

    private static final Logger log = LoggerFactory.getLogger(BuildService.class);

    private static final Set<BuildStatus> FINISH_STATUSES =
            EnumSet.of(BuildStatus.SUCCEEDED, BuildStatus.FAILED, BuildStatus.ERRORED);

    private static final List<BuildStatus> FROM_STARTED = List.of(BuildStatus.STARTED);
    private static final List<BuildStatus> FROM_RUNNABLE = List.of(BuildStatus.PENDING, BuildStatus.STARTED);

    private final BuildRepository       buildRepo;
    private final JobRepository         jobRepo;
    private final PipelineRepository    pipelineRepo;
    private final TeamRepository        teamRepo;
    private final BuildEventStore       eventStore;
    private final PipelineConfigService configService;

    public BuildService(BuildRepository buildRepo,
                        JobRepository jobRepo,
                        PipelineRepository pipelineRepo,
                        TeamRepository teamRepo,
                        BuildEventStore eventStore,
                        PipelineConfigService configService) {
        this.buildRepo     = buildRepo;
        this.jobRepo       = jobRepo;
        this.pipelineRepo  = pipelineRepo;
        this.teamRepo      = teamRepo;
        this.eventStore    = eventStore;
        this.configService = configService;
    }

    // ------------------------------------------------------------------
    // Creation and lookup
    // ------------------------------------------------------------------

    /** New PENDING build outside any pipeline, named from the global one-off sequence. */
    @Transactional
    public Build createOneOffBuild(long teamId) {
        if (!teamRepo.existsById(teamId)) {
            throw new TeamNotFoundException(teamId);
        }
        String name = Long.toString(buildRepo.nextOneOffName());
        Build build = buildRepo.save(Build.oneOff(name, teamId));
        log.info("Created one-off build {} (name={}, team={})", build.getId(), name, teamId);
        return build;
    }

    /**
     * New PENDING build of a pipeline job. The job row stays locked until
     * commit, so concurrent creators get consecutive build names.
     */
    @Transactional
    public Build createJobBuild(long pipelineId, String jobName) {
        Pipeline pipeline = pipelineRepo.findById(pipelineId)
                .orElseThrow(() -> new PipelineNotFoundException(pipelineId));
        Job job = jobRepo.findByPipelineIdAndNameForUpdate(pipelineId, jobName)
                .filter(Job::isActive)
                .orElseThrow(() -> new JobNotFoundException(pipelineId, jobName));

        String name = job.nextBuildName();
        Build build = buildRepo.save(Build.forJob(name, pipeline.getTeamId(), pipelineId, job.getId()));
        log.info("Created build {} of job '{}' #{} (pipeline={})", build.getId(), jobName, name, pipelineId);
        return build;
    }

    @Transactional(readOnly = true)
    public Optional<Build> getBuild(long buildId) {
        return buildRepo.findById(buildId);
    }

    /** Config of the build's pipeline at its current version; empty for one-off builds. */
    @Transactional(readOnly = true)
    public Optional<SavedPipelineConfig> getConfig(long buildId) {
        Build build = buildRepo.findById(buildId)
                .orElseThrow(() -> new BuildNotFoundException(buildId));
        if (build.getPipelineId() == null) {
            return Optional.empty();
        }
        return configService.findConfig(build.getPipelineId());
    }

    // ------------------------------------------------------------------
    // Lifecycle
    // ------------------------------------------------------------------

    /**
     * PENDING → STARTED, recording the engine that runs the build.
     *
     * @return true if this call started the build; false if it was no longer
     *         pending (another caller won, or it was aborted first)
     * @throws BuildNotFoundException if the build does not exist
     */
    @Transactional
    public boolean start(long buildId, String engine, String engineMetadata) {
        Instant now = now();
        if (buildRepo.markStarted(buildId, now, engine, engineMetadata) == 0) {
            if (!buildRepo.existsById(buildId)) {
                throw new BuildNotFoundException(buildId);
            }
            log.info("Build {} was not pending, start ignored", buildId);
            return false;
        }
        eventStore.append(buildId, new StatusEvent(BuildStatus.STARTED, now.getEpochSecond()));
        log.info("Build {} started (engine={})", buildId, engine);
        return true;
    }

    /**
     * STARTED → SUCCEEDED, FAILED or ERRORED.
     *
     * @throws IllegalArgumentException  if {@code status} is not one of those three
     * @throws BuildTransitionException  if the build is not running
     */
    @Transactional
    public void finish(long buildId, BuildStatus status) {
        if (!FINISH_STATUSES.contains(status)) {
            throw new IllegalArgumentException("Cannot finish a build as " + status);
        }
        complete(buildId, status, FROM_STARTED, null);
    }

    /** PENDING or STARTED → ABORTED. */
    @Transactional
    public void abort(long buildId) {
        complete(buildId, BuildStatus.ABORTED, FROM_RUNNABLE, null);
    }

    /**
     * PENDING or STARTED → ERRORED, preceded by an error event carrying the
     * cause's message.
     */
    @Transactional
    public void markAsFailed(long buildId, Throwable cause) {
        String message = cause.getMessage() != null ? cause.getMessage() : cause.toString();
        complete(buildId, BuildStatus.ERRORED, FROM_RUNNABLE, new ErrorEvent(message));
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private void complete(long buildId, BuildStatus status, List<BuildStatus> from, ErrorEvent error) {
        Instant now = now();
        if (buildRepo.markCompleted(buildId, status, now, from) == 0) {
            BuildStatus current = buildRepo.findStatusById(buildId)
                    .orElseThrow(() -> new BuildNotFoundException(buildId));
            throw new BuildTransitionException(buildId, current, status);
        }
        if (error != null) {
            eventStore.append(buildId, error);
        }
        eventStore.append(buildId, new StatusEvent(status, now.getEpochSecond()));

        if (status == BuildStatus.SUCCEEDED) {
            log.info("Build {} {}", buildId, status);
        } else {
            log.warn("Build {} {}{}", buildId, status, error != null ? ": " + error.message() : "");
        }
    }

    // Postgres keeps microseconds; truncating keeps the stored and returned times equal.
    private static Instant now() {
        return Instant.now().truncatedTo(ChronoUnit.MICROS);
    }
}
