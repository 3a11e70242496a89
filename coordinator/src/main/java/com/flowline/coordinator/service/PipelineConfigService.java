package com.flowline.coordinator.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flowline.coordinator.model.Pipeline;
import com.flowline.coordinator.model.PipelineConfig;
import com.flowline.coordinator.model.PipelinePauseState;
import com.flowline.coordinator.model.SaveConfigResult;
import com.flowline.coordinator.model.SavedPipelineConfig;
import com.flowline.coordinator.repository.JobRepository;
import com.flowline.coordinator.repository.PipelineRepository;
import com.flowline.coordinator.repository.TeamRepository;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;

/**
 * Pipeline configs with optimistic concurrency.
 *
 * An editor reads a config together with its version and sends that version
 * back when saving. The save is a compare-and-set in the database, so of two
 * editors starting from the same version exactly one succeeds; the other gets
 * a {@link ConfigVersionConflictException} and nothing is written.
 */
@Service
public class PipelineConfigService {

    private static final Logger log = LoggerFactory.getLogger(PipelineConfigService.class);

    private final PipelineRepository pipelineRepo;
    private final JobRepository      jobRepo;
    private final TeamRepository     teamRepo;
    private final ObjectMapper       objectMapper;
    private final MeterRegistry      meterRegistry;

    public PipelineConfigService(PipelineRepository pipelineRepo,
                                 JobRepository jobRepo,
                                 TeamRepository teamRepo,
                                 ObjectMapper objectMapper,
                                 MeterRegistry meterRegistry) {
        this.pipelineRepo  = pipelineRepo;
        this.jobRepo       = jobRepo;
        this.teamRepo      = teamRepo;
        this.objectMapper  = objectMapper;
        this.meterRegistry = meterRegistry;
    }

    // ------------------------------------------------------------------
    // Saving
    // ------------------------------------------------------------------

    /**
     * Create or update a pipeline's config.
     *
     * A pipeline that does not exist yet is created at version 1 with the
     * given paused state, whatever {@code expectedVersion} says. An existing
     * one is updated only if its version equals {@code expectedVersion}; its
     * paused state is left alone. The job rows are brought in line with the
     * config in the same transaction.
     *
     * @throws ConfigVersionConflictException if the stored version moved on
     * @throws TeamNotFoundException          if the team does not exist
     * @throws IllegalArgumentException       if a job has no name
     */
    @Transactional
    public SaveConfigResult saveConfig(long teamId,
                                       String pipelineName,
                                       PipelineConfig config,
                                       long expectedVersion,
                                       PipelinePauseState initialPausedState) {
        requireJobNames(pipelineName, config);
        if (!teamRepo.existsById(teamId)) {
            throw new TeamNotFoundException(teamId);
        }
        String document = write(config);
        Instant now = now();

        boolean created = pipelineRepo.insertIfAbsent(
                teamId, pipelineName, document, initialPausedState.isPaused(), now) == 1;
        if (!created
                && pipelineRepo.updateConfigIfVersion(teamId, pipelineName, document, expectedVersion, now) == 0) {
            long actual = pipelineRepo.findByTeamIdAndName(teamId, pipelineName)
                    .map(Pipeline::getVersion)
                    .orElseThrow(() -> new PipelineNotFoundException(teamId, pipelineName));
            meterRegistry.counter("flowline.pipeline.config.conflicts").increment();
            log.info("Config conflict on pipeline '{}' (team {}): expected version {}, found {}",
                    pipelineName, teamId, expectedVersion, actual);
            throw new ConfigVersionConflictException(teamId, pipelineName, expectedVersion, actual);
        }

        Pipeline pipeline = pipelineRepo.findByTeamIdAndName(teamId, pipelineName)
                .orElseThrow(() -> new PipelineNotFoundException(teamId, pipelineName));
        syncJobs(pipeline.getId(), config.jobNames());

        log.info("{} pipeline '{}' (team {}) at version {}",
                created ? "Created" : "Updated", pipelineName, teamId, pipeline.getVersion());
        return new SaveConfigResult(pipeline, created);
    }

    // ------------------------------------------------------------------
    // Reading
    // ------------------------------------------------------------------

    @Transactional(readOnly = true)
    public Pipeline getPipeline(long teamId, String pipelineName) {
        if (!teamRepo.existsById(teamId)) {
            throw new TeamNotFoundException(teamId);
        }
        return pipelineRepo.findByTeamIdAndName(teamId, pipelineName)
                .orElseThrow(() -> new PipelineNotFoundException(teamId, pipelineName));
    }

    /** Current config and the version to send back with the next save. */
    @Transactional(readOnly = true)
    public SavedPipelineConfig getConfig(long teamId, String pipelineName) {
        return toSaved(getPipeline(teamId, pipelineName));
    }

    @Transactional(readOnly = true)
    public Optional<SavedPipelineConfig> findConfig(long pipelineId) {
        return pipelineRepo.findById(pipelineId).map(this::toSaved);
    }

    // ------------------------------------------------------------------
    // Pausing
    // ------------------------------------------------------------------

    @Transactional
    public void pause(long teamId, String pipelineName) {
        setPaused(teamId, pipelineName, PipelinePauseState.PAUSED);
    }

    @Transactional
    public void unpause(long teamId, String pipelineName) {
        setPaused(teamId, pipelineName, PipelinePauseState.UNPAUSED);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private void setPaused(long teamId, String pipelineName, PipelinePauseState state) {
        Pipeline pipeline = getPipeline(teamId, pipelineName);
        pipelineRepo.updatePaused(pipeline.getId(), state.isPaused(), now());
        log.info("Pipeline '{}' (team {}) {}", pipelineName, teamId, state);
    }

    private static void requireJobNames(String pipelineName, PipelineConfig config) {
        for (int i = 0; i < config.jobs().size(); i++) {
            String name = config.jobs().get(i).name();
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException(
                        "Job #" + (i + 1) + " of pipeline '" + pipelineName + "' has no name");
            }
        }
    }

    private void syncJobs(Long pipelineId, List<String> jobNames) {
        jobNames.forEach(name -> jobRepo.upsertActive(pipelineId, name));
        if (jobNames.isEmpty()) {
            jobRepo.deactivateAll(pipelineId);
        } else {
            jobRepo.deactivateAllExcept(pipelineId, jobNames);
        }
    }

    private SavedPipelineConfig toSaved(Pipeline pipeline) {
        return new SavedPipelineConfig(read(pipeline), pipeline.getVersion(), pipeline.isPaused());
    }

    private String write(PipelineConfig config) {
        try {
            return objectMapper.writeValueAsString(config);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Pipeline config cannot be serialized to JSON", e);
        }
    }

    private PipelineConfig read(Pipeline pipeline) {
        try {
            return objectMapper.readValue(pipeline.getConfig(), PipelineConfig.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored config of pipeline " + pipeline.getId() + " is not valid JSON", e);
        }
    }

    private static Instant now() {
        return Instant.now().truncatedTo(ChronoUnit.MICROS);
    }
}
