package com.flowline.coordinator.model;

import jakarta.persistence.*;
import org.hibernate.annotations.DynamicUpdate;

import java.time.Instant;

/**
 * One execution of a job, or a standalone one-off run.
 *
 * Status only ever moves forward (see {@link BuildStatus}); every status change
 * goes through a conditional UPDATE in {@code BuildRepository} and is committed
 * together with the matching status event.
 *
 * DB table: builds  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "builds")
@DynamicUpdate
public class Build {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    // Job build number, or the one-off sequence value for builds without a job.
    @Column(nullable = false)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private BuildStatus status = BuildStatus.PENDING;

    @Column(name = "team_id", nullable = false)
    private Long teamId;

    // Both null for one-off builds.
    @Column(name = "pipeline_id")
    private Long pipelineId;

    @Column(name = "job_id")
    private Long jobId;

    // Engine bookkeeping written by start().
    @Column(name = "engine")
    private String engine;

    @Column(name = "engine_metadata", columnDefinition = "TEXT")
    private String engineMetadata;

    @Column(name = "start_time")
    private Instant startTime;

    @Column(name = "end_time")
    private Instant endTime;

    // Owned by the external reaper.
    @Column(name = "reap_time")
    private Instant reapTime;

    // True once a terminal status is committed; cursors use it to detect end of stream.
    @Column(nullable = false)
    private boolean completed = false;

    // Event id handed to the next appended event. Only advanced under a row lock.
    @Column(name = "next_event_id", nullable = false)
    private int nextEventId = 0;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected Build() {}   // required by JPA

    private Build(String name, Long teamId, Long pipelineId, Long jobId) {
        this.name       = name;
        this.teamId     = teamId;
        this.pipelineId = pipelineId;
        this.jobId      = jobId;
    }

    public static Build oneOff(String name, Long teamId) {
        return new Build(name, teamId, null, null);
    }

    public static Build forJob(String name, Long teamId, Long pipelineId, Long jobId) {
        return new Build(name, teamId, pipelineId, jobId);
    }

    // ------------------------------------------------------------------
    // Getters
    // ------------------------------------------------------------------

    public Long        getId()             { return id; }
    public String      getName()           { return name; }
    public BuildStatus getStatus()         { return status; }
    public Long        getTeamId()         { return teamId; }
    public Long        getPipelineId()     { return pipelineId; }
    public Long        getJobId()          { return jobId; }
    public String      getEngine()         { return engine; }
    public String      getEngineMetadata() { return engineMetadata; }
    public Instant     getStartTime()      { return startTime; }
    public Instant     getEndTime()        { return endTime; }
    public Instant     getReapTime()       { return reapTime; }
    public boolean     isCompleted()       { return completed; }
    public int         getNextEventId()    { return nextEventId; }
    public Instant     getCreatedAt()      { return createdAt; }

    public boolean isOneOff() {
        return jobId == null;
    }

    /**
     * Hands out the next event id and advances the counter.
     * Callers must hold the row lock ({@code BuildRepository.findByIdForUpdate}).
     */
    public int claimNextEventId() {
        return nextEventId++;
    }
}
