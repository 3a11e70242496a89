package com.flowline.coordinator.model;

import jakarta.persistence.*;
import org.hibernate.annotations.DynamicUpdate;

/**
 * A job declared in a pipeline config.
 *
 * Rows are created and (de)activated whenever the pipeline config is saved.
 * {@code buildNumberSeq} names the job's builds "1", "2", ... and is only
 * advanced while the row is locked (JobRepository.findByPipelineIdAndNameForUpdate).
 *
 * DB table: jobs  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "jobs")
@DynamicUpdate
public class Job {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "pipeline_id", nullable = false)
    private Long pipelineId;

    @Column(nullable = false)
    private String name;

    @Column(name = "build_number_seq", nullable = false)
    private int buildNumberSeq = 0;

    // False once the job disappears from the pipeline config.
    @Column(nullable = false)
    private boolean active = true;

    protected Job() {}   // required by JPA

    public Job(Long pipelineId, String name) {
        this.pipelineId = pipelineId;
        this.name       = name;
    }

    public Long    getId()             { return id; }
    public Long    getPipelineId()     { return pipelineId; }
    public String  getName()           { return name; }
    public int     getBuildNumberSeq() { return buildNumberSeq; }
    public boolean isActive()          { return active; }

    /** Advances the build counter and returns the new build name. */
    public String nextBuildName() {
        buildNumberSeq++;
        return Integer.toString(buildNumberSeq);
    }
}
