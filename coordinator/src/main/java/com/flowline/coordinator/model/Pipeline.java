package com.flowline.coordinator.model;

import jakarta.persistence.*;
import java.time.Instant;

/**
 * A team's pipeline together with its current configuration.
 *
 * The row is never written through the entity: creation is an
 * INSERT ... ON CONFLICT DO NOTHING and every config change is a
 * compare-and-set UPDATE on {@code version} (see PipelineRepository).
 *
 * DB table: pipelines  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "pipelines")
public class Pipeline {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "team_id", nullable = false)
    private Long teamId;

    // Unique within the team.
    @Column(nullable = false)
    private String name;

    // Jackson-encoded PipelineConfig document.
    @Column(nullable = false, columnDefinition = "TEXT")
    private String config;

    // Starts at 1, +1 on every successful save.
    @Column(nullable = false)
    private long version;

    @Column(nullable = false)
    private boolean paused;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected Pipeline() {}   // required by JPA

    public Long    getId()        { return id; }
    public Long    getTeamId()    { return teamId; }
    public String  getName()      { return name; }
    public String  getConfig()    { return config; }
    public long    getVersion()   { return version; }
    public boolean isPaused()     { return paused; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
}
