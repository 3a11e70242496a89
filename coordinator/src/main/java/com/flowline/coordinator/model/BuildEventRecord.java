package com.flowline.coordinator.model;

import jakarta.persistence.*;
import java.time.Instant;

/**
 * One committed entry of a build's event log.
 *
 * (build_id, event_id) is unique; event ids start at 0 and are gapless
 * because they are taken from {@link Build#claimNextEventId()} while the
 * build row is locked. Rows are never updated or deleted.
 *
 * DB table: build_events  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "build_events")
public class BuildEventRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "build_id", nullable = false, updatable = false)
    private Long buildId;

    @Column(name = "event_id", nullable = false, updatable = false)
    private int eventId;

    // Event type name, e.g. "log" or "status".
    @Column(nullable = false, updatable = false)
    private String type;

    // Payload schema version for the type.
    @Column(nullable = false, updatable = false)
    private String version;

    // JSON-encoded event body.
    @Column(nullable = false, updatable = false, columnDefinition = "TEXT")
    private String payload;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    protected BuildEventRecord() {}   // required by JPA

    public BuildEventRecord(Long buildId, int eventId, String type, String version, String payload) {
        this.buildId = buildId;
        this.eventId = eventId;
        this.type    = type;
        this.version = version;
        this.payload = payload;
    }

    public Long    getId()        { return id; }
    public Long    getBuildId()   { return buildId; }
    public int     getEventId()   { return eventId; }
    public String  getType()      { return type; }
    public String  getVersion()   { return version; }
    public String  getPayload()   { return payload; }
    public Instant getCreatedAt() { return createdAt; }
}
