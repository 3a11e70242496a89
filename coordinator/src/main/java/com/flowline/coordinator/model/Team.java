package com.flowline.coordinator.model;

import jakarta.persistence.*;
import java.time.Instant;

/**
 * Owner of pipelines and builds. The "main" team is seeded by the V1 migration.
 */
@Entity
@Table(name = "teams")
public class Team {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true)
    private String name;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    protected Team() {}   // required by JPA

    public Team(String name) {
        this.name = name;
    }

    public Long    getId()        { return id; }
    public String  getName()      { return name; }
    public Instant getCreatedAt() { return createdAt; }
}
