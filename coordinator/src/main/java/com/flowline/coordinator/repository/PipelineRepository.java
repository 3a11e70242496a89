package com.flowline.coordinator.repository;

import com.flowline.coordinator.model.Pipeline;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Optional;

/**
 * Pipeline rows and their optimistic-concurrency config updates.
 */
public interface PipelineRepository extends JpaRepository<Pipeline, Long> {

    Optional<Pipeline> findByTeamIdAndName(Long teamId, String name);

    /**
     * Create the pipeline at version 1 unless (team, name) already exists.
     * Returns 1 when this call created it, 0 when a row was already there.
     */
    @Modifying
    @Query(value = """
            INSERT INTO pipelines (team_id, name, config, version, paused, created_at, updated_at)
            VALUES (:teamId, :name, :config, 1, :paused, :now, :now)
            ON CONFLICT (team_id, name) DO NOTHING
            """, nativeQuery = true)
    int insertIfAbsent(@Param("teamId") Long teamId,
                       @Param("name") String name,
                       @Param("config") String config,
                       @Param("paused") boolean paused,
                       @Param("now") Instant now);

    /**
     * Compare-and-set: replace the config and bump the version by one, but
     * only if the stored version still equals {@code expectedVersion}.
     * Returns 0 on a version mismatch.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            UPDATE Pipeline p
            SET p.config = :config, p.version = p.version + 1, p.updatedAt = :now
            WHERE p.teamId = :teamId AND p.name = :name AND p.version = :expectedVersion
            """)
    int updateConfigIfVersion(@Param("teamId") Long teamId,
                              @Param("name") String name,
                              @Param("config") String config,
                              @Param("expectedVersion") long expectedVersion,
                              @Param("now") Instant now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Pipeline p SET p.paused = :paused, p.updatedAt = :now WHERE p.id = :id")
    int updatePaused(@Param("id") Long id, @Param("paused") boolean paused, @Param("now") Instant now);
}
