package com.flowline.coordinator.repository;

import com.flowline.coordinator.model.Job;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.Optional;

/**
 * Jobs of a pipeline, kept in step with the pipeline config.
 */
public interface JobRepository extends JpaRepository<Job, Long> {

    /** Lock the job row so two builds of the same job can't get the same number. */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT j FROM Job j WHERE j.pipelineId = :pipelineId AND j.name = :name")
    Optional<Job> findByPipelineIdAndNameForUpdate(@Param("pipelineId") Long pipelineId,
                                                   @Param("name") String name);

    /** Create the job, or re-activate it if it was dropped from an earlier config. */
    @Modifying
    @Query(value = """
            INSERT INTO jobs (pipeline_id, name, build_number_seq, active)
            VALUES (:pipelineId, :name, 0, TRUE)
            ON CONFLICT (pipeline_id, name) DO UPDATE SET active = TRUE
            """, nativeQuery = true)
    int upsertActive(@Param("pipelineId") Long pipelineId, @Param("name") String name);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Job j SET j.active = false WHERE j.pipelineId = :pipelineId AND j.name NOT IN :names")
    int deactivateAllExcept(@Param("pipelineId") Long pipelineId, @Param("names") Collection<String> names);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Job j SET j.active = false WHERE j.pipelineId = :pipelineId")
    int deactivateAll(@Param("pipelineId") Long pipelineId);
}
