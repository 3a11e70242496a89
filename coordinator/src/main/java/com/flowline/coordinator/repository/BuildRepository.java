package com.flowline.coordinator.repository;

import com.flowline.coordinator.model.Build;
import com.flowline.coordinator.model.BuildStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.Optional;

/**
 * CRUD, row locking and conditional status updates for the builds table.
 *
 * Status changes are never done by dirtying a loaded Build: each transition
 * is a single UPDATE ... WHERE status IN (allowed sources), and the affected
 * row count tells the caller whether it won. Two concurrent callers can never
 * both move the same build out of the same state.
 */
public interface BuildRepository extends JpaRepository<Build, Long> {

    /**
     * Lock the build row for the rest of the transaction.
     *
     * Every event append goes through this lock, which is what serialises
     * event id assignment for one build while leaving other builds untouched.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT b FROM Build b WHERE b.id = :id")
    Optional<Build> findByIdForUpdate(@Param("id") Long id);

    /** Read only the completion flag; used by cursors on every poll. */
    @Query("SELECT b.completed FROM Build b WHERE b.id = :id")
    Optional<Boolean> findCompletedById(@Param("id") Long id);

    @Query("SELECT b.status FROM Build b WHERE b.id = :id")
    Optional<BuildStatus> findStatusById(@Param("id") Long id);

    /** PENDING → STARTED. Returns 1 if this caller made the transition, 0 otherwise. */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            UPDATE Build b
            SET b.status = :started, b.startTime = :startTime,
                b.engine = :engine, b.engineMetadata = :engineMetadata
            WHERE b.id = :id AND b.status = :pending
            """)
    int markStarted(@Param("id") Long id,
                    @Param("startTime") Instant startTime,
                    @Param("engine") String engine,
                    @Param("engineMetadata") String engineMetadata,
                    @Param("pending") BuildStatus pending,
                    @Param("started") BuildStatus started);

    default int markStarted(Long id, Instant startTime, String engine, String engineMetadata) {
        return markStarted(id, startTime, engine, engineMetadata, BuildStatus.PENDING, BuildStatus.STARTED);
    }

    /** Move to a terminal status if the build is currently in one of {@code from}. */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            UPDATE Build b
            SET b.status = :status, b.endTime = :endTime, b.completed = true
            WHERE b.id = :id AND b.status IN :from
            """)
    int markCompleted(@Param("id") Long id,
                      @Param("status") BuildStatus status,
                      @Param("endTime") Instant endTime,
                      @Param("from") Collection<BuildStatus> from);

    /** Next name for a one-off build: "1", "2", ... across all teams. */
    @Query(value = "SELECT nextval('one_off_name')", nativeQuery = true)
    long nextOneOffName();
}
