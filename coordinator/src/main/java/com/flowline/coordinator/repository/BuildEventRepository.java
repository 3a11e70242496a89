package com.flowline.coordinator.repository;

import com.flowline.coordinator.model.BuildEventRecord;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

/**
 * Append-only access to the build_events table.
 *
 * Inserts only happen through BuildEventStore, under the build row lock.
 */
public interface BuildEventRepository extends JpaRepository<BuildEventRecord, Long> {

    /** The next batch of a build's events starting at {@code fromEventId}, in id order. */
    List<BuildEventRecord> findByBuildIdAndEventIdGreaterThanEqualOrderByEventIdAsc(
            Long buildId, int fromEventId, Pageable page);
}
