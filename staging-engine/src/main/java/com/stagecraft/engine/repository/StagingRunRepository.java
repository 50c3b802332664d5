package com.stagecraft.engine.repository;

import com.stagecraft.engine.model.StagingRun;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;
import java.util.UUID;

/**
 * CRUD + locking queries for the staging_runs table.
 */
public interface StagingRunRepository extends JpaRepository<StagingRun, UUID> {

    /**
     * Load a run with SELECT ... FOR UPDATE.
     *
     * The run row is the mutual-exclusion boundary for its state machine:
     * two callbacks for the same run queue up here, so the second one sees
     * the state the first one committed. Runs never block each other.
     *
     * Must be called inside a @Transactional method; the lock is held until
     * that transaction commits.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT r FROM StagingRun r WHERE r.id = :id")
    Optional<StagingRun> findByIdForUpdate(@Param("id") UUID id);
}
