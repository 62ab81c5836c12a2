package com.socialnet.repository;

import com.socialnet.entity.ScheduledJob;
import com.socialnet.entity.ScheduledJob.JobStatus;
import com.socialnet.jobs.JobKind;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Repository interface for ScheduledJob entity.
 *
 * Besides CRUD, this is where the queue semantics live: the due-job scan used by
 * the dispatcher and the conditional status updates used by the executor. Each
 * conditional update returns the number of rows changed, so a caller that gets 0
 * knows another worker (or an earlier run) already moved the row.
 */
@Repository
public interface ScheduledJobRepository extends JpaRepository<ScheduledJob, UUID> {

    @Query("SELECT j FROM ScheduledJob j " +
           "WHERE j.status = :status " +
           "AND j.eta <= :now " +
           "AND (j.dispatchedAt IS NULL OR j.dispatchedAt < :redispatchBefore) " +
           "ORDER BY j.eta ASC")
    List<ScheduledJob> findDueForDispatch(@Param("status") JobStatus status,
                                          @Param("now") LocalDateTime now,
                                          @Param("redispatchBefore") LocalDateTime redispatchBefore,
                                          Pageable pageable);

    /**
     * Find PENDING jobs whose eta has passed and that were never dispatched or were
     * dispatched before {@code redispatchBefore}. Oldest eta first.
     *
     * @param now current time
     * @param redispatchBefore dispatch stamps older than this are considered lost
     * @param batchSize maximum number of jobs returned
     * @return due jobs
     */
    default List<ScheduledJob> findDueForDispatch(LocalDateTime now, LocalDateTime redispatchBefore, int batchSize) {
        return findDueForDispatch(JobStatus.PENDING, now, redispatchBefore, PageRequest.of(0, batchSize));
    }

    @Modifying
    @Transactional
    @Query("UPDATE ScheduledJob j SET j.dispatchedAt = :now " +
           "WHERE j.id = :id AND j.status = :status")
    int markDispatched(@Param("id") UUID id, @Param("status") JobStatus status, @Param("now") LocalDateTime now);

    /**
     * Stamp a PENDING job as handed to the worker pool.
     */
    default int markDispatched(UUID id, LocalDateTime now) {
        return markDispatched(id, JobStatus.PENDING, now);
    }

    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("UPDATE ScheduledJob j SET j.status = :to, j.startedAt = :now, j.updatedAt = :now " +
           "WHERE j.id = :id AND j.status = :from AND j.eta <= :now")
    int claim(@Param("id") UUID id,
              @Param("from") JobStatus from,
              @Param("to") JobStatus to,
              @Param("now") LocalDateTime now);

    /**
     * Atomically claim a due PENDING job for execution.
     *
     * @return 1 if this caller now owns the job, 0 otherwise
     */
    default int claim(UUID id, LocalDateTime now) {
        return claim(id, JobStatus.PENDING, JobStatus.RUNNING, now);
    }

    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("UPDATE ScheduledJob j SET j.status = :to, j.completedAt = :now, " +
           "j.updatedAt = :now, j.errorLog = :errorLog " +
           "WHERE j.id = :id AND j.status = :from")
    int finish(@Param("id") UUID id,
               @Param("from") JobStatus from,
               @Param("to") JobStatus to,
               @Param("now") LocalDateTime now,
               @Param("errorLog") String errorLog);

    /**
     * Move a RUNNING job to a terminal status.
     *
     * @return 1 if the transition happened, 0 if the job was not RUNNING
     */
    default int finish(UUID id, JobStatus terminal, LocalDateTime now, String errorLog) {
        if (!terminal.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal status: " + terminal);
        }
        return finish(id, JobStatus.RUNNING, terminal, now, errorLog);
    }

    List<ScheduledJob> findByKindAndStatus(JobKind kind, JobStatus status);
}
