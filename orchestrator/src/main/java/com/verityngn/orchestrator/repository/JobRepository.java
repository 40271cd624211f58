package com.verityngn.orchestrator.repository;

import com.verityngn.orchestrator.model.Job;
import com.verityngn.orchestrator.model.JobStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Spring Data access to the jobs table. Only {@link JpaJobStore} uses it.
 */
public interface JobRepository extends JpaRepository<Job, UUID> {

    /**
     * Load a job and lock its row until the surrounding transaction ends.
     *
     * The lock covers only the version check and the write of one
     * compare-and-update; nothing holds it across a provider call.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT j FROM Job j WHERE j.id = :id")
    Optional<Job> findByIdForUpdate(@Param("id") UUID id);

    List<Job> findByTenantIdAndStatusInOrderByCreatedAtAsc(String tenantId, Collection<JobStatus> statuses);

    List<Job> findByStatusInOrderByCreatedAtAsc(Collection<JobStatus> statuses);
}
