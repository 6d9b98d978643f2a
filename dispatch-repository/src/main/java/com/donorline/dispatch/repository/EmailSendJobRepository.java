package com.donorline.dispatch.repository;

import com.donorline.dispatch.model.EmailSendJob;
import com.donorline.dispatch.model.JobStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

public interface EmailSendJobRepository extends JpaRepository<EmailSendJob, UUID> {

    List<EmailSendJob> findByCampaignIdAndStatusOrderByScheduledTimeAsc(UUID campaignId, JobStatus status);

    List<EmailSendJob> findByCampaignIdOrderByScheduledTimeAsc(UUID campaignId);

    List<EmailSendJob> findByOrganizationIdAndStatusInAndScheduledTimeGreaterThanEqual(
            String organizationId, Collection<JobStatus> statuses, Instant since);

    /**
     * Compare-and-set on the job status.
     *
     * @return 1 if the job was in {@code expected} and moved to {@code next}, else 0
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update EmailSendJob j set j.status = :next where j.id = :id and j.status = :expected")
    int transition(@Param("id") UUID id,
                   @Param("expected") JobStatus expected,
                   @Param("next") JobStatus next);
}
