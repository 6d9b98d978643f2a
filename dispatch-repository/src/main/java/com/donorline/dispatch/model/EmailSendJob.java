package com.donorline.dispatch.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "email_send_jobs")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EmailSendJob {

    @Id
    private UUID id;

    @Column(nullable = false)
    private UUID messageId;

    @Column(nullable = false)
    private UUID campaignId;

    @Column(nullable = false, length = 100)
    private String organizationId;

    /** Handle returned by the trigger gateway; used to cancel a not-yet-fired trigger. */
    private String triggerHandle;

    @Column(nullable = false)
    private Instant scheduledTime;

    private Instant actualSendTime;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private JobStatus status = JobStatus.SCHEDULED;

    @Column(nullable = false)
    private int attemptCount;

    @Column(columnDefinition = "TEXT")
    private String lastError;

    @CreationTimestamp
    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    private Instant updatedAt;
}
