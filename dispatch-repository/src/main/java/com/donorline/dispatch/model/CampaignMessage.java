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

import java.time.Instant;
import java.util.UUID;

/**
 * One generated email addressed to a donor. {@code sent} flips to true exactly once,
 * when the provider accepts the message, and is never reset.
 */
@Entity
@Table(name = "campaign_messages")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CampaignMessage {

    @Id
    private UUID id;

    @Column(nullable = false)
    private UUID campaignId;

    @Column(nullable = false, length = 100)
    private String organizationId;

    @Column(nullable = false)
    private UUID donorId;

    @Column(nullable = false)
    private String recipientEmail;

    private String recipientName;

    @Column(nullable = false, length = 998)
    private String subject;

    @Column(columnDefinition = "TEXT", nullable = false)
    private String body;

    private Integer priority;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private SendStatus sendStatus = SendStatus.PENDING;

    @Column(nullable = false)
    private boolean sent;

    private Instant sentAt;

    private Instant scheduledSendTime;

    private UUID sendJobId;

    private String providerMessageId;

    @Column(columnDefinition = "TEXT")
    private String lastError;

    @CreationTimestamp
    @Column(nullable = false, updatable = false)
    private Instant createdAt;
}
