package com.donorline.dispatch.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "email_trackers")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EmailTracker {

    @Id
    @Column(length = 32)
    private String id;

    @Column(nullable = false)
    private UUID messageId;

    @Column(nullable = false)
    private UUID campaignId;

    @Column(nullable = false)
    private String recipientEmail;

    @CreationTimestamp
    @Column(nullable = false, updatable = false)
    private Instant createdAt;
}
