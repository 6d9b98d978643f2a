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

@Entity
@Table(name = "link_trackers")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LinkTracker {

    @Id
    @Column(length = 32)
    private String id;

    @Column(nullable = false, length = 32)
    private String emailTrackerId;

    @Column(columnDefinition = "TEXT", nullable = false)
    private String originalUrl;

    @CreationTimestamp
    @Column(nullable = false, updatable = false)
    private Instant createdAt;
}
