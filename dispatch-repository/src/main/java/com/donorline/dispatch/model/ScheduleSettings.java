package com.donorline.dispatch.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UpdateTimestamp;
import org.hibernate.type.SqlTypes;

import java.time.Instant;

/**
 * Stored sending rules of an organization. {@code allowedDays} and
 * {@code dailySchedules} are JSON documents.
 */
@Entity
@Table(name = "email_schedule_config")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ScheduleSettings {

    @Id
    @Column(length = 100)
    private String organizationId;

    @Column(nullable = false)
    private int dailyLimit;

    @Column(nullable = false)
    private int minGapMinutes;

    @Column(nullable = false)
    private int maxGapMinutes;

    @Column(nullable = false, length = 64)
    private String timezone;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(columnDefinition = "jsonb", nullable = false)
    private String allowedDays;

    @Column(nullable = false, length = 5)
    private String allowedStartTime;

    @Column(nullable = false, length = 5)
    private String allowedEndTime;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(columnDefinition = "jsonb")
    private String dailySchedules;

    @UpdateTimestamp
    private Instant updatedAt;
}
