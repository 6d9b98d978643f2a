package com.donorline.dispatch.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

@Entity
@Table(name = "donors")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Donor {

    @Id
    private UUID id;

    @Column(nullable = false, length = 100)
    private String organizationId;

    private String displayName;

    private String email;

    /** Staff member who owns the relationship with this donor, if any. */
    private UUID assignedStaffId;
}
