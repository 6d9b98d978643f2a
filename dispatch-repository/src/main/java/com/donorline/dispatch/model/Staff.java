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
@Table(name = "staff")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Staff {

    @Id
    private UUID id;

    @Column(nullable = false, length = 100)
    private String organizationId;

    @Column(nullable = false)
    private String displayName;

    @Column(nullable = false)
    private String email;

    /** The organization's fallback sender when a donor has no assigned staff. */
    @Column(nullable = false)
    private boolean primaryContact;
}
