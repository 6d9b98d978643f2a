package com.donorline.dispatch.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;
import java.util.UUID;

/**
 * Provider OAuth tokens of a staff member or user. Concurrent refreshes are
 * resolved through {@link Version}: the first writer wins and the others re-read.
 */
@Entity
@Table(name = "oauth_credentials")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class OAuthCredential {

    @Id
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private CredentialOwnerType ownerType;

    @Column(nullable = false)
    private UUID ownerId;

    @Column(nullable = false, length = 30)
    private String provider;

    @ToString.Exclude
    @Column(columnDefinition = "TEXT")
    private String accessToken;

    @ToString.Exclude
    @Column(columnDefinition = "TEXT")
    private String refreshToken;

    private Instant expiresAt;

    @Version
    private long version;

    public boolean isUsable(Instant now) {
        boolean hasRefresh = refreshToken != null && !refreshToken.isBlank();
        boolean hasLiveAccess = accessToken != null && expiresAt != null && expiresAt.isAfter(now);
        return hasRefresh || hasLiveAccess;
    }
}
