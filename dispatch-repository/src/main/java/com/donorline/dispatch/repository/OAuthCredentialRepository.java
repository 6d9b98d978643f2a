package com.donorline.dispatch.repository;

import com.donorline.dispatch.model.CredentialOwnerType;
import com.donorline.dispatch.model.OAuthCredential;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;
import java.util.UUID;

public interface OAuthCredentialRepository extends JpaRepository<OAuthCredential, UUID> {

    Optional<OAuthCredential> findFirstByOwnerTypeAndOwnerIdAndProvider(
            CredentialOwnerType ownerType, UUID ownerId, String provider);
}
