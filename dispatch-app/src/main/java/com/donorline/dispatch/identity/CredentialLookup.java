package com.donorline.dispatch.identity;

import com.donorline.dispatch.model.CredentialOwnerType;
import com.donorline.dispatch.model.OAuthCredential;
import com.donorline.dispatch.repository.OAuthCredentialRepository;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Optional;
import java.util.UUID;

/**
 * Finds the provider credential of a staff member or user, if it can still be used
 * (live access token or a refresh token to get one).
 */
@Component
public class CredentialLookup {

    private final OAuthCredentialRepository credentialRepository;
    private final Clock clock;
    private final String provider;

    public CredentialLookup(
            OAuthCredentialRepository credentialRepository,
            Clock clock,
            @Value("${dispatch.provider.name:google}") String provider) {
        this.credentialRepository = credentialRepository;
        this.clock = clock;
        this.provider = provider;
    }

    public Optional<OAuthCredential> findUsable(CredentialOwnerType ownerType, UUID ownerId) {
        if (ownerId == null) {
            return Optional.empty();
        }
        return credentialRepository.findFirstByOwnerTypeAndOwnerIdAndProvider(ownerType, ownerId, provider)
                .filter(credential -> credential.isUsable(clock.instant()));
    }
}
