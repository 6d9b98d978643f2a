package com.donorline.dispatch.identity;

import com.donorline.dispatch.model.CredentialOwnerType;
import com.donorline.dispatch.repository.AppUserRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * The user who launched the campaign, sending from their own mailbox.
 */
@Component
@Order(3)
@RequiredArgsConstructor
public class CampaignOwnerStrategy implements IdentityStrategy {

    private final AppUserRepository appUserRepository;
    private final CredentialLookup credentialLookup;

    @Override
    public Optional<SenderIdentity> resolve(IdentityRequest request) {
        if (request.campaignOwnerUserId() == null) {
            return Optional.empty();
        }
        return appUserRepository.findById(request.campaignOwnerUserId())
                .flatMap(user -> credentialLookup.findUsable(CredentialOwnerType.USER, user.getId())
                        .map(credential -> new SenderIdentity(CredentialOwnerType.USER, user.getId(),
                                user.getDisplayName(), user.getEmail(), credential)));
    }

    @Override
    public String name() {
        return "campaign-owner";
    }
}
