package com.donorline.dispatch.identity;

import com.donorline.dispatch.model.CredentialOwnerType;
import com.donorline.dispatch.model.OAuthCredential;

import java.util.UUID;

/**
 * The staff member or user a message is sent as, with the provider credential used
 * for the send.
 */
public record SenderIdentity(
        CredentialOwnerType ownerType,
        UUID ownerId,
        String displayName,
        String emailAddress,
        OAuthCredential credential
) {

    public SenderIdentity withCredential(OAuthCredential refreshed) {
        return new SenderIdentity(ownerType, ownerId, displayName, emailAddress, refreshed);
    }

    public String accessToken() {
        return credential.getAccessToken();
    }
}
