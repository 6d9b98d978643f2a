package com.donorline.dispatch.provider;

import com.donorline.dispatch.identity.SenderIdentity;

/**
 * Capability to send mail and renew OAuth access through a mail provider.
 */
public interface EmailProvider {

    /**
     * Sends {@code email} as {@code from}, using the identity's current access token.
     *
     * @return the provider's id for the accepted message
     * @throws EmailProviderException if the provider did not accept the message
     */
    String deliver(OutboundEmail email, SenderIdentity from);

    /**
     * Exchanges a refresh token for a new access token.
     *
     * @throws EmailProviderException if the exchange failed
     */
    TokenGrant refreshCredential(String refreshToken);
}
