package com.donorline.dispatch.identity;

import java.util.UUID;

/**
 * A credential could not be brought up to date; the send that needed it fails.
 */
public class CredentialExpiredException extends RuntimeException {

    public CredentialExpiredException(UUID credentialId, String reason) {
        this(credentialId, reason, null);
    }

    public CredentialExpiredException(UUID credentialId, String reason, Throwable cause) {
        super("Credential " + credentialId + " expired: " + reason, cause);
    }
}
