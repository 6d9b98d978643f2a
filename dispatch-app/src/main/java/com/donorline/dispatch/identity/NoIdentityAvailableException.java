package com.donorline.dispatch.identity;

import java.util.UUID;

public class NoIdentityAvailableException extends RuntimeException {

    public NoIdentityAvailableException(UUID donorId, String organizationId) {
        super("No credentialed sender available for donor " + donorId + " in organization " + organizationId);
    }
}
