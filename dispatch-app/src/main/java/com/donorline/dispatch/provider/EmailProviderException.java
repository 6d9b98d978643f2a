package com.donorline.dispatch.provider;

/**
 * Delivery or token exchange failure. Transient failures (timeouts, I/O errors,
 * 5xx, 429) could succeed on a later attempt; permanent ones (bad recipient,
 * revoked grant) will not.
 */
public class EmailProviderException extends RuntimeException {

    private final boolean transientFailure;

    public EmailProviderException(String message, boolean transientFailure, Throwable cause) {
        super(message, cause);
        this.transientFailure = transientFailure;
    }

    public boolean isTransientFailure() {
        return transientFailure;
    }
}
