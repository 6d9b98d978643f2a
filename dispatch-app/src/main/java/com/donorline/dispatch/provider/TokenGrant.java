package com.donorline.dispatch.provider;

import java.time.Instant;

/**
 * Result of a token refresh. {@code refreshToken} is only set when the provider rotated it.
 */
public record TokenGrant(String accessToken, Instant expiresAt, String refreshToken) {
}
