package com.donorline.dispatch.identity;

import com.donorline.dispatch.model.OAuthCredential;
import com.donorline.dispatch.provider.EmailProvider;
import com.donorline.dispatch.provider.EmailProviderException;
import com.donorline.dispatch.provider.TokenGrant;
import com.donorline.dispatch.repository.OAuthCredentialRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Renews an access token shortly before it expires. Concurrent sends sharing a
 * credential may refresh at the same time; the first save wins and the losers
 * continue with the stored token.
 */
@Component
@Slf4j
public class CredentialRefresher {

    static final Duration REFRESH_SKEW = Duration.ofSeconds(60);

    private final EmailProvider emailProvider;
    private final OAuthCredentialRepository credentialRepository;
    private final Clock clock;

    public CredentialRefresher(EmailProvider emailProvider,
                               OAuthCredentialRepository credentialRepository,
                               Clock clock) {
        this.emailProvider = emailProvider;
        this.credentialRepository = credentialRepository;
        this.clock = clock;
    }

    /**
     * @return the credential with an access token valid for at least {@link #REFRESH_SKEW}
     * @throws CredentialExpiredException if the token is stale and cannot be renewed
     */
    public OAuthCredential ensureFresh(OAuthCredential credential) {
        Instant now = clock.instant();
        if (!needsRefresh(credential, now)) {
            return credential;
        }
        String refreshToken = credential.getRefreshToken();
        if (refreshToken == null || refreshToken.isBlank()) {
            throw new CredentialExpiredException(credential.getId(), "access token expired and no refresh token is stored");
        }

        TokenGrant grant;
        try {
            grant = emailProvider.refreshCredential(refreshToken);
        } catch (EmailProviderException e) {
            throw new CredentialExpiredException(credential.getId(), e.getMessage(), e);
        }

        credential.setAccessToken(grant.accessToken());
        credential.setExpiresAt(grant.expiresAt());
        if (grant.refreshToken() != null && !grant.refreshToken().isBlank()) {
            credential.setRefreshToken(grant.refreshToken());
        }

        try {
            OAuthCredential saved = credentialRepository.save(credential);
            log.info("Refreshed credential {} ({} {}), valid until {}",
                    saved.getId(), saved.getOwnerType(), saved.getOwnerId(), saved.getExpiresAt());
            return saved;
        } catch (OptimisticLockingFailureException e) {
            log.info("Credential {} was refreshed concurrently; using the stored token", credential.getId());
            return credentialRepository.findById(credential.getId())
                    .orElseThrow(() -> new CredentialExpiredException(credential.getId(),
                            "credential removed during refresh", e));
        }
    }

    boolean needsRefresh(OAuthCredential credential, Instant now) {
        return credential.getAccessToken() == null
                || credential.getExpiresAt() == null
                || !credential.getExpiresAt().isAfter(now.plus(REFRESH_SKEW));
    }
}
