package com.donorline.dispatch.identity;

import com.donorline.dispatch.model.CredentialOwnerType;
import com.donorline.dispatch.model.OAuthCredential;
import com.donorline.dispatch.provider.EmailProvider;
import com.donorline.dispatch.provider.EmailProviderException;
import com.donorline.dispatch.provider.TokenGrant;
import com.donorline.dispatch.repository.OAuthCredentialRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.OptimisticLockingFailureException;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CredentialRefresherTest {

    private static final Instant NOW = Instant.parse("2025-03-04T19:00:00Z");

    @Mock
    private EmailProvider emailProvider;

    @Mock
    private OAuthCredentialRepository credentialRepository;

    private CredentialRefresher refresher;

    @BeforeEach
    void setUp() {
        refresher = new CredentialRefresher(emailProvider, credentialRepository, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void ensureFresh_withLiveToken_shouldNotRefresh() {
        OAuthCredential credential = credential("live", NOW.plusSeconds(600), "refresh");

        assertThat(refresher.ensureFresh(credential)).isSameAs(credential);
        verify(emailProvider, never()).refreshCredential(anyString());
    }

    @Test
    void ensureFresh_nearExpiry_shouldRefreshAndPersist() {
        OAuthCredential credential = credential("old", NOW.plusSeconds(30), "refresh");
        when(emailProvider.refreshCredential("refresh"))
                .thenReturn(new TokenGrant("new", NOW.plusSeconds(3600), null));
        when(credentialRepository.save(any(OAuthCredential.class))).thenAnswer(invocation -> invocation.getArgument(0));

        OAuthCredential refreshed = refresher.ensureFresh(credential);

        assertThat(refreshed.getAccessToken()).isEqualTo("new");
        assertThat(refreshed.getExpiresAt()).isEqualTo(NOW.plusSeconds(3600));
        assertThat(refreshed.getRefreshToken()).isEqualTo("refresh");
    }

    @Test
    void ensureFresh_withoutRefreshToken_shouldThrowExpired() {
        OAuthCredential credential = credential("old", NOW.minusSeconds(1), null);

        assertThatThrownBy(() -> refresher.ensureFresh(credential))
                .isInstanceOf(CredentialExpiredException.class);
    }

    @Test
    void ensureFresh_whenProviderRejectsRefresh_shouldThrowExpired() {
        OAuthCredential credential = credential("old", NOW.minusSeconds(1), "revoked");
        when(emailProvider.refreshCredential("revoked"))
                .thenThrow(new EmailProviderException("Token refresh failed with HTTP 400", false, null));

        assertThatThrownBy(() -> refresher.ensureFresh(credential))
                .isInstanceOf(CredentialExpiredException.class)
                .hasCauseInstanceOf(EmailProviderException.class);
    }

    @Test
    void ensureFresh_whenRefreshedConcurrently_shouldUseStoredCredential() {
        OAuthCredential credential = credential("old", NOW.minusSeconds(1), "refresh");
        OAuthCredential stored = credential("other-worker", NOW.plusSeconds(3600), "refresh");
        when(emailProvider.refreshCredential("refresh"))
                .thenReturn(new TokenGrant("new", NOW.plusSeconds(3600), null));
        when(credentialRepository.save(any(OAuthCredential.class)))
                .thenThrow(new OptimisticLockingFailureException("stale"));
        when(credentialRepository.findById(credential.getId())).thenReturn(Optional.of(stored));

        assertThat(refresher.ensureFresh(credential).getAccessToken()).isEqualTo("other-worker");
    }

    private static OAuthCredential credential(String accessToken, Instant expiresAt, String refreshToken) {
        return OAuthCredential.builder()
                .id(UUID.fromString("11111111-1111-1111-1111-111111111111"))
                .ownerType(CredentialOwnerType.STAFF)
                .ownerId(UUID.randomUUID())
                .provider("google")
                .accessToken(accessToken)
                .refreshToken(refreshToken)
                .expiresAt(expiresAt)
                .build();
    }
}
