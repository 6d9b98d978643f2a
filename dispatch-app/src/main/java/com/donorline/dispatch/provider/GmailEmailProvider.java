package com.donorline.dispatch.provider;

import com.donorline.dispatch.identity.SenderIdentity;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;

/**
 * {@link EmailProvider} on the Gmail REST API and Google's OAuth token endpoint.
 * Both calls run with bounded connect and read timeouts; a timeout surfaces as a
 * transient {@link EmailProviderException}.
 */
@Component
@Slf4j
public class GmailEmailProvider implements EmailProvider {

    private final RestClient gmailClient;
    private final RestClient oauthClient;
    private final MimeMessageComposer composer = new MimeMessageComposer();
    private final Clock clock;
    private final String clientId;
    private final String clientSecret;

    public GmailEmailProvider(
            RestClient.Builder restClientBuilder,
            Clock clock,
            @Value("${dispatch.provider.gmail.api-base-url:https://gmail.googleapis.com}") String apiBaseUrl,
            @Value("${dispatch.provider.gmail.oauth-base-url:https://oauth2.googleapis.com}") String oauthBaseUrl,
            @Value("${dispatch.provider.gmail.client-id:}") String clientId,
            @Value("${dispatch.provider.gmail.client-secret:}") String clientSecret,
            @Value("${dispatch.provider.connect-timeout:5s}") Duration connectTimeout,
            @Value("${dispatch.provider.read-timeout:20s}") Duration readTimeout) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(connectTimeout);
        requestFactory.setReadTimeout(readTimeout);
        this.gmailClient = restClientBuilder.clone().requestFactory(requestFactory).baseUrl(apiBaseUrl).build();
        this.oauthClient = restClientBuilder.clone().requestFactory(requestFactory).baseUrl(oauthBaseUrl).build();
        this.clock = clock;
        this.clientId = clientId;
        this.clientSecret = clientSecret;
    }

    @Override
    public String deliver(OutboundEmail email, SenderIdentity from) {
        String raw = composer.composeBase64Url(email, from.displayName(), from.emailAddress());
        try {
            GmailSendResponse response = gmailClient.post()
                    .uri("/gmail/v1/users/me/messages/send")
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + from.accessToken())
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(Map.of("raw", raw))
                    .retrieve()
                    .body(GmailSendResponse.class);
            String providerId = response != null ? response.id() : null;
            log.info("Gmail accepted message to {} from {} (id={})", email.toAddress(), from.emailAddress(), providerId);
            return providerId;
        } catch (RestClientException e) {
            throw classify("Gmail send to " + email.toAddress(), e);
        }
    }

    @Override
    public TokenGrant refreshCredential(String refreshToken) {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("client_id", clientId);
        form.add("client_secret", clientSecret);
        form.add("refresh_token", refreshToken);
        form.add("grant_type", "refresh_token");
        try {
            GoogleTokenResponse response = oauthClient.post()
                    .uri("/token")
                    .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                    .body(form)
                    .retrieve()
                    .body(GoogleTokenResponse.class);
            if (response == null || response.accessToken() == null) {
                throw new EmailProviderException("Token endpoint returned no access token", false, null);
            }
            long expiresIn = response.expiresIn() != null ? response.expiresIn() : 3600L;
            return new TokenGrant(response.accessToken(), clock.instant().plusSeconds(expiresIn),
                    response.refreshToken());
        } catch (RestClientException e) {
            throw classify("Token refresh", e);
        }
    }

    static EmailProviderException classify(String operation, RestClientException e) {
        if (e instanceof RestClientResponseException response) {
            int status = response.getStatusCode().value();
            boolean transientFailure = status >= 500 || status == 429;
            return new EmailProviderException(operation + " failed with HTTP " + status + ": "
                    + response.getResponseBodyAsString(), transientFailure, e);
        }
        if (e instanceof ResourceAccessException) {
            return new EmailProviderException(operation + " timed out or could not connect: " + e.getMessage(), true, e);
        }
        return new EmailProviderException(operation + " failed: " + e.getMessage(), false, e);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record GmailSendResponse(String id, String threadId) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record GoogleTokenResponse(
            @JsonProperty("access_token") String accessToken,
            @JsonProperty("expires_in") Long expiresIn,
            @JsonProperty("refresh_token") String refreshToken) {
    }
}
