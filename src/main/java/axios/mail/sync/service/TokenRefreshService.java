package axios.mail.sync.service;

import axios.mail.sync.entity.MailAccount;
import axios.mail.sync.entity.OAuthToken;
import axios.mail.sync.entity.SyncStatus;
import axios.mail.sync.provider.ProviderAuthException;
import axios.mail.sync.provider.ProviderException;
import axios.mail.sync.provider.TransientProviderException;
import axios.mail.sync.repository.MailAccountRepository;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Instant;
import java.util.function.Consumer;

/**
 * Keeps the OAuth access token of Gmail accounts usable. A missing or rejected
 * refresh token marks the account {@link SyncStatus#EXPIRED} so the sync loop
 * skips it until the user signs in again.
 * <p>
 * Writes only touch the token and sync status, applied to a freshly loaded row, so a concurrent
 * change to the account (disabling it, a new cursor) is never overwritten by the caller's copy.
 */
@Slf4j
@Service
public class TokenRefreshService {
    private static final String TOKEN_ENDPOINT = "https://oauth2.googleapis.com/token";
    private static final long REFRESH_MARGIN_SECONDS = 300;

    private final MailAccountRepository mailAccountRepository;
    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;

    @Value("${mailsync.google.client-id:}")
    private String clientId;

    @Value("${mailsync.google.client-secret:}")
    private String clientSecret;

    public TokenRefreshService(MailAccountRepository mailAccountRepository) {
        this.mailAccountRepository = mailAccountRepository;
        this.restTemplate = new RestTemplate();
        this.objectMapper = new ObjectMapper();
    }

    /**
     * Returns a valid access token, refreshing it first if it expires within the next 5 minutes.
     */
    public String ensureValidAccessToken(MailAccount account) throws ProviderException {
        OAuthToken token = account.getToken();
        if (token == null || token.getAccessToken() == null) {
            markExpired(account, "No access token stored");
            throw new ProviderAuthException("No access token available for account: " + account.getEmailAddress());
        }

        boolean needsRefresh = token.getExpiry() == null
                || token.getExpiry().isBefore(Instant.now().plusSeconds(REFRESH_MARGIN_SECONDS));
        if (needsRefresh) {
            log.info("Refreshing access token for account: {}", account.getEmailAddress());
            refreshAccessToken(account);
        }
        return account.getToken().getAccessToken();
    }

    /**
     * Called when the provider answered 401 although the token looked valid.
     */
    public String refreshTokenOn401(MailAccount account) throws ProviderException {
        log.info("Received 401, refreshing access token for account: {}", account.getEmailAddress());
        refreshAccessToken(account);
        return account.getToken().getAccessToken();
    }

    void refreshAccessToken(MailAccount account) throws ProviderException {
        OAuthToken token = account.getToken();
        if (token == null || token.getRefreshToken() == null || token.getRefreshToken().isEmpty()) {
            markExpired(account, "No refresh token available");
            throw new ProviderAuthException("Access token expired and no refresh token available for account: "
                    + account.getEmailAddress() + ". Please re-authenticate.");
        }
        if (clientId == null || clientId.isEmpty() || clientSecret == null || clientSecret.isEmpty()) {
            throw new ProviderAuthException("Google OAuth client is not configured. Set mailsync.google.client-id and mailsync.google.client-secret");
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);

        MultiValueMap<String, String> body = new LinkedMultiValueMap<>();
        body.add("client_id", clientId);
        body.add("client_secret", clientSecret);
        body.add("refresh_token", token.getRefreshToken());
        body.add("grant_type", "refresh_token");

        ResponseEntity<String> response;
        try {
            response = restTemplate.postForEntity(TOKEN_ENDPOINT, new HttpEntity<>(body, headers), String.class);
        } catch (HttpClientErrorException e) {
            // 400 invalid_grant / 401: the refresh token was revoked
            markExpired(account, "Token refresh rejected: " + e.getStatusCode());
            throw new ProviderAuthException("Failed to refresh access token for account: "
                    + account.getEmailAddress() + ". Error: " + e.getMessage(), e);
        } catch (RestClientException e) {
            markError(account, "Token refresh failed: " + e.getMessage());
            log.error("Failed to refresh access token for account {}: {}", account.getEmailAddress(), e.getMessage());
            throw new TransientProviderException("Failed to refresh access token for account: "
                    + account.getEmailAddress() + ". Error: " + e.getMessage(), e);
        }

        if (!response.getStatusCode().is2xxSuccessful() || response.getBody() == null) {
            markError(account, "Token refresh returned " + response.getStatusCode());
            throw new TransientProviderException("Failed to refresh token. Status: " + response.getStatusCode());
        }

        try {
            JsonNode json = objectMapper.readTree(response.getBody());
            if (!json.has("access_token")) {
                throw new TransientProviderException("Token refresh response missing access_token");
            }
            long expiresInSeconds = json.has("expires_in") ? json.get("expires_in").asLong() : 3600;
            Instant expiresAt = Instant.now().plusSeconds(expiresInSeconds);

            String accessToken = json.get("access_token").asText();
            String rotatedRefreshToken = json.hasNonNull("refresh_token") ? json.get("refresh_token").asText() : null;
            update(account, a -> {
                OAuthToken stored = a.getToken() != null ? a.getToken() : new OAuthToken();
                stored.setAccessToken(accessToken);
                stored.setExpiry(expiresAt);
                if (rotatedRefreshToken != null) {
                    stored.setRefreshToken(rotatedRefreshToken);
                } else if (stored.getRefreshToken() == null) {
                    stored.setRefreshToken(token.getRefreshToken());
                }
                a.setToken(stored);
                a.setSyncStatus(SyncStatus.ACTIVE);
            });
            log.info("Token refreshed successfully for account: {}, expires at: {}", account.getEmailAddress(), expiresAt);
        } catch (com.fasterxml.jackson.core.JsonProcessingException e) {
            throw new TransientProviderException("Unreadable token refresh response: " + e.getMessage(), e);
        }
    }

    private void markExpired(MailAccount account, String reason) {
        update(account, a -> {
            a.setSyncStatus(SyncStatus.EXPIRED);
            a.setLastError(reason);
        });
    }

    private void markError(MailAccount account, String reason) {
        update(account, a -> {
            a.setSyncStatus(SyncStatus.ERROR);
            a.setLastError(reason);
        });
    }

    /**
     * Applies the change to the caller's copy and to the stored row, then saves the stored row.
     */
    private void update(MailAccount account, Consumer<MailAccount> change) {
        change.accept(account);
        MailAccount stored = mailAccountRepository.findById(account.getId()).orElse(null);
        if (stored == null) {
            log.warn("Account {} was removed while its token was being refreshed", account.getEmailAddress());
            return;
        }
        if (stored != account) {
            change.accept(stored);
        }
        mailAccountRepository.save(stored);
    }
}
