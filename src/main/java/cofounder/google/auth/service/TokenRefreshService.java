package cofounder.google.auth.service;

import cofounder.google.auth.config.GoogleAuthProperties;
import cofounder.google.auth.entity.AccountCredential;
import cofounder.google.auth.entity.TokenResponse;
import cofounder.google.auth.exception.AccountNotConfiguredException;
import cofounder.google.auth.exception.TokenRefreshException;
import cofounder.google.auth.repository.CredentialStore;
import com.google.api.client.http.HttpTransport;
import com.google.api.client.json.JsonFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;

@Slf4j
@Service
public class TokenRefreshService implements AuthenticatedClientProvider {
    private final CredentialStore credentialStore;
    private final GoogleTokenClient tokenClient;
    private final GoogleAuthProperties properties;
    private final Clock clock;
    private final HttpTransport httpTransport;
    private final JsonFactory jsonFactory;
    private final ReentrantLock lock = new ReentrantLock();

    public TokenRefreshService(CredentialStore credentialStore, GoogleTokenClient tokenClient,
                               GoogleAuthProperties properties, Clock clock,
                               HttpTransport httpTransport, JsonFactory jsonFactory) {
        this.credentialStore = credentialStore;
        this.tokenClient = tokenClient;
        this.properties = properties;
        this.clock = clock;
        this.httpTransport = httpTransport;
        this.jsonFactory = jsonFactory;
    }

    @Override
    public AuthenticatedClient getAuthenticatedClient(String account) {
        return ensureValid(account);
    }

    /**
     * Returns a client for the account, refreshing the access token first if it is
     * expired or expires within the configured margin.
     * A failed refresh leaves the stored credential untouched.
     */
    public AuthenticatedClient ensureValid(String account) {
        lock.lock();
        try {
            AccountCredential credential = loadRequired(account);
            if (!credential.isExpired(clock.instant(), properties.getExpiryMargin())) {
                return toClient(credential);
            }
            return toClient(refreshAndSave(credential));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Refreshes regardless of the current expiry.
     */
    public AuthenticatedClient refresh(String account) {
        lock.lock();
        try {
            return toClient(refreshAndSave(loadRequired(account)));
        } finally {
            lock.unlock();
        }
    }

    private AccountCredential loadRequired(String account) {
        return credentialStore.load(account)
            .orElseThrow(() -> AccountNotConfiguredException.notFound(account));
    }

    private AccountCredential refreshAndSave(AccountCredential stored) {
        String account = stored.getAccount();
        if (!stored.hasRefreshToken()) {
            throw TokenRefreshException.missingRefreshToken(account);
        }
        log.info("Refreshing access token for account: {}", account);

        TokenResponse tokens = tokenClient.refresh(stored);
        Instant expiry = tokens.expiryFrom(clock.instant());
        if (stored.getExpiry() != null && !expiry.isAfter(stored.getExpiry())) {
            // the refresh token is already redeemed, so the response is kept; expiry never moves backwards
            log.debug("Provider expiry {} for {} is not after stored expiry {}", expiry, account, stored.getExpiry());
            expiry = stored.getExpiry();
        }

        AccountCredential refreshed = stored.toBuilder()
            .accessToken(tokens.getAccessToken())
            .expiry(expiry)
            // an omitted refresh token means the old one is still valid
            .refreshToken(tokens.getRefreshToken() != null ? tokens.getRefreshToken() : stored.getRefreshToken())
            .build();
        credentialStore.save(account, refreshed);

        log.info("Token refreshed successfully for account: {}, expires at: {}", account, expiry);
        return refreshed;
    }

    private AuthenticatedClient toClient(AccountCredential credential) {
        return new AuthenticatedClient(credential, httpTransport, jsonFactory, properties.getApplicationName());
    }
}
