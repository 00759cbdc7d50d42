package cofounder.google.auth.service;

import cofounder.google.auth.entity.AccountCredential;
import cofounder.google.auth.entity.ApiFeature;
import cofounder.google.auth.exception.ConfigurationException;
import com.google.api.client.auth.oauth2.BearerToken;
import com.google.api.client.auth.oauth2.Credential;
import com.google.api.client.http.HttpRequestInitializer;
import com.google.api.client.http.HttpTransport;
import com.google.api.client.json.JsonFactory;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A ready-to-use client for one account, bound to an access token that was valid when
 * it was handed out. Pass {@link #getRequestInitializer()} and {@link #getApplicationName()} to any
 * Google API client builder.
 */
@Getter
@ToString(onlyExplicitlyIncluded = true)
public class AuthenticatedClient {
    @ToString.Include
    private final String account;
    private final String accessToken;
    @ToString.Include
    private final Instant expiry;
    private final Map<String, Boolean> enabledFeatures;
    private final Credential credential;
    private final String applicationName;

    AuthenticatedClient(AccountCredential stored, HttpTransport transport, JsonFactory jsonFactory,
                        String applicationName) {
        this.account = stored.getAccount();
        this.applicationName = applicationName;
        this.accessToken = stored.getAccessToken();
        this.expiry = stored.getExpiry();
        this.enabledFeatures = Collections.unmodifiableMap(new LinkedHashMap<>(stored.getEnabledFeatures()));

        Credential credential = new Credential.Builder(BearerToken.authorizationHeaderAccessMethod())
            .setTransport(transport)
            .setJsonFactory(jsonFactory)
            .build();
        credential.setAccessToken(accessToken);
        credential.setExpirationTimeMilliseconds(expiry.toEpochMilli());
        this.credential = credential;
    }

    public HttpRequestInitializer getRequestInitializer() {
        return credential;
    }

    public String getAuthorizationHeader() {
        return "Bearer " + accessToken;
    }

    public boolean isFeatureEnabled(ApiFeature feature) {
        return Boolean.TRUE.equals(enabledFeatures.get(feature.getKey()));
    }

    /**
     * @throws ConfigurationException if the feature is switched off for this account
     */
    public void requireFeature(ApiFeature feature) {
        if (!isFeatureEnabled(feature)) {
            throw new ConfigurationException(feature.getDescription() + " API is not enabled for " + account,
                "Enable the API in Google Cloud Console, then run: auth configure-apis --account=" + account
                    + " --apis=+" + feature.getKey());
        }
    }
}
