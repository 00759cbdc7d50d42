package cofounder.google.auth.service;

import cofounder.google.auth.entity.AccountCredential;
import cofounder.google.auth.entity.ApiFeature;
import cofounder.google.auth.exception.AccountNotConfiguredException;
import cofounder.google.auth.exception.ConfigurationException;
import cofounder.google.auth.repository.InMemoryCredentialStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ApiConfigurationServiceTest {
    private static final String ACCOUNT = "me@example.com";

    private InMemoryCredentialStore credentialStore;
    private ApiConfigurationService configurationService;
    private AccountCredential stored;

    @BeforeEach
    void setUp() {
        credentialStore = new InMemoryCredentialStore();
        configurationService = new ApiConfigurationService(credentialStore, new ApiEnablementRegistry());
        stored = AccountCredential.builder()
            .account(ACCOUNT)
            .clientId("client-id")
            .clientSecret("client-secret")
            .accessToken("ya29.access")
            .refreshToken("1//refresh")
            .scopes(List.of("drive"))
            .enabledFeatures(new ApiEnablementRegistry().defaultFeatures())
            .expiry(Instant.parse("2026-10-18T12:00:00Z"))
            .build();
        credentialStore.save(ACCOUNT, stored);
    }

    @Test
    void configure_WithRoundsAndOverrides_ShouldApplyRoundsFirst() {
        // When
        AccountCredential updated = configurationService.configure(ACCOUNT, "1-3", "-vision");

        // Then
        assertTrue(updated.isFeatureEnabled(ApiFeature.AI));
        assertTrue(updated.isFeatureEnabled(ApiFeature.GMAIL));
        assertFalse(updated.isFeatureEnabled(ApiFeature.VISION));
        assertFalse(updated.isFeatureEnabled(ApiFeature.IAM));
        assertEquals(updated, credentialStore.load(ACCOUNT).orElseThrow());
    }

    @Test
    void configure_ShouldKeepTokensAndScopes() {
        AccountCredential updated = configurationService.configure(ACCOUNT, null, "+ai");

        assertEquals(stored.getAccessToken(), updated.getAccessToken());
        assertEquals(stored.getRefreshToken(), updated.getRefreshToken());
        assertEquals(stored.getExpiry(), updated.getExpiry());
        assertEquals(stored.getScopes(), updated.getScopes());
        assertEquals(stored.countEnabledFeatures() + 1, updated.countEnabledFeatures());
    }

    @Test
    void configure_WithUnknownFeature_ShouldLeaveRecordUnchanged() {
        assertThrows(ConfigurationException.class, () -> configurationService.configure(ACCOUNT, "all", "+ai,+dropbox"));

        assertEquals(stored, credentialStore.load(ACCOUNT).orElseThrow());
        assertEquals(1, credentialStore.getSaveCount());
    }

    @Test
    void configure_WithoutSelection_ShouldThrow() {
        assertThrows(ConfigurationException.class, () -> configurationService.configure(ACCOUNT, null, null));
    }

    @Test
    void configure_ForUnknownAccount_ShouldThrowNotConfigured() {
        assertThrows(AccountNotConfiguredException.class,
            () -> configurationService.configure("nobody@example.com", "1", null));
    }
}
