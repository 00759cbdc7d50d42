package cofounder.google.auth.service;

import cofounder.google.auth.entity.AccountCredential;
import cofounder.google.auth.exception.AccountNotConfiguredException;
import cofounder.google.auth.exception.ConfigurationException;
import cofounder.google.auth.repository.CredentialStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Changes which APIs are enabled for an already configured account. Tokens and scopes
 * are left as they are.
 */
@Slf4j
@Service
public class ApiConfigurationService {
    private final CredentialStore credentialStore;
    private final ApiEnablementRegistry enablementRegistry;

    public ApiConfigurationService(CredentialStore credentialStore, ApiEnablementRegistry enablementRegistry) {
        this.credentialStore = credentialStore;
        this.enablementRegistry = enablementRegistry;
    }

    /**
     * Applies {@code roundSelector} first (if given), then {@code overrides} (if given).
     */
    public AccountCredential configure(String account, String roundSelector, String overrides) {
        if (roundSelector == null && overrides == null) {
            throw new ConfigurationException("--rounds or --apis is required",
                "Example: auth configure-apis --account=user@example.com --rounds=1,2,3");
        }
        AccountCredential credential = credentialStore.load(account)
            .orElseThrow(() -> AccountNotConfiguredException.notFound(account));

        Map<String, Boolean> features = credential.getEnabledFeatures();
        if (roundSelector != null) {
            features = enablementRegistry.applyRounds(features, roundSelector);
        }
        if (overrides != null) {
            features = enablementRegistry.applyOverrides(features, overrides);
        }

        AccountCredential updated = credential.toBuilder().enabledFeatures(features).build();
        credentialStore.save(account, updated);
        log.info("API configuration saved for {}: {} of {} enabled",
            account, updated.countEnabledFeatures(), features.size());
        return updated;
    }
}
