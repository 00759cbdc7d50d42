package cofounder.google.auth.repository;

import cofounder.google.auth.entity.AccountCredential;
import cofounder.google.auth.entity.ApiFeature;

import java.util.ArrayList;
import java.util.List;

/**
 * Field-level rules every stored credential must satisfy.
 */
final class CredentialSchema {

    private CredentialSchema() {
    }

    static List<String> violations(AccountCredential credential) {
        List<String> violations = new ArrayList<>();
        if (isBlank(credential.getAccount())) {
            violations.add("account is missing");
        }
        if (isBlank(credential.getClientId()) || isBlank(credential.getClientSecret())) {
            violations.add("client_id and client_secret are required");
        }
        if ((credential.getAccessToken() == null) != (credential.getExpiry() == null)) {
            violations.add("access_token and expiry must be set together");
        }
        if (credential.getScopes() == null) {
            violations.add("scopes are missing");
        }
        if (credential.getEnabledFeatures() == null) {
            violations.add("enabled_features are missing");
        } else {
            credential.getEnabledFeatures().forEach((key, enabled) -> {
                if (ApiFeature.fromKey(key).isEmpty()) {
                    violations.add("unknown feature '" + key + "'");
                }
                if (enabled == null) {
                    violations.add("feature '" + key + "' has no value");
                }
            });
        }
        return violations;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
