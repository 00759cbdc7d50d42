package cofounder.google.auth.exception;

import java.util.Collection;

/**
 * Invalid input detected before any network or listener activity.
 */
public class ConfigurationException extends GoogleAuthException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, String hint) {
        super(message, hint);
    }

    public static ConfigurationException unknownScopes(Collection<String> names) {
        return new ConfigurationException("Unknown scope: " + String.join(", ", names),
            "Run 'auth scopes' to list available scopes");
    }

    public static ConfigurationException unknownFeature(String token) {
        return new ConfigurationException("Unknown API in override: " + token,
            "Run 'auth api-rounds' to list available APIs");
    }

    public static ConfigurationException invalidRoundSelector(String selector) {
        return new ConfigurationException("Invalid rounds selector: '" + selector + "'",
            "Use round numbers, ranges or 'all', e.g. \"1,2\", \"1-3\", \"all\"");
    }

    public static ConfigurationException missingClientCredentials() {
        return new ConfigurationException("--client-id and --client-secret are required for setup",
            "Create an OAuth 2.0 Client ID (Desktop app type) at https://console.cloud.google.com/apis/credentials");
    }

    public static ConfigurationException missingOption(String option, String command) {
        return new ConfigurationException("--" + option + " is required for " + command);
    }

    public static ConfigurationException invalidAccount(String account) {
        return new ConfigurationException("Invalid account identifier: '" + account + "'");
    }
}
