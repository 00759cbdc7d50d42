package cofounder.google.auth.repository;

import cofounder.google.auth.exception.ConfigurationException;

/**
 * Account identifiers double as file names, so anything that could escape the
 * credentials directory is rejected.
 */
public final class AccountIds {

    private AccountIds() {
    }

    public static String requireValid(String account) {
        if (account == null || account.isBlank() || account.startsWith(".")
                || account.contains("/") || account.contains("\\") || account.indexOf('\0') >= 0) {
            throw ConfigurationException.invalidAccount(account);
        }
        return account;
    }
}
