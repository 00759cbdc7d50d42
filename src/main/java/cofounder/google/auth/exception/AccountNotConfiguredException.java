package cofounder.google.auth.exception;

/**
 * No usable credential record exists for the account, either because none was ever
 * saved or because the stored one cannot be read.
 */
public class AccountNotConfiguredException extends GoogleAuthException {

    public AccountNotConfiguredException(String message, String account, Throwable cause) {
        super(message, setupHint(account), cause);
    }

    public static AccountNotConfiguredException notFound(String account) {
        return new AccountNotConfiguredException("No credentials found for " + account, account, null);
    }

    public static AccountNotConfiguredException unreadable(String account, Throwable cause) {
        return new AccountNotConfiguredException(
            "Stored credentials for " + account + " are unreadable", account, cause);
    }
}
