package cofounder.google.auth.exception;

/**
 * A stale access token could not be renewed. Fatal for the account until setup is
 * re-run; callers must not retry.
 */
public class TokenRefreshException extends GoogleAuthException {

    public TokenRefreshException(String message, String account, Throwable cause) {
        super(message, setupHint(account), cause);
    }

    public static TokenRefreshException rejected(String account, String reason, Throwable cause) {
        return new TokenRefreshException("Token refresh failed for " + account + ": " + reason
            + ". Re-run setup for this account", account, cause);
    }

    public static TokenRefreshException missingRefreshToken(String account) {
        return new TokenRefreshException("Access token expired and no refresh token is stored for " + account,
            account, null);
    }
}
