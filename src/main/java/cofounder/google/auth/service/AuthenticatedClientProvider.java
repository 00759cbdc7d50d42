package cofounder.google.auth.service;

/**
 * The only entry point downstream API clients use. Implementations refresh stale
 * tokens transparently; callers must not cache tokens themselves.
 */
public interface AuthenticatedClientProvider {

    /**
     * @throws cofounder.google.auth.exception.AccountNotConfiguredException if setup never ran for the account
     * @throws cofounder.google.auth.exception.TokenRefreshException if a stale token cannot be renewed
     */
    AuthenticatedClient getAuthenticatedClient(String account);
}
