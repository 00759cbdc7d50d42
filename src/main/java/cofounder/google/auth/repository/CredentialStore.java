package cofounder.google.auth.repository;

import cofounder.google.auth.entity.AccountCredential;

import java.util.List;
import java.util.Optional;

/**
 * Persistence for credential records, one per account. Implementations never reach
 * the network.
 */
public interface CredentialStore {

    /**
     * @return the stored record, or empty if the account was never set up
     * @throws cofounder.google.auth.exception.AccountNotConfiguredException if a record
     *         exists but cannot be read
     */
    Optional<AccountCredential> load(String account);

    /**
     * Replaces any existing record for {@code account}. A failed save leaves the
     * previous record intact.
     */
    void save(String account, AccountCredential credential);

    List<String> list();
}
