package cofounder.google.auth.exception;

public class CredentialStoreException extends GoogleAuthException {

    public CredentialStoreException(String message) {
        super(message);
    }

    public CredentialStoreException(String message, Throwable cause) {
        super(message, null, cause);
    }
}
