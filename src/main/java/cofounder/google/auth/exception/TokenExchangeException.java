package cofounder.google.auth.exception;

/**
 * The authorization code could not be exchanged for tokens.
 */
public class TokenExchangeException extends GoogleAuthException {

    public TokenExchangeException(String message, Throwable cause) {
        super(message, "Run setup again", cause);
    }

    public TokenExchangeException(String message) {
        this(message, null);
    }
}
