package cofounder.google.auth.exception;

import lombok.Getter;

/**
 * Base class for every failure the auth core reports to its callers.
 * The message is meant for the person at the terminal; {@link #getHint()} carries the
 * next step to take, when there is one.
 */
@Getter
public class GoogleAuthException extends RuntimeException {
    private final String hint;

    public GoogleAuthException(String message) {
        this(message, null, null);
    }

    public GoogleAuthException(String message, String hint) {
        this(message, hint, null);
    }

    public GoogleAuthException(String message, String hint, Throwable cause) {
        super(message, cause);
        this.hint = hint;
    }

    static String setupHint(String account) {
        return "Run: auth setup --account=" + account;
    }
}
