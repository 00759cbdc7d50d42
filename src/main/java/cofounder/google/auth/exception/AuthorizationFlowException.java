package cofounder.google.auth.exception;

import java.time.Duration;

/**
 * The interactive authorization step did not produce a code.
 */
public class AuthorizationFlowException extends GoogleAuthException {

    public AuthorizationFlowException(String message, String hint, Throwable cause) {
        super(message, hint, cause);
    }

    public static AuthorizationFlowException denied(String error) {
        return new AuthorizationFlowException("Authorization failed: " + error, null, null);
    }

    public static AuthorizationFlowException timedOut(Duration timeout) {
        String window = timeout.toSeconds() % 60 == 0
            ? timeout.toMinutes() + " minutes"
            : timeout.toSeconds() + " seconds";
        return new AuthorizationFlowException("Authorization timed out after " + window, "Run setup again", null);
    }

    public static AuthorizationFlowException portUnavailable(int port, Throwable cause) {
        return new AuthorizationFlowException(
            "Failed to start callback server on port " + port + ": " + cause.getMessage(),
            "Another setup may still be running; stop it before retrying", cause);
    }

    public static AuthorizationFlowException interrupted(Throwable cause) {
        return new AuthorizationFlowException("Interrupted while waiting for authorization", null, cause);
    }
}
