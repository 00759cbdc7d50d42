package cofounder.google.auth.callback;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Terminal outcome of a {@link CallbackListener}: the authorization code, the
 * provider's error string, or a timeout.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class CallbackResult {
    CallbackState state;
    String code;
    String error;

    public static CallbackResult codeReceived(String code) {
        return new CallbackResult(CallbackState.CODE_RECEIVED, code, null);
    }

    public static CallbackResult failed(String error) {
        return new CallbackResult(CallbackState.FAILED, null, error);
    }

    public static CallbackResult timedOut() {
        return new CallbackResult(CallbackState.TIMED_OUT, null, null);
    }
}
