package cofounder.google.auth.callback;

public enum CallbackState {
    LISTENING,
    CODE_RECEIVED,
    FAILED,
    TIMED_OUT;

    public boolean isTerminal() {
        return this != LISTENING;
    }
}
