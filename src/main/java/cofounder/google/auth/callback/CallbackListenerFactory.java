package cofounder.google.auth.callback;

@FunctionalInterface
public interface CallbackListenerFactory {

    CallbackListener create();
}
