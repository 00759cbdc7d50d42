package cofounder.google.auth.callback;

/**
 * One-shot receiver for the OAuth redirect.
 * <p>
 * Lifecycle: {@link #start()} binds the port and enters {@link CallbackState#LISTENING};
 * {@link #awaitResult()} blocks until a terminal state is reached, then releases the
 * port. A listener is never reused.
 */
public interface CallbackListener extends AutoCloseable {

    /**
     * @throws cofounder.google.auth.exception.AuthorizationFlowException if the port cannot be bound
     */
    void start();

    CallbackResult awaitResult();

    CallbackState getState();

    @Override
    void close();
}
