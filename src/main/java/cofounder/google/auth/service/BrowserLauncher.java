package cofounder.google.auth.service;

public interface BrowserLauncher {

    /**
     * Points the user at {@code url}. Must not fail the flow when no browser is
     * available; the URL is always printed as a fallback.
     */
    void open(String url);
}
