package cofounder.google.auth.callback;

import cofounder.google.auth.exception.AuthorizationFlowException;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.MultiValueMap;
import org.springframework.web.util.HtmlUtils;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * {@link CallbackListener} backed by the JDK HTTP server, bound to the loopback address.
 * Requests to {@code /} carrying {@code error} or {@code code} end the session; anything else gets a 404.
 */
@Slf4j
public class LoopbackCallbackListener implements CallbackListener {
    private static final String SUCCESS_PAGE = "<html><body>"
        + "<h1>Authorization Successful!</h1>"
        + "<p>You can close this window and return to the terminal.</p>"
        + "</body></html>";

    private final int port;
    private final Duration timeout;
    private final AtomicReference<CallbackState> state = new AtomicReference<>(CallbackState.LISTENING);
    private final CompletableFuture<CallbackResult> result = new CompletableFuture<>();

    private HttpServer server;
    private ExecutorService dispatcher;

    public LoopbackCallbackListener(int port, Duration timeout) {
        this.port = port;
        this.timeout = timeout;
    }

    @Override
    public synchronized void start() {
        if (server != null || result.isDone()) {
            throw new IllegalStateException("Callback listener has already been started");
        }
        try {
            server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), port), 0);
        } catch (IOException e) {
            throw AuthorizationFlowException.portUnavailable(port, e);
        }
        dispatcher = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "oauth-callback");
            thread.setDaemon(true);
            return thread;
        });
        server.setExecutor(dispatcher);
        server.createContext("/", this::handle);
        server.start();
        log.info("Listening for OAuth callback on port {}...", getPort());
    }

    @Override
    public CallbackResult awaitResult() {
        try {
            return result.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            complete(CallbackResult.timedOut());
            // a callback may have won the race against the timeout
            return result.join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw AuthorizationFlowException.interrupted(e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Callback result completed exceptionally", e.getCause());
        } finally {
            close();
        }
    }

    @Override
    public CallbackState getState() {
        return state.get();
    }

    /**
     * The bound port; differs from the configured one only when that was 0.
     */
    public synchronized int getPort() {
        return server != null ? server.getAddress().getPort() : port;
    }

    @Override
    public synchronized void close() {
        if (server == null) {
            return;
        }
        server.stop(1);
        dispatcher.shutdownNow();
        server = null;
        log.debug("Callback listener on port {} closed in state {}", port, state.get());
    }

    private void handle(HttpExchange exchange) throws IOException {
        try {
            MultiValueMap<String, String> params = UriComponentsBuilder.fromUri(exchange.getRequestURI())
                .build()
                .getQueryParams();
            String error = firstParam(params, "error");
            String code = firstParam(params, "code");

            String path = exchange.getRequestURI().getPath();
            if (result.isDone() || !(path == null || path.isEmpty() || "/".equals(path))) {
                respond(exchange, 404, "Not found");
            } else if (error != null) {
                respond(exchange, 200, failurePage(error));
                complete(CallbackResult.failed(error));
            } else if (code != null) {
                respond(exchange, 200, SUCCESS_PAGE);
                complete(CallbackResult.codeReceived(code));
            } else {
                log.debug("Ignoring callback request without code or error: {}", path);
                respond(exchange, 404, "Not found");
            }
        } finally {
            exchange.close();
        }
    }

    private void complete(CallbackResult callbackResult) {
        // state must be terminal before any waiter observes the result
        synchronized (state) {
            if (!result.isDone()) {
                state.set(callbackResult.getState());
                result.complete(callbackResult);
            }
        }
    }

    private static String firstParam(MultiValueMap<String, String> params, String name) {
        String value = params.getFirst(name);
        if (value == null || value.isEmpty()) {
            return null;
        }
        return UriUtils.decode(value, StandardCharsets.UTF_8);
    }

    private static String failurePage(String error) {
        return "<html><body>"
            + "<h1>Authorization Failed</h1>"
            + "<p>Error: " + HtmlUtils.htmlEscape(error) + "</p>"
            + "<p>You can close this window.</p>"
            + "</body></html>";
    }

    private static void respond(HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        String contentType = status == 200 ? "text/html; charset=utf-8" : "text/plain; charset=utf-8";
        exchange.getResponseHeaders().set("Content-Type", contentType);
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }
}
