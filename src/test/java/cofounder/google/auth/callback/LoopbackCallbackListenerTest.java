package cofounder.google.auth.callback;

import cofounder.google.auth.exception.AuthorizationFlowException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class LoopbackCallbackListenerTest {

    private final HttpClient httpClient = HttpClient.newBuilder()
        .connectTimeout(Duration.ofSeconds(5))
        .build();

    private LoopbackCallbackListener listener;

    @AfterEach
    void tearDown() {
        if (listener != null) {
            listener.close();
        }
    }

    @Test
    void callbackWithCode_ShouldCompleteWithDecodedCode() throws Exception {
        // Given
        listener = startListener(Duration.ofSeconds(10));
        CompletableFuture<CallbackResult> pending = CompletableFuture.supplyAsync(listener::awaitResult);

        // When
        HttpResponse<String> response = get("/?code=4%2F0AbCd&scope=drive");

        // Then
        assertEquals(200, response.statusCode());
        assertTrue(response.body().contains("Authorization Successful"));
        CallbackResult result = pending.get(5, TimeUnit.SECONDS);
        assertEquals(CallbackState.CODE_RECEIVED, result.getState());
        assertEquals("4/0AbCd", result.getCode());
        assertEquals(CallbackState.CODE_RECEIVED, listener.getState());
    }

    @Test
    void callbackWithError_ShouldCompleteAsFailed() throws Exception {
        // Given
        listener = startListener(Duration.ofSeconds(10));
        CompletableFuture<CallbackResult> pending = CompletableFuture.supplyAsync(listener::awaitResult);

        // When
        HttpResponse<String> response = get("/?error=access_denied");

        // Then
        assertEquals(200, response.statusCode());
        assertTrue(response.body().contains("Error: access_denied"));
        CallbackResult result = pending.get(5, TimeUnit.SECONDS);
        assertEquals(CallbackState.FAILED, result.getState());
        assertEquals("access_denied", result.getError());
        assertNull(result.getCode());
    }

    @Test
    void callbackWithErrorAndCode_ShouldPreferError() throws Exception {
        listener = startListener(Duration.ofSeconds(10));
        CompletableFuture<CallbackResult> pending = CompletableFuture.supplyAsync(listener::awaitResult);

        get("/?code=abc&error=%3Cscript%3E");

        CallbackResult result = pending.get(5, TimeUnit.SECONDS);
        assertEquals(CallbackState.FAILED, result.getState());
        assertEquals("<script>", result.getError());
    }

    @Test
    void errorPage_ShouldEscapeProviderError() throws Exception {
        listener = startListener(Duration.ofSeconds(10));
        CompletableFuture<CallbackResult> pending = CompletableFuture.supplyAsync(listener::awaitResult);

        HttpResponse<String> response = get("/?error=%3Cb%3Ebad%3C%2Fb%3E");

        assertFalse(response.body().contains("<b>bad</b>"));
        assertTrue(response.body().contains("&lt;b&gt;bad&lt;/b&gt;"));
        pending.get(5, TimeUnit.SECONDS);
    }

    @Test
    void unrelatedRequests_ShouldGet404AndKeepListening() throws Exception {
        // Given
        listener = startListener(Duration.ofSeconds(10));
        CompletableFuture<CallbackResult> pending = CompletableFuture.supplyAsync(listener::awaitResult);

        // When
        HttpResponse<String> favicon = get("/favicon.ico");
        HttpResponse<String> emptyCode = get("/?code=");
        HttpResponse<String> codeOnOtherPath = get("/favicon.ico?code=stray");
        HttpResponse<String> errorOnOtherPath = get("/other?error=access_denied");

        // Then
        assertEquals(404, favicon.statusCode());
        assertEquals(404, emptyCode.statusCode());
        assertEquals(404, codeOnOtherPath.statusCode());
        assertEquals(404, errorOnOtherPath.statusCode());
        assertEquals(CallbackState.LISTENING, listener.getState());
        assertFalse(pending.isDone());

        get("/?code=late-but-valid");
        assertEquals("late-but-valid", pending.get(5, TimeUnit.SECONDS).getCode());
    }

    @Test
    void awaitResult_WithoutCallback_ShouldTimeOutAndReleasePort() throws Exception {
        // Given
        listener = startListener(Duration.ofMillis(200));
        int port = listener.getPort();

        // When
        CallbackResult result = listener.awaitResult();

        // Then
        assertEquals(CallbackState.TIMED_OUT, result.getState());
        assertTrue(listener.getState().isTerminal());

        LoopbackCallbackListener next = new LoopbackCallbackListener(port, Duration.ofMillis(200));
        try {
            assertDoesNotThrow(next::start);
        } finally {
            next.close();
        }
    }

    @Test
    void start_WithPortInUse_ShouldFailWithPortUnavailable() throws Exception {
        try (ServerSocket occupied = new ServerSocket(0, 50, InetAddress.getLoopbackAddress())) {
            listener = new LoopbackCallbackListener(occupied.getLocalPort(), Duration.ofSeconds(1));

            AuthorizationFlowException exception = assertThrows(AuthorizationFlowException.class, listener::start);

            assertTrue(exception.getMessage().contains(String.valueOf(occupied.getLocalPort())));
            assertEquals(CallbackState.LISTENING, listener.getState());
        }
    }

    @Test
    void start_Twice_ShouldBeRejected() {
        listener = startListener(Duration.ofSeconds(1));

        assertThrows(IllegalStateException.class, listener::start);
    }

    @Test
    void close_ShouldBeIdempotent() {
        listener = startListener(Duration.ofSeconds(1));

        listener.close();

        assertDoesNotThrow(listener::close);
    }

    private LoopbackCallbackListener startListener(Duration timeout) {
        LoopbackCallbackListener started = new LoopbackCallbackListener(0, timeout);
        started.start();
        return started;
    }

    private HttpResponse<String> get(String pathAndQuery) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + listener.getPort() + pathAndQuery))
            .timeout(Duration.ofSeconds(5))
            .GET()
            .build();
        return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    }
}
