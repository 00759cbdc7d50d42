package cofounder.google.auth.service;

import cofounder.google.auth.callback.CallbackListener;
import cofounder.google.auth.callback.CallbackListenerFactory;
import cofounder.google.auth.callback.CallbackResult;
import cofounder.google.auth.callback.CallbackState;
import cofounder.google.auth.config.AuthorizationUrlFactory;
import cofounder.google.auth.config.GoogleAuthProperties;
import cofounder.google.auth.entity.AccountCredential;
import cofounder.google.auth.entity.TokenResponse;
import cofounder.google.auth.exception.AuthorizationFlowException;
import cofounder.google.auth.exception.ConfigurationException;
import cofounder.google.auth.repository.AccountIds;
import cofounder.google.auth.repository.CredentialStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Runs the interactive authorization-code flow and stores the resulting credential.
 * Nothing is persisted unless every step succeeds.
 */
@Slf4j
@Service
public class AuthorizationFlowService {
    private final ScopeCatalog scopeCatalog;
    private final ApiEnablementRegistry enablementRegistry;
    private final AuthorizationUrlFactory authorizationUrlFactory;
    private final CallbackListenerFactory callbackListenerFactory;
    private final BrowserLauncher browserLauncher;
    private final GoogleTokenClient tokenClient;
    private final CredentialStore credentialStore;
    private final GoogleAuthProperties properties;
    private final Clock clock;

    public AuthorizationFlowService(ScopeCatalog scopeCatalog,
                                    ApiEnablementRegistry enablementRegistry,
                                    AuthorizationUrlFactory authorizationUrlFactory,
                                    CallbackListenerFactory callbackListenerFactory,
                                    BrowserLauncher browserLauncher,
                                    GoogleTokenClient tokenClient,
                                    CredentialStore credentialStore,
                                    GoogleAuthProperties properties,
                                    Clock clock) {
        this.scopeCatalog = scopeCatalog;
        this.enablementRegistry = enablementRegistry;
        this.authorizationUrlFactory = authorizationUrlFactory;
        this.callbackListenerFactory = callbackListenerFactory;
        this.browserLauncher = browserLauncher;
        this.tokenClient = tokenClient;
        this.credentialStore = credentialStore;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Authorizes {@code request.account} and replaces any credential stored for it.
     * Not safe to run twice at once: the callback listener binds a fixed port.
     */
    public AccountCredential runSetup(SetupRequest request) {
        if (request.getAccount() == null || request.getAccount().isBlank()) {
            throw ConfigurationException.missingOption("account", "setup");
        }
        String account = AccountIds.requireValid(request.getAccount());
        requireClientCredentials(request.getClientId(), request.getClientSecret());

        List<String> scopeNames = scopeNamesOrDefault(request.getScopeNames());
        List<String> scopeUrls = scopeCatalog.resolve(scopeNames);

        String roundSelector = request.getRoundSelector() != null
            ? request.getRoundSelector()
            : properties.getDefaultRounds();
        Map<String, Boolean> enabledFeatures = enablementRegistry.applyRounds(
            enablementRegistry.defaultFeatures(), roundSelector);
        enabledFeatures = enablementRegistry.applyOverrides(enabledFeatures, request.getFeatureOverrides());

        String authorizationUrl = authorizationUrlFactory.buildAuthorizationUrl(request.getClientId(), scopeUrls);
        log.info("Starting OAuth setup for {} (scopes: {}, rounds: {})", account, scopeNames, roundSelector);

        String code = awaitAuthorizationCode(authorizationUrl);
        log.info("Authorization code received for {}, exchanging for tokens", account);

        TokenResponse tokens = tokenClient.exchangeCode(request.getClientId(), request.getClientSecret(), code);

        AccountCredential credential = AccountCredential.builder()
            .account(account)
            .clientId(request.getClientId())
            .clientSecret(request.getClientSecret())
            .accessToken(tokens.getAccessToken())
            .refreshToken(tokens.getRefreshToken())
            .scopes(new ArrayList<>(scopeNames))
            .enabledFeatures(enabledFeatures)
            .expiry(tokens.expiryFrom(clock.instant()))
            .build();
        credentialStore.save(account, credential);
        log.info("Credentials saved for {}", account);
        return credential;
    }

    /**
     * Builds the URL {@link #runSetup} would open, without starting a listener.
     */
    public String authorizationUrl(String clientId, String clientSecret, List<String> scopeNames) {
        requireClientCredentials(clientId, clientSecret);
        List<String> scopeUrls = scopeCatalog.resolve(scopeNamesOrDefault(scopeNames));
        return authorizationUrlFactory.buildAuthorizationUrl(clientId, scopeUrls);
    }

    private String awaitAuthorizationCode(String authorizationUrl) {
        try (CallbackListener listener = callbackListenerFactory.create()) {
            // bind before the browser can redirect
            listener.start();
            browserLauncher.open(authorizationUrl);

            CallbackResult result = listener.awaitResult();
            if (result.getState() == CallbackState.CODE_RECEIVED) {
                return result.getCode();
            } else if (result.getState() == CallbackState.FAILED) {
                throw AuthorizationFlowException.denied(result.getError());
            } else if (result.getState() == CallbackState.TIMED_OUT) {
                throw AuthorizationFlowException.timedOut(properties.getCallbackTimeout());
            }
            throw new IllegalStateException("Callback listener returned non-terminal state " + result.getState());
        }
    }

    private static void requireClientCredentials(String clientId, String clientSecret) {
        if (clientId == null || clientId.isBlank() || clientSecret == null || clientSecret.isBlank()) {
            throw ConfigurationException.missingClientCredentials();
        }
    }

    private static List<String> scopeNamesOrDefault(List<String> scopeNames) {
        return scopeNames == null || scopeNames.isEmpty() ? ScopeCatalog.DEFAULT_SCOPES : scopeNames;
    }
}
