package cofounder.google.auth.cli;

import cofounder.google.auth.config.GoogleAuthProperties;
import cofounder.google.auth.entity.AccountCredential;
import cofounder.google.auth.entity.ApiFeature;
import cofounder.google.auth.entity.ApiRoundTable;
import cofounder.google.auth.entity.ScopeDefinition;
import cofounder.google.auth.exception.ConfigurationException;
import cofounder.google.auth.exception.GoogleAuthException;
import cofounder.google.auth.repository.CredentialStore;
import cofounder.google.auth.service.ApiConfigurationService;
import cofounder.google.auth.service.ApiEnablementRegistry;
import cofounder.google.auth.service.AuthenticatedClient;
import cofounder.google.auth.service.AuthorizationFlowService;
import cofounder.google.auth.service.ScopeCatalog;
import cofounder.google.auth.service.SetupRequest;
import cofounder.google.auth.service.TokenRefreshService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.io.PrintStream;
import java.time.Clock;
import java.time.Instant;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Command-line entry point: {@code auth <command> [--option=value ...]}.
 */
@Slf4j
@Component
public class AuthCommandRunner implements ApplicationRunner, ExitCodeGenerator {
    private final AuthorizationFlowService authorizationFlowService;
    private final TokenRefreshService tokenRefreshService;
    private final ApiConfigurationService apiConfigurationService;
    private final ApiEnablementRegistry enablementRegistry;
    private final ScopeCatalog scopeCatalog;
    private final CredentialStore credentialStore;
    private final GoogleAuthProperties properties;
    private final Clock clock;
    private final PrintStream out;
    private final PrintStream err;

    private int exitCode;

    public AuthCommandRunner(AuthorizationFlowService authorizationFlowService,
                             TokenRefreshService tokenRefreshService,
                             ApiConfigurationService apiConfigurationService,
                             ApiEnablementRegistry enablementRegistry,
                             ScopeCatalog scopeCatalog,
                             CredentialStore credentialStore,
                             GoogleAuthProperties properties,
                             Clock clock,
                             @Qualifier("consoleOut") PrintStream out,
                             @Qualifier("consoleErr") PrintStream err) {
        this.authorizationFlowService = authorizationFlowService;
        this.tokenRefreshService = tokenRefreshService;
        this.apiConfigurationService = apiConfigurationService;
        this.enablementRegistry = enablementRegistry;
        this.scopeCatalog = scopeCatalog;
        this.credentialStore = credentialStore;
        this.properties = properties;
        this.clock = clock;
        this.out = out;
        this.err = err;
    }

    @Override
    public void run(ApplicationArguments args) {
        List<String> positional = args.getNonOptionArgs();
        String command = positional.isEmpty() ? "help" : positional.get(0);
        try {
            dispatch(command, args);
            exitCode = 0;
        } catch (GoogleAuthException e) {
            log.debug("Command {} failed", command, e);
            err.println("Error: " + e.getMessage());
            if (e.getHint() != null) {
                err.println(e.getHint());
            }
            exitCode = 1;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private void dispatch(String command, ApplicationArguments args) {
        switch (command) {
            case "setup":
                setup(args);
                break;
            case "url":
                out.println(authorizationFlowService.authorizationUrl(
                    option(args, "client-id"), option(args, "client-secret"), scopeNames(args)));
                break;
            case "status":
                status(requireOption(args, "account", command));
                break;
            case "refresh":
                refresh(requireOption(args, "account", command));
                break;
            case "configure-apis":
                configureApis(requireOption(args, "account", command), option(args, "rounds"), option(args, "apis"));
                break;
            case "api-rounds":
                listApiRounds();
                break;
            case "list":
                listAccounts();
                break;
            case "scopes":
                listScopes();
                break;
            case "help":
            default:
                printHelp();
        }
    }

    private void setup(ApplicationArguments args) {
        String account = requireOption(args, "account", "setup");
        out.println();
        out.println("=== Google OAuth Setup for " + account + " ===");
        out.println();

        List<String> scopeNames = scopeNames(args);
        out.println("Scopes requested:");
        for (String name : scopeNames) {
            Optional<ScopeDefinition> definition = scopeCatalog.find(name);
            out.println("  - " + name + definition.map(d -> ": " + d.getDescription()).orElse(""));
        }
        out.println();

        AccountCredential credential = authorizationFlowService.runSetup(SetupRequest.builder()
            .account(account)
            .clientId(option(args, "client-id"))
            .clientSecret(option(args, "client-secret"))
            .scopeNames(scopeNames)
            .roundSelector(option(args, "rounds"))
            .featureOverrides(option(args, "apis"))
            .build());

        out.println("Credentials saved for " + account);
        out.println();
        out.println("Enabled APIs:");
        for (ApiFeature feature : enablementRegistry.enabledFeatures(credential.getEnabledFeatures())) {
            out.println("  + " + feature.getDescription());
        }
        out.println();
        out.println("You can now use Google services with --account=" + account);
        out.println("To change enabled APIs later: auth configure-apis --account=" + account);
    }

    private void status(String account) {
        Optional<AccountCredential> stored = credentialStore.load(account);
        if (stored.isEmpty()) {
            out.println();
            out.println("No credentials found for: " + account);
            out.println("Run: auth setup --account=" + account);
            return;
        }
        AccountCredential credential = stored.get();
        boolean expired = credential.isExpired(clock.instant(), properties.getExpiryMargin());

        out.println();
        out.println("Account: " + account);
        out.println("Status: " + (expired ? "EXPIRED" : "VALID"));
        out.println("Expiry: " + Optional.ofNullable(credential.getExpiry()).map(Instant::toString).orElse("Unknown"));
        out.println("Has refresh token: " + (credential.hasRefreshToken() ? "Yes" : "No"));
        if (!credential.getScopes().isEmpty()) {
            out.println("Scopes: " + String.join(", ", credential.getScopes()));
        }

        out.println();
        out.println("Enabled APIs:");
        for (ApiRoundTable.Round round : ApiRoundTable.rounds()) {
            List<ApiFeature> enabledInRound = round.getFeatures().stream()
                .filter(credential::isFeatureEnabled)
                .collect(Collectors.toList());
            if (!enabledInRound.isEmpty()) {
                out.println("  Round " + round.getNumber() + ":");
                enabledInRound.forEach(feature -> out.println("    + " + feature.getDescription()));
            }
        }

        long disabled = credential.getEnabledFeatures().size() - credential.countEnabledFeatures();
        if (disabled > 0) {
            out.println();
            out.println("Disabled APIs: " + disabled);
            out.println("  Run 'auth configure-apis --account=" + account + "' to enable more");
        }
    }

    private void refresh(String account) {
        AuthenticatedClient client = tokenRefreshService.refresh(account);
        out.println();
        out.println("Tokens refreshed for " + account + " (expires " + client.getExpiry() + ")");
    }

    private void configureApis(String account, String rounds, String apis) {
        AccountCredential updated = apiConfigurationService.configure(account, rounds, apis);
        if (rounds != null) {
            out.println();
            out.println("Enabled rounds: " + enablementRegistry.parseRounds(rounds).stream()
                .map(String::valueOf)
                .collect(Collectors.joining(", ")));
        }
        out.println();
        out.println("API configuration saved for " + account);
        out.println();
        out.println("Enabled: " + updated.countEnabledFeatures() + "/" + updated.getEnabledFeatures().size() + " APIs");
    }

    private void listApiRounds() {
        out.println();
        out.println("=== API Rounds (table v" + ApiRoundTable.VERSION + ") ===");
        for (ApiRoundTable.Round round : ApiRoundTable.rounds()) {
            out.println();
            out.println("Round " + round.getNumber() + " - " + round.getName() + " (" + round.getBilling() + "):");
            for (ApiFeature feature : round.getFeatures()) {
                out.println("  " + pad(feature.getKey(), 20) + " " + feature.getDescription());
            }
        }
        out.println();
        out.println("Usage:");
        out.println("  --rounds=1,2                Enable rounds 1 and 2");
        out.println("  --rounds=1-3                Enable rounds 1 through 3");
        out.println("  --rounds=all                Enable all rounds");
        out.println("  --apis=+ai,-vision          Enable ai, disable vision");
    }

    private void listAccounts() {
        List<String> accounts = credentialStore.list();
        if (accounts.isEmpty()) {
            out.println();
            out.println("No accounts configured.");
            out.println("Run: auth setup --account=your@email.com");
            return;
        }
        out.println();
        out.println("Configured accounts:");
        Instant now = clock.instant();
        for (String account : accounts) {
            try {
                credentialStore.load(account).ifPresent(credential -> out.println("  - " + account
                    + (credential.isExpired(now, properties.getExpiryMargin()) ? " (expired)" : " (valid)")
                    + " [" + credential.countEnabledFeatures() + " APIs enabled]"));
            } catch (GoogleAuthException e) {
                out.println("  - " + account + " (unreadable: re-run setup)");
            }
        }
    }

    private void listScopes() {
        out.println();
        out.println("=== Available Google OAuth Scopes ===");
        Map<String, List<ScopeDefinition>> byCategory = scopeCatalog.all().stream()
            .collect(Collectors.groupingBy(ScopeDefinition::getCategory, LinkedHashMap::new, Collectors.toList()));
        byCategory.forEach((category, scopes) -> {
            out.println();
            out.println(category + ":");
            scopes.forEach(scope -> out.println("  " + pad(scope.getName(), 25) + " " + scope.getDescription()));
        });

        out.println();
        out.println("=== Scope Presets ===");
        out.println();
        scopeCatalog.presets().forEach((name, scopes) ->
            out.println("  " + pad(name, 15) + " " + String.join(", ", scopes)));
    }

    private void printHelp() {
        out.println();
        out.println("Google OAuth Authentication");
        out.println();
        out.println("Commands:");
        out.println("  setup                       Set up credentials for a new account");
        out.println("  status                      Check status of an account's credentials");
        out.println("  refresh                     Manually refresh tokens for an account");
        out.println("  configure-apis              Configure which APIs are enabled for an account");
        out.println("  api-rounds                  List available API rounds");
        out.println("  list                        List all configured accounts");
        out.println("  scopes                      List available OAuth scopes");
        out.println("  url                         Generate authorization URL (no callback)");
        out.println("  help                        Show this help");
        out.println();
        out.println("Options:");
        out.println("  --account=EMAIL             Google account email (required for most commands)");
        out.println("  --client-id=ID              OAuth Client ID (required for setup)");
        out.println("  --client-secret=SECRET      OAuth Client Secret (required for setup)");
        out.println("  --scopes=scope1,scope2      Comma-separated scope names");
        out.println("  --preset=NAME               Use scope preset (full, workspace, gmail-only, ...)");
        out.println("  --rounds=1,2,3              API rounds enabled (setup defaults to " + properties.getDefaultRounds() + ")");
        out.println("  --apis=+api,-api            Enable/disable specific APIs");
    }

    private List<String> scopeNames(ApplicationArguments args) {
        String scopes = option(args, "scopes");
        if (scopes != null) {
            return Arrays.stream(scopes.split(","))
                .map(String::trim)
                .filter(StringUtils::hasText)
                .collect(Collectors.toList());
        }
        String preset = option(args, "preset");
        return preset != null ? scopeCatalog.preset(preset) : ScopeCatalog.DEFAULT_SCOPES;
    }

    private static String option(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty() || !StringUtils.hasText(values.get(0))) {
            return null;
        }
        return values.get(0);
    }

    private static String requireOption(ApplicationArguments args, String name, String command) {
        String value = option(args, name);
        if (value == null) {
            throw ConfigurationException.missingOption(name, command);
        }
        return value;
    }

    private static String pad(String value, int width) {
        return String.format("%-" + width + "s", value);
    }
}
