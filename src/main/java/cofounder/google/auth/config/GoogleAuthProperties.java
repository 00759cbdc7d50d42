package cofounder.google.auth.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.time.Duration;

@Getter
@Setter
@ConfigurationProperties(prefix = "google.auth")
public class GoogleAuthProperties {

    /** Directory holding one {@code <account>.json} record per account. */
    private Path credentialsDir = Path.of(System.getProperty("user.home"), ".google-connector", "credentials");

    /** Fixed loopback port registered as the OAuth client's redirect URI. */
    private int redirectPort = 3847;

    private Duration callbackTimeout = Duration.ofMinutes(5);

    /** Tokens expiring within this window are refreshed before use. */
    private Duration expiryMargin = Duration.ofSeconds(60);

    private String authorizationUri = "https://accounts.google.com/o/oauth2/v2/auth";

    private String tokenUri = "https://oauth2.googleapis.com/token";

    /** Rounds enabled by setup when no selector is given: the two free rounds. */
    private String defaultRounds = "1,2";

    /** Lifetime assumed when the token endpoint omits {@code expires_in}. */
    private Duration defaultTokenLifetime = Duration.ofHours(1);

    private String applicationName = "Google Connector";

    public String getRedirectUri() {
        return "http://localhost:" + redirectPort;
    }
}
