package cofounder.google.auth.config;

import org.springframework.security.oauth2.core.endpoint.OAuth2AuthorizationRequest;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Builds Google authorization URLs that request offline access and force the consent
 * screen, so a refresh token is issued even if the user authorized this client before.
 */
@Component
public class AuthorizationUrlFactory {
    private final GoogleAuthProperties properties;

    public AuthorizationUrlFactory(GoogleAuthProperties properties) {
        this.properties = properties;
    }

    public String buildAuthorizationUrl(String clientId, List<String> scopeUrls) {
        Map<String, Object> additionalParameters = new HashMap<>();
        // access_type=offline to get refresh tokens
        additionalParameters.put("access_type", "offline");
        // prompt=consent so a refresh token is returned on re-authorization too
        additionalParameters.put("prompt", "consent");

        OAuth2AuthorizationRequest authorizationRequest = OAuth2AuthorizationRequest.authorizationCode()
                .authorizationUri(properties.getAuthorizationUri())
                .clientId(clientId)
                .redirectUri(properties.getRedirectUri())
                .scopes(new LinkedHashSet<>(scopeUrls))
                .additionalParameters(additionalParameters)
                .build();

        return authorizationRequest.getAuthorizationRequestUri();
    }
}
