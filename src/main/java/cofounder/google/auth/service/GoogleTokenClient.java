package cofounder.google.auth.service;

import cofounder.google.auth.config.GoogleAuthProperties;
import cofounder.google.auth.entity.AccountCredential;
import cofounder.google.auth.entity.TokenResponse;
import cofounder.google.auth.exception.TokenExchangeException;
import cofounder.google.auth.exception.TokenRefreshException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * Talks to Google's OAuth token endpoint: authorization-code exchange and
 * refresh-token grant. Never retries.
 */
@Slf4j
@Service
public class GoogleTokenClient {
    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final GoogleAuthProperties properties;

    public GoogleTokenClient(RestTemplate restTemplate, ObjectMapper objectMapper, GoogleAuthProperties properties) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    public TokenResponse exchangeCode(String clientId, String clientSecret, String code) {
        MultiValueMap<String, String> body = new LinkedMultiValueMap<>();
        body.add("code", code);
        body.add("client_id", clientId);
        body.add("client_secret", clientSecret);
        body.add("redirect_uri", properties.getRedirectUri());
        body.add("grant_type", "authorization_code");

        try {
            TokenResponse tokens = parse(post(body));
            if (tokens.getRefreshToken() == null) {
                log.warn("Token endpoint returned no refresh token; unattended refresh will not be possible");
            }
            return tokens;
        } catch (HttpStatusCodeException e) {
            throw new TokenExchangeException("Error getting tokens: " + describe(e), e);
        } catch (ResourceAccessException e) {
            throw new TokenExchangeException("Could not reach token endpoint: " + e.getMessage(), e);
        } catch (RestClientException | JsonProcessingException e) {
            throw new TokenExchangeException("Error getting tokens: " + e.getMessage(), e);
        }
    }

    /**
     * Redeems the credential's refresh token. The credential itself is not modified.
     */
    public TokenResponse refresh(AccountCredential credential) {
        String account = credential.getAccount();
        if (!credential.hasRefreshToken()) {
            throw TokenRefreshException.missingRefreshToken(account);
        }

        MultiValueMap<String, String> body = new LinkedMultiValueMap<>();
        body.add("client_id", credential.getClientId());
        body.add("client_secret", credential.getClientSecret());
        body.add("refresh_token", credential.getRefreshToken());
        body.add("grant_type", "refresh_token");

        try {
            return parse(post(body));
        } catch (HttpStatusCodeException e) {
            throw TokenRefreshException.rejected(account, describe(e), e);
        } catch (ResourceAccessException e) {
            throw TokenRefreshException.rejected(account, "could not reach token endpoint (" + e.getMessage() + ")", e);
        } catch (RestClientException | JsonProcessingException e) {
            throw TokenRefreshException.rejected(account, e.getMessage(), e);
        }
    }

    private String post(MultiValueMap<String, String> body) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);
        HttpEntity<MultiValueMap<String, String>> request = new HttpEntity<>(body, headers);

        ResponseEntity<String> response = restTemplate.postForEntity(properties.getTokenUri(), request, String.class);
        if (response == null || !response.getStatusCode().is2xxSuccessful() || response.getBody() == null) {
            String status = response != null ? String.valueOf(response.getStatusCode()) : "no response";
            throw new RestClientException("Token endpoint returned " + status);
        }
        return response.getBody();
    }

    private TokenResponse parse(String responseBody) throws JsonProcessingException {
        JsonNode json = objectMapper.readTree(responseBody);
        if (!json.hasNonNull("access_token")) {
            throw new RestClientException("Token response missing access_token");
        }
        Duration expiresIn = json.hasNonNull("expires_in")
            ? Duration.ofSeconds(json.get("expires_in").asLong())
            : properties.getDefaultTokenLifetime();
        if (expiresIn.isZero() || expiresIn.isNegative()) {
            throw new RestClientException("Token response has non-positive expires_in: " + expiresIn.toSeconds());
        }
        return TokenResponse.builder()
            .accessToken(json.get("access_token").asText())
            .refreshToken(json.hasNonNull("refresh_token") ? json.get("refresh_token").asText() : null)
            .expiresIn(expiresIn)
            .scope(json.hasNonNull("scope") ? json.get("scope").asText() : null)
            .tokenType(json.hasNonNull("token_type") ? json.get("token_type").asText() : null)
            .build();
    }

    /**
     * Google reports failures as {@code {"error": "...", "error_description": "..."}}.
     */
    private String describe(HttpStatusCodeException e) {
        String description = e.getStatusCode().toString();
        try {
            JsonNode json = objectMapper.readTree(e.getResponseBodyAsString());
            if (json != null && json.hasNonNull("error")) {
                description = json.get("error").asText();
                if (json.hasNonNull("error_description")) {
                    description += " (" + json.get("error_description").asText() + ")";
                }
            }
        } catch (JsonProcessingException parseFailure) {
            log.debug("Token endpoint error body is not JSON: {}", parseFailure.getMessage());
        }
        return description;
    }
}
