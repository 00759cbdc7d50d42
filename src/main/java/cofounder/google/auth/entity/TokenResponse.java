package cofounder.google.auth.entity;

import lombok.Builder;
import lombok.ToString;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * Tokens returned by the token endpoint for either grant type.
 * {@code refreshToken} is null when the provider did not issue a new one.
 */
@Value
@Builder
public class TokenResponse {
    @ToString.Exclude
    String accessToken;

    @ToString.Exclude
    String refreshToken;

    Duration expiresIn;

    String scope;

    String tokenType;

    public Instant expiryFrom(Instant now) {
        return now.plus(expiresIn);
    }
}
