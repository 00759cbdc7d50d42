package cofounder.google.auth.entity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * OAuth credential record for a single Google account.
 * Stored as one JSON document per account; see {@code CredentialStore}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class AccountCredential {
    private String account;

    private String clientId;

    @ToString.Exclude
    private String clientSecret;

    @ToString.Exclude
    private String accessToken;

    @ToString.Exclude
    private String refreshToken;

    @Builder.Default
    private List<String> scopes = new ArrayList<>();

    @Builder.Default
    private Map<String, Boolean> enabledFeatures = new LinkedHashMap<>();

    private Instant expiry;

    @JsonIgnore
    public boolean hasRefreshToken() {
        return refreshToken != null && !refreshToken.isBlank();
    }

    /**
     * Tokens expiring within {@code margin} of {@code now} count as expired, as does a
     * record with no expiry at all.
     */
    @JsonIgnore
    public boolean isExpired(Instant now, Duration margin) {
        return expiry == null || !now.plus(margin).isBefore(expiry);
    }

    @JsonIgnore
    public boolean isFeatureEnabled(ApiFeature feature) {
        return Boolean.TRUE.equals(enabledFeatures.get(feature.getKey()));
    }

    @JsonIgnore
    public long countEnabledFeatures() {
        return enabledFeatures.values().stream().filter(Boolean.TRUE::equals).count();
    }
}
