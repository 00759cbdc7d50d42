package cofounder.google.auth.service;

import lombok.Builder;
import lombok.ToString;
import lombok.Value;

import java.util.List;

/**
 * Input to {@link AuthorizationFlowService#runSetup(SetupRequest)}. A null
 * {@code roundSelector} means the configured default rounds; null
 * {@code featureOverrides} means none.
 */
@Value
@Builder
public class SetupRequest {
    String account;
    String clientId;
    @ToString.Exclude
    String clientSecret;
    List<String> scopeNames;
    String roundSelector;
    String featureOverrides;
}
