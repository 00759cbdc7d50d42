package cofounder.google.auth.service;

import cofounder.google.auth.entity.ApiFeature;
import cofounder.google.auth.entity.ApiRoundTable;
import cofounder.google.auth.exception.ConfigurationException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Pure transformations over an account's feature on/off ledger.
 * Nothing here touches storage; callers persist the returned maps.
 */
@Component
public class ApiEnablementRegistry {
    private static final String ALL = "all";

    /**
     * Free rounds (1 and 2) on, billing-gated rounds off.
     */
    public Map<String, Boolean> defaultFeatures() {
        Map<String, Boolean> features = allDisabled();
        enableRounds(features, List.of(1, 2));
        return features;
    }

    /**
     * Disables every known feature, then enables each feature of the selected rounds.
     * Round numbers outside the table are ignored.
     */
    public Map<String, Boolean> applyRounds(Map<String, Boolean> current, String roundSelector) {
        SortedSet<Integer> rounds = parseRounds(roundSelector);
        Map<String, Boolean> features = allDisabled();
        // keys outside the vocabulary never survive a round selection
        enableRounds(features, rounds);
        return features;
    }

    public Map<String, Boolean> applyOverrides(Map<String, Boolean> current, String overrides) {
        if (overrides == null) {
            return new LinkedHashMap<>(current);
        }
        return applyOverrides(current, Arrays.asList(overrides.split(",")));
    }

    /**
     * Applies {@code +name} (enable), {@code -name} (disable) or bare {@code name}
     * (enable) tokens on top of {@code current}. All tokens are validated before any
     * change is made.
     */
    public Map<String, Boolean> applyOverrides(Map<String, Boolean> current, List<String> tokens) {
        Map<String, Boolean> updates = new LinkedHashMap<>();
        for (String raw : tokens) {
            String token = raw.trim();
            if (token.isEmpty()) {
                continue;
            }
            boolean enable = !token.startsWith("-");
            String name = token.startsWith("+") || token.startsWith("-") ? token.substring(1) : token;
            ApiFeature feature = ApiFeature.fromKey(name)
                .orElseThrow(() -> ConfigurationException.unknownFeature(token));
            updates.put(feature.getKey(), enable);
        }
        Map<String, Boolean> features = new LinkedHashMap<>(current);
        features.putAll(updates);
        return features;
    }

    /**
     * Parses "1,2", "1-3", "all" or mixes such as "1,3-4" into round numbers that exist
     * in {@link ApiRoundTable}.
     */
    public SortedSet<Integer> parseRounds(String roundSelector) {
        if (roundSelector == null || roundSelector.isBlank()) {
            throw ConfigurationException.invalidRoundSelector(String.valueOf(roundSelector));
        }
        SortedSet<Integer> rounds = new TreeSet<>();
        for (String part : roundSelector.split(",")) {
            String token = part.trim();
            if (token.isEmpty()) {
                continue;
            }
            if (ALL.equalsIgnoreCase(token)) {
                rounds.addAll(ApiRoundTable.roundNumbers());
                continue;
            }
            int dash = token.indexOf('-');
            if (dash > 0) {
                int start = parseRoundNumber(token.substring(0, dash), roundSelector);
                int end = parseRoundNumber(token.substring(dash + 1), roundSelector);
                for (int round = start; round <= end; round++) {
                    addIfKnown(rounds, round);
                }
            } else {
                addIfKnown(rounds, parseRoundNumber(token, roundSelector));
            }
        }
        return rounds;
    }

    public List<ApiFeature> enabledFeatures(Map<String, Boolean> features) {
        List<ApiFeature> enabled = new ArrayList<>();
        for (ApiFeature feature : ApiFeature.values()) {
            if (Boolean.TRUE.equals(features.get(feature.getKey()))) {
                enabled.add(feature);
            }
        }
        return enabled;
    }

    private static int parseRoundNumber(String value, String selector) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw ConfigurationException.invalidRoundSelector(selector);
        }
    }

    private static void addIfKnown(SortedSet<Integer> rounds, int round) {
        if (ApiRoundTable.round(round) != null) {
            rounds.add(round);
        }
    }

    private static Map<String, Boolean> allDisabled() {
        Map<String, Boolean> features = new LinkedHashMap<>();
        for (ApiFeature feature : ApiFeature.values()) {
            features.put(feature.getKey(), false);
        }
        return features;
    }

    private static void enableRounds(Map<String, Boolean> features, Iterable<Integer> rounds) {
        for (Integer round : rounds) {
            for (ApiFeature feature : ApiRoundTable.round(round).getFeatures()) {
                features.put(feature.getKey(), true);
            }
        }
    }
}
