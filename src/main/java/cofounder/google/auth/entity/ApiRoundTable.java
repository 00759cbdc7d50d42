package cofounder.google.auth.entity;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static cofounder.google.auth.entity.ApiFeature.*;

/**
 * Numbered feature bundles ("rounds"). Rounds 1 and 2 need no billing account,
 * round 3 may, round 4 does.
 * Bump {@link #VERSION} whenever a round's membership changes.
 */
public final class ApiRoundTable {
    public static final int VERSION = 1;

    private static final Map<Integer, Round> ROUNDS;

    static {
        Map<Integer, Round> rounds = new LinkedHashMap<>();
        rounds.put(1, new Round(1, "Core", "Free, no billing",
            List.of(DRIVE)));
        rounds.put(2, new Round(2, "Services", "Free, no billing",
            List.of(DOCS, SHEETS, SLIDES, GMAIL, YOUTUBE, YOUTUBE_ANALYTICS, YOUTUBE_REPORTING, CALENDAR)));
        rounds.put(3, new Round(3, "AI", "May require billing",
            List.of(AI, VERTEX, VISION)));
        rounds.put(4, new Round(4, "Cloud Management", "Requires billing",
            List.of(CLOUD_RUN, CLOUD_FUNCTIONS, APP_ENGINE, CLOUD_BUILD, API_KEYS, SERVICE_USAGE, RESOURCE_MANAGER, IAM)));
        ROUNDS = Collections.unmodifiableMap(rounds);
    }

    private ApiRoundTable() {
    }

    public static Set<Integer> roundNumbers() {
        return ROUNDS.keySet();
    }

    public static Round round(int number) {
        return ROUNDS.get(number);
    }

    public static Iterable<Round> rounds() {
        return ROUNDS.values();
    }

    @Getter
    public static final class Round {
        private final int number;
        private final String name;
        private final String billing;
        private final List<ApiFeature> features;

        Round(int number, String name, String billing, List<ApiFeature> features) {
            this.number = number;
            this.name = name;
            this.billing = billing;
            this.features = features;
        }
    }
}
