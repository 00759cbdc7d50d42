package cofounder.google.auth.entity;

import lombok.Getter;

import java.util.Arrays;
import java.util.Optional;

/**
 * Known feature (API) keys that can be switched on or off per account.
 * The key is what gets persisted in {@link AccountCredential#getEnabledFeatures()}.
 */
@Getter
public enum ApiFeature {
    // Round 1
    DRIVE("drive", "Google Drive"),
    // Round 2
    DOCS("docs", "Google Docs"),
    SHEETS("sheets", "Google Sheets"),
    SLIDES("slides", "Google Slides"),
    GMAIL("gmail", "Gmail"),
    YOUTUBE("youtube", "YouTube Data"),
    YOUTUBE_ANALYTICS("youtube_analytics", "YouTube Analytics"),
    YOUTUBE_REPORTING("youtube_reporting", "YouTube Reporting"),
    CALENDAR("calendar", "Google Calendar"),
    // Round 3
    AI("ai", "Gemini AI (Generative Language)"),
    VERTEX("vertex", "Vertex AI (Veo, Imagen)"),
    VISION("vision", "Cloud Vision"),
    // Round 4
    CLOUD_RUN("cloud_run", "Cloud Run"),
    CLOUD_FUNCTIONS("cloud_functions", "Cloud Functions"),
    APP_ENGINE("app_engine", "App Engine"),
    CLOUD_BUILD("cloud_build", "Cloud Build"),
    API_KEYS("api_keys", "API Keys Management"),
    SERVICE_USAGE("service_usage", "Service Usage"),
    RESOURCE_MANAGER("resource_manager", "Cloud Resource Manager"),
    IAM("iam", "IAM");

    private final String key;
    private final String description;

    ApiFeature(String key, String description) {
        this.key = key;
        this.description = description;
    }

    public static Optional<ApiFeature> fromKey(String key) {
        return Arrays.stream(values())
            .filter(feature -> feature.key.equals(key))
            .findFirst();
    }
}
