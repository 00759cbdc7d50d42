package cofounder.google.auth.service;

import cofounder.google.auth.entity.ScopeDefinition;
import cofounder.google.auth.exception.ConfigurationException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Google OAuth scopes the connectors know by short name, plus named presets.
 */
@Component
public class ScopeCatalog {
    private static final String SCOPE_PREFIX = "https://www.googleapis.com/auth/";

    public static final List<String> DEFAULT_SCOPES = List.of(
        "drive", "documents", "spreadsheets", "presentations", "gmail.modify", "youtube", "youtube.upload", "calendar");

    private final Map<String, ScopeDefinition> scopes = new LinkedHashMap<>();
    private final Map<String, List<String>> presets = new LinkedHashMap<>();

    public ScopeCatalog() {
        define("Drive & Files", "drive", "Full Google Drive access (read, write, delete)");
        define("Drive & Files", "drive.file", "Access only to files created by this app");
        define("Drive & Files", "drive.readonly", "Read-only Drive access");
        define("Google Docs", "documents", "Full Google Docs access");
        define("Google Docs", "documents.readonly", "Read-only Google Docs access");
        define("Google Sheets", "spreadsheets", "Full Google Sheets access");
        define("Google Sheets", "spreadsheets.readonly", "Read-only Google Sheets access");
        define("Google Slides", "presentations", "Full Google Slides access");
        define("Google Slides", "presentations.readonly", "Read-only Google Slides access");
        define("Gmail", "gmail.modify", "Full Gmail access (read, write, delete)");
        define("Gmail", "gmail.readonly", "Read-only Gmail access");
        define("Gmail", "gmail.send", "Send emails only");
        define("Gmail", "gmail.compose", "Create and send emails");
        define("YouTube", "youtube", "Full YouTube account management");
        define("YouTube", "youtube.readonly", "Read-only YouTube access");
        define("YouTube", "youtube.upload", "Upload YouTube videos");
        define("YouTube", "youtube.force-ssl", "YouTube operations over SSL");
        define("Calendar", "calendar", "Full Google Calendar access");
        define("Calendar", "calendar.readonly", "Read-only Calendar access");
        define("Calendar", "calendar.events", "Manage calendar events only");

        presets.put("full", DEFAULT_SCOPES);
        presets.put("drive-only", List.of("drive"));
        presets.put("workspace", List.of("drive", "documents", "spreadsheets", "presentations"));
        presets.put("gmail-only", List.of("gmail.modify"));
        presets.put("gmail-readonly", List.of("gmail.readonly"));
        presets.put("youtube-only", List.of("youtube", "youtube.upload"));
        presets.put("calendar-only", List.of("calendar"));
        presets.put("readonly", List.of("drive.readonly", "documents.readonly", "spreadsheets.readonly",
            "presentations.readonly", "gmail.readonly", "youtube.readonly", "calendar.readonly"));
    }

    private void define(String category, String name, String description) {
        scopes.put(name, new ScopeDefinition(name, SCOPE_PREFIX + name, description, category));
    }

    public Optional<ScopeDefinition> find(String name) {
        return Optional.ofNullable(scopes.get(name));
    }

    public Collection<ScopeDefinition> all() {
        return Collections.unmodifiableCollection(scopes.values());
    }

    public Map<String, List<String>> presets() {
        return Collections.unmodifiableMap(presets);
    }

    public List<String> preset(String name) {
        List<String> preset = presets.get(name);
        if (preset == null) {
            throw new ConfigurationException("Unknown preset: " + name,
                "Available presets: " + String.join(", ", presets.keySet()));
        }
        return preset;
    }

    /**
     * Maps scope names to URLs. Full {@code https://} URLs pass through unchanged.
     *
     * @throws ConfigurationException listing every name that is neither known nor a URL
     */
    public List<String> resolve(List<String> names) {
        List<String> urls = new ArrayList<>();
        List<String> unknown = new ArrayList<>();
        for (String name : names) {
            ScopeDefinition definition = scopes.get(name);
            if (definition != null) {
                urls.add(definition.getUrl());
            } else if (name.startsWith("https://")) {
                urls.add(name);
            } else {
                unknown.add(name);
            }
        }
        if (!unknown.isEmpty()) {
            throw ConfigurationException.unknownScopes(unknown);
        }
        return urls;
    }
}
