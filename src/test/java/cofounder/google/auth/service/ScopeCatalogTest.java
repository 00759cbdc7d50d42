package cofounder.google.auth.service;

import cofounder.google.auth.exception.ConfigurationException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ScopeCatalogTest {

    private final ScopeCatalog scopeCatalog = new ScopeCatalog();

    @Test
    void resolve_ShouldMapNamesToUrlsInOrder() {
        List<String> urls = scopeCatalog.resolve(List.of("gmail.modify", "drive"));

        assertEquals(List.of(
            "https://www.googleapis.com/auth/gmail.modify",
            "https://www.googleapis.com/auth/drive"), urls);
    }

    @Test
    void resolve_WithFullUrl_ShouldPassItThrough() {
        List<String> urls = scopeCatalog.resolve(List.of("https://www.googleapis.com/auth/cloud-platform"));

        assertEquals(List.of("https://www.googleapis.com/auth/cloud-platform"), urls);
    }

    @Test
    void resolve_WithUnknownNames_ShouldListEveryOne() {
        ConfigurationException exception = assertThrows(ConfigurationException.class,
            () -> scopeCatalog.resolve(List.of("drive", "photos", "contacts")));

        assertEquals("Unknown scope: photos, contacts", exception.getMessage());
    }

    @Test
    void defaultScopes_ShouldAllBeKnown() {
        assertEquals(ScopeCatalog.DEFAULT_SCOPES.size(), scopeCatalog.resolve(ScopeCatalog.DEFAULT_SCOPES).size());
        scopeCatalog.presets().values().forEach(preset -> assertDoesNotThrow(() -> scopeCatalog.resolve(preset)));
    }

    @Test
    void preset_ShouldReturnNamedScopes() {
        assertEquals(List.of("gmail.readonly"), scopeCatalog.preset("gmail-readonly"));
        assertThrows(ConfigurationException.class, () -> scopeCatalog.preset("everything"));
    }
}
