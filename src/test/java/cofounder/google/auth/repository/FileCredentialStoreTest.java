package cofounder.google.auth.repository;

import cofounder.google.auth.entity.AccountCredential;
import cofounder.google.auth.exception.AccountNotConfiguredException;
import cofounder.google.auth.exception.ConfigurationException;
import cofounder.google.auth.exception.CredentialStoreException;
import cofounder.google.auth.service.ApiEnablementRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class FileCredentialStoreTest {

    private static final String ACCOUNT = "me@example.com";

    @TempDir
    Path tempDir;

    private Path credentialsDir;
    private FileCredentialStore store;
    private AccountCredential credential;

    @BeforeEach
    void setUp() {
        credentialsDir = tempDir.resolve("credentials");
        store = new FileCredentialStore(credentialsDir);
        credential = AccountCredential.builder()
            .account(ACCOUNT)
            .clientId("client-id.apps.googleusercontent.com")
            .clientSecret("client-secret")
            .accessToken("ya29.access")
            .refreshToken("1//refresh")
            .scopes(List.of("https://www.googleapis.com/auth/drive"))
            .enabledFeatures(new ApiEnablementRegistry().defaultFeatures())
            .expiry(Instant.parse("2026-10-18T12:00:00Z"))
            .build();
    }

    @Test
    void save_ThenLoad_ShouldReturnEqualRecord() {
        // When
        store.save(ACCOUNT, credential);

        // Then
        assertEquals(credential, store.load(ACCOUNT).orElseThrow());
        assertTrue(Files.exists(credentialsDir.resolve(ACCOUNT + ".json")), "directory should be created on demand");
    }

    @Test
    void load_WithUnknownAccount_ShouldReturnEmpty() {
        assertTrue(store.load("nobody@example.com").isEmpty());
    }

    @Test
    void save_ShouldUseSnakeCaseKeysAndIsoExpiry() throws Exception {
        // When
        store.save(ACCOUNT, credential);

        // Then
        String json = Files.readString(credentialsDir.resolve(ACCOUNT + ".json"));
        assertTrue(json.contains("\"client_id\""));
        assertTrue(json.contains("\"refresh_token\""));
        assertTrue(json.contains("\"enabled_features\""));
        assertTrue(json.contains("\"2026-10-18T12:00:00Z\""));
    }

    @Test
    void save_ShouldReplacePreviousRecordAndLeaveNoTempFiles() throws Exception {
        // Given
        store.save(ACCOUNT, credential);
        AccountCredential updated = credential.toBuilder().accessToken("ya29.second").build();

        // When
        store.save(ACCOUNT, updated);

        // Then
        assertEquals("ya29.second", store.load(ACCOUNT).orElseThrow().getAccessToken());
        try (Stream<Path> files = Files.list(credentialsDir)) {
            assertEquals(List.of(ACCOUNT + ".json"), files.map(p -> p.getFileName().toString()).toList());
        }
    }

    @Test
    void save_ShouldRestrictFileToOwner() throws Exception {
        assumeTrue(FileSystems.getDefault().supportedFileAttributeViews().contains("posix"));

        store.save(ACCOUNT, credential);

        assertEquals("rw-------", PosixFilePermissions.toString(
            Files.getPosixFilePermissions(credentialsDir.resolve(ACCOUNT + ".json"))));
    }

    @Test
    void list_ShouldReturnSortedAccountsAndSkipOtherFiles() throws Exception {
        // Given
        store.save("b@example.com", credential.toBuilder().account("b@example.com").build());
        store.save("a@example.com", credential.toBuilder().account("a@example.com").build());
        Files.writeString(credentialsDir.resolve("notes.txt"), "ignored");
        Files.writeString(credentialsDir.resolve(".a@example.com-123.tmp"), "{}");

        // Then
        assertEquals(List.of("a@example.com", "b@example.com"), store.list());
    }

    @Test
    void list_WithMissingDirectory_ShouldReturnEmpty() {
        assertTrue(store.list().isEmpty());
    }

    @Test
    void load_WithUnknownJsonKey_ShouldRejectRecord() throws Exception {
        // Given
        store.save(ACCOUNT, credential);
        Path file = credentialsDir.resolve(ACCOUNT + ".json");
        String json = Files.readString(file).replaceFirst("\\{", "{\n  \"token_uri\" : \"https://example.com\",");
        Files.writeString(file, json);

        // When & Then
        assertThrows(AccountNotConfiguredException.class, () -> store.load(ACCOUNT));
    }

    @Test
    void load_WithCorruptJson_ShouldRejectRecord() throws Exception {
        Files.createDirectories(credentialsDir);
        Files.write(credentialsDir.resolve(ACCOUNT + ".json"), "{\"account\": ".getBytes(StandardCharsets.UTF_8));

        AccountNotConfiguredException exception =
            assertThrows(AccountNotConfiguredException.class, () -> store.load(ACCOUNT));
        assertNotNull(exception.getHint());
    }

    @Test
    void load_WithRecordForDifferentAccount_ShouldRejectRecord() throws Exception {
        // Given
        store.save("other@example.com", credential.toBuilder().account("other@example.com").build());
        Files.copy(credentialsDir.resolve("other@example.com.json"), credentialsDir.resolve(ACCOUNT + ".json"));

        // When & Then
        assertThrows(AccountNotConfiguredException.class, () -> store.load(ACCOUNT));
    }

    @Test
    void save_WithUnknownFeature_ShouldRefuseAndKeepPreviousRecord() {
        // Given
        store.save(ACCOUNT, credential);
        AccountCredential invalid = credential.toBuilder().enabledFeatures(Map.of("dropbox", true)).build();

        // When & Then
        assertThrows(CredentialStoreException.class, () -> store.save(ACCOUNT, invalid));
        assertEquals(credential, store.load(ACCOUNT).orElseThrow());
    }

    @Test
    void save_WithAccessTokenButNoExpiry_ShouldRefuse() {
        AccountCredential invalid = credential.toBuilder().expiry(null).build();

        assertThrows(CredentialStoreException.class, () -> store.save(ACCOUNT, invalid));
        assertTrue(store.load(ACCOUNT).isEmpty());
    }

    @Test
    void save_WithoutAccessToken_ShouldBeAccepted() {
        AccountCredential pending = credential.toBuilder().accessToken(null).expiry(null).build();

        store.save(ACCOUNT, pending);

        assertNull(store.load(ACCOUNT).orElseThrow().getAccessToken());
    }

    @Test
    void save_WithMismatchedAccount_ShouldRefuse() {
        assertThrows(CredentialStoreException.class, () -> store.save("other@example.com", credential));
    }

    @Test
    void load_WithPathLikeAccount_ShouldRejectIdentifier() {
        assertThrows(ConfigurationException.class, () -> store.load("../escape"));
        assertThrows(ConfigurationException.class, () -> store.load(".hidden"));
        assertThrows(ConfigurationException.class, () -> store.load(" "));
    }
}
