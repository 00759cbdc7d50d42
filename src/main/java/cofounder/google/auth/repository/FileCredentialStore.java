package cofounder.google.auth.repository;

import cofounder.google.auth.entity.AccountCredential;
import cofounder.google.auth.exception.AccountNotConfiguredException;
import cofounder.google.auth.exception.CredentialStoreException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.FileAttribute;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Stores each account as {@code <credentials-dir>/<account>.json}.
 * Writes go to a temp file in the same directory which is then moved over the target.
 */
@Slf4j
public class FileCredentialStore implements CredentialStore {
    private static final String EXTENSION = ".json";

    private final Path directory;
    private final ObjectMapper objectMapper;

    public FileCredentialStore(Path directory) {
        this.directory = directory;
        this.objectMapper = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT)
            .build();
    }

    @Override
    public Optional<AccountCredential> load(String account) {
        Path file = pathFor(account);
        byte[] content;
        try {
            content = Files.readAllBytes(file);
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw AccountNotConfiguredException.unreadable(account, e);
        }

        AccountCredential credential;
        try {
            credential = objectMapper.readValue(content, AccountCredential.class);
        } catch (IOException e) {
            log.warn("Credential record {} is corrupt: {}", file, e.getMessage());
            throw AccountNotConfiguredException.unreadable(account, e);
        }
        if (credential == null) {
            throw AccountNotConfiguredException.unreadable(account, null);
        }
        List<String> violations = CredentialSchema.violations(credential);
        if (!violations.isEmpty() || !account.equals(credential.getAccount())) {
            log.warn("Credential record {} fails validation: {}", file, violations);
            throw AccountNotConfiguredException.unreadable(account,
                new CredentialStoreException("Invalid record: " + String.join("; ", violations)));
        }
        return Optional.of(credential);
    }

    @Override
    public void save(String account, AccountCredential credential) {
        Path target = pathFor(account);
        if (!account.equals(credential.getAccount())) {
            throw new CredentialStoreException(
                "Credential for " + credential.getAccount() + " cannot be stored under " + account);
        }
        List<String> violations = CredentialSchema.violations(credential);
        if (!violations.isEmpty()) {
            throw new CredentialStoreException(
                "Refusing to store invalid credential for " + account + ": " + String.join("; ", violations));
        }

        byte[] content;
        try {
            content = objectMapper.writeValueAsBytes(credential);
        } catch (JsonProcessingException e) {
            throw new CredentialStoreException("Failed to serialize credential for " + account, e);
        }

        Path temp = null;
        try {
            Files.createDirectories(directory);
            temp = Files.createTempFile(directory, "." + account + "-", ".tmp", ownerOnly());
            writeDurably(temp, content);
            moveIntoPlace(temp, target);
            log.debug("Saved credentials for {} to {}", account, target);
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new CredentialStoreException("Failed to save credentials for " + account + ": " + e.getMessage(), e);
        }
    }

    @Override
    public List<String> list() {
        if (!Files.isDirectory(directory)) {
            return Collections.emptyList();
        }
        List<String> accounts = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, "*" + EXTENSION)) {
            for (Path file : stream) {
                String name = file.getFileName().toString();
                if (!name.startsWith(".") && Files.isRegularFile(file)) {
                    accounts.add(name.substring(0, name.length() - EXTENSION.length()));
                }
            }
        } catch (IOException e) {
            throw new CredentialStoreException("Failed to list accounts in " + directory, e);
        }
        Collections.sort(accounts);
        return accounts;
    }

    Path pathFor(String account) {
        return directory.resolve(AccountIds.requireValid(account) + EXTENSION);
    }

    private static void writeDurably(Path file, byte[] content) throws IOException {
        try (FileChannel channel = FileChannel.open(file, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
            ByteBuffer buffer = ByteBuffer.wrap(content);
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
            channel.force(true);
        }
    }

    private static void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move not supported for {}, falling back to replace", target);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static FileAttribute<?>[] ownerOnly() {
        if (FileSystems.getDefault().supportedFileAttributeViews().contains("posix")) {
            return new FileAttribute<?>[]{PosixFilePermissions.asFileAttribute(PosixFilePermissions.fromString("rw-------"))};
        }
        return new FileAttribute<?>[0];
    }

    private static void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Could not remove temp file {}: {}", temp, e.getMessage());
        }
    }
}
