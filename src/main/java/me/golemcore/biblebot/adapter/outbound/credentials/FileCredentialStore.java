package me.golemcore.biblebot.adapter.outbound.credentials;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.biblebot.domain.model.Credentials;
import me.golemcore.biblebot.infrastructure.config.BotProperties;
import me.golemcore.biblebot.port.outbound.CredentialPort;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Comparator;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

/**
 * JSON credential file under the per-user config directory, by default
 * {@code ~/.config/matrix-biblebot/credentials.json}, with the E2EE key store
 * directory next to it.
 *
 * <p>
 * Writes go to a temp file in the same directory that is restricted to
 * {@code rw-------}, fsynced and then atomically renamed over the target, so a
 * reader sees either the old or the new file. On failure the temp file is
 * removed and the previous file is left untouched. On filesystems without POSIX
 * permissions the mode is not set.
 */
@Component
@Slf4j
public class FileCredentialStore implements CredentialPort {

    private static final Set<PosixFilePermission> FILE_PERMISSIONS = PosixFilePermissions.fromString("rw-------");
    private static final Set<PosixFilePermission> DIRECTORY_PERMISSIONS = PosixFilePermissions
            .fromString("rwx------");

    private final ObjectMapper objectMapper;
    private final Path directory;
    private final Path credentialsPath;
    private final Path storePath;

    public FileCredentialStore(BotProperties properties, ObjectMapper objectMapper) {
        BotProperties.CredentialsProperties config = properties.getCredentials();
        this.objectMapper = objectMapper;
        this.directory = Paths.get(config.getDirectory().replace("${user.home}", System.getProperty("user.home")))
                .toAbsolutePath()
                .normalize();
        this.credentialsPath = directory.resolve(config.getFileName());
        this.storePath = directory.resolve(config.getStoreDirectory());
    }

    @Override
    public void save(Credentials credentials) {
        Path tempPath = null;
        try {
            Files.createDirectories(directory);
            restrict(directory, DIRECTORY_PERMISSIONS);

            byte[] bytes = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(credentials);
            tempPath = Files.createTempFile(directory, "." + credentialsPath.getFileName(), ".tmp");
            restrict(tempPath, FILE_PERMISSIONS);
            try (FileChannel channel = FileChannel.open(tempPath,
                    StandardOpenOption.WRITE,
                    StandardOpenOption.TRUNCATE_EXISTING)) {
                ByteBuffer buffer = ByteBuffer.wrap(bytes);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }

            try {
                Files.move(tempPath, credentialsPath,
                        StandardCopyOption.REPLACE_EXISTING,
                        StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                log.warn("[Credentials] Atomic move not supported, using regular move");
                Files.move(tempPath, credentialsPath, StandardCopyOption.REPLACE_EXISTING);
            }
            log.debug("[Credentials] Saved {}", credentialsPath);
        } catch (IOException e) {
            if (tempPath != null) {
                try {
                    Files.deleteIfExists(tempPath);
                } catch (IOException cleanupEx) {
                    log.warn("[Credentials] Failed to cleanup temp file: {}", tempPath);
                }
            }
            throw new UncheckedIOException("Failed to save credentials to " + credentialsPath, e);
        }
    }

    @Override
    public Optional<Credentials> load() {
        if (!Files.isRegularFile(credentialsPath)) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(credentialsPath.toFile(), Credentials.class));
        } catch (IOException e) {
            log.warn("[Credentials] Ignoring unreadable credentials file {}: {}", credentialsPath, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public boolean delete() {
        try {
            boolean existed = Files.deleteIfExists(credentialsPath);
            if (Files.exists(storePath)) {
                deleteRecursively(storePath);
                log.info("[Credentials] Removed key store {}", storePath);
            }
            return existed;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to delete credentials in " + directory, e);
        }
    }

    @Override
    public boolean exists() {
        return Files.isRegularFile(credentialsPath);
    }

    @Override
    public Path getCredentialsPath() {
        return credentialsPath;
    }

    @Override
    public Path getStorePath() {
        return storePath;
    }

    private static void restrict(Path path, Set<PosixFilePermission> permissions) throws IOException {
        try {
            Files.setPosixFilePermissions(path, permissions);
        } catch (UnsupportedOperationException e) {
            log.debug("[Credentials] POSIX permissions not supported for {}", path);
        }
    }

    private static void deleteRecursively(Path root) throws IOException {
        try (Stream<Path> paths = Files.walk(root)) {
            for (Path path : paths.sorted(Comparator.reverseOrder()).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
