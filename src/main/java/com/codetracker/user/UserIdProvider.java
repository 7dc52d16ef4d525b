package com.codetracker.user;

import com.codetracker.storage.SessionStore;
import com.codetracker.storage.StorageException;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Stable id of this installation.
 * <p>
 * The first id found in the shared database wins, so every host writing into the same database
 * records under one id. Otherwise a locally stored id is used, and failing that a new one is
 * generated. The chosen id is always written back to the local file.
 */
public class UserIdProvider {

    private static final Logger log = LoggerFactory.getLogger(UserIdProvider.class);

    public static final String USER_ID_FILE = "user-id";

    private final SessionStore store;
    private final Path idFile;
    private final ReentrantLock lock = new ReentrantLock();
    private volatile String userId;

    public UserIdProvider(SessionStore store, Path dataRoot) {
        this.store = Objects.requireNonNull(store, "store");
        this.idFile = Objects.requireNonNull(dataRoot, "dataRoot").resolve(USER_ID_FILE);
    }

    public String userId() {
        String current = userId;
        if (current == null) {
            lock.lock();
            try {
                current = userId;
                if (current == null) {
                    current = determineUserId();
                    userId = current;
                }
            } finally {
                lock.unlock();
            }
        }
        return current;
    }

    private String determineUserId() {
        Optional<String> fromDatabase = readFromDatabase();
        if (fromDatabase.isPresent()) {
            writeLocal(fromDatabase.get());
            return fromDatabase.get();
        }
        Optional<String> local = readLocal();
        if (local.isPresent()) {
            return local.get();
        }
        String generated = UUID.randomUUID().toString();
        writeLocal(generated);
        log.info("Generated new user id {}", generated);
        return generated;
    }

    private Optional<String> readFromDatabase() {
        try {
            return store.findAnyUserId().filter(StringUtils::isNotBlank);
        } catch (StorageException ex) {
            log.warn("Failed to read user id from database", ex);
            return Optional.empty();
        }
    }

    private Optional<String> readLocal() {
        if (!Files.isRegularFile(idFile)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readString(idFile, StandardCharsets.UTF_8).trim())
                    .filter(StringUtils::isNotBlank);
        } catch (IOException ex) {
            log.warn("Failed to read user id from {}", idFile, ex);
            return Optional.empty();
        }
    }

    private void writeLocal(String id) {
        try {
            Files.createDirectories(idFile.toAbsolutePath().getParent());
            Files.writeString(idFile, id, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            log.warn("Failed to store user id in {}", idFile, ex);
        }
    }
}
