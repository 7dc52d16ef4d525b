package com.codetracker.user;

import com.codetracker.testing.InMemorySessionStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.UUID;

import static com.codetracker.testing.Sessions.insert;
import static com.codetracker.testing.Sessions.session;
import static org.junit.jupiter.api.Assertions.assertEquals;

class UserIdProviderTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldAdoptIdAlreadyInDatabase() throws Exception {
        InMemorySessionStore store = new InMemorySessionStore();
        insert(store, session("Demo", "Java", "2025-10-06T09:00", "2025-10-06T09:30"));
        Files.writeString(tempDir.resolve(UserIdProvider.USER_ID_FILE), "local-id");

        UserIdProvider provider = new UserIdProvider(store, tempDir);

        assertEquals("user-1", provider.userId());
        assertEquals("user-1", Files.readString(tempDir.resolve(UserIdProvider.USER_ID_FILE)));
    }

    @Test
    void shouldFallBackToLocalFile() throws Exception {
        Files.writeString(tempDir.resolve(UserIdProvider.USER_ID_FILE), " local-id \n");

        assertEquals("local-id", new UserIdProvider(new InMemorySessionStore(), tempDir).userId());
    }

    @Test
    void shouldGenerateAndPersistNewId() throws Exception {
        Path dataRoot = tempDir.resolve("fresh");
        UserIdProvider provider = new UserIdProvider(new InMemorySessionStore(), dataRoot);

        String id = provider.userId();

        UUID.fromString(id);
        assertEquals(id, provider.userId());
        assertEquals(id, new UserIdProvider(new InMemorySessionStore(), dataRoot).userId());
    }

    @Test
    void shouldIgnoreUnreadableDatabase() throws Exception {
        InMemorySessionStore store = new InMemorySessionStore();
        store.failReads(true);
        Files.writeString(tempDir.resolve(UserIdProvider.USER_ID_FILE), "local-id");

        assertEquals("local-id", new UserIdProvider(store, tempDir).userId());
    }
}
