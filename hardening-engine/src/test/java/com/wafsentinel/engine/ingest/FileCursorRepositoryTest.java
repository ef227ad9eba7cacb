package com.wafsentinel.engine.ingest;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Optional;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class FileCursorRepositoryTest {

    @TempDir
    Path dir;

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();

    @Test
    void shouldReportNoCursorBeforeFirstSave() {
        FileCursorRepository repository = new FileCursorRepository(dir.resolve("cursor.json"), objectMapper);

        assertEquals(Optional.empty(), repository.load());
    }

    @Test
    void shouldPersistAcrossInstances() throws Exception {
        Path file = dir.resolve("state").resolve("cursor.json");
        CursorState state = new CursorState("2025.06.19.04", "tx-42", Instant.parse("2025-06-19T05:10:00Z"));

        new FileCursorRepository(file, objectMapper).save(state);

        assertEquals(Optional.of(state), new FileCursorRepository(file, objectMapper).load());
        try (Stream<Path> files = Files.list(file.getParent())) {
            assertEquals(1, files.count());
        }
    }

    @Test
    void shouldRejectCorruptCursor() throws Exception {
        Path file = dir.resolve("cursor.json");
        Files.writeString(file, "{\"bucket\": ");

        assertThrows(CursorPersistenceException.class, () -> new FileCursorRepository(file, objectMapper).load());
    }
}
