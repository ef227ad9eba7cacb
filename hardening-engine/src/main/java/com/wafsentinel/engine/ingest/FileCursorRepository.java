package com.wafsentinel.engine.ingest;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * JSON cursor file replaced atomically (write to a sibling temp file, then
 * rename), so a crash leaves either the old or the new cursor on disk.
 *
 * @author WAF Sentinel Team
 */
public class FileCursorRepository implements CursorRepository {

    private static final Logger log = LoggerFactory.getLogger(FileCursorRepository.class);

    private final Path path;
    private final ObjectMapper objectMapper;

    public FileCursorRepository(Path path, ObjectMapper objectMapper) {
        this.path = path;
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<CursorState> load() {
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(path.toFile(), CursorState.class));
        } catch (IOException e) {
            throw new CursorPersistenceException("Cannot read cursor " + path + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void save(CursorState state) {
        try {
            Path dir = path.toAbsolutePath().getParent();
            Files.createDirectories(dir);
            Path tmp = Files.createTempFile(dir, path.getFileName().toString(), ".tmp");
            try {
                objectMapper.writeValue(tmp.toFile(), state);
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } finally {
                Files.deleteIfExists(tmp);
            }
            log.trace("Cursor persisted: bucket={} lastId={}", state.bucket(), state.lastId());
        } catch (IOException e) {
            throw new CursorPersistenceException("Cannot write cursor " + path + ": " + e.getMessage(), e);
        }
    }
}
