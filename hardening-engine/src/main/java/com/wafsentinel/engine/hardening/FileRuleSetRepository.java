package com.wafsentinel.engine.hardening;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.wafsentinel.engine.hardening.ModSecurityRuleRenderer.RenderedRules;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Rule set stored as three files: the state JSON and the two rendered
 * ModSecurity includes.
 *
 * <p>
 * A commit holds a file lock, checks the stored version, stages all three
 * files next to their targets and moves them into place. If any move fails,
 * the files already replaced are restored from backups so the firewall and the
 * state file keep describing the same version.
 * </p>
 *
 * @author WAF Sentinel Team
 */
public class FileRuleSetRepository implements RuleSetRepository {

    private static final Logger log = LoggerFactory.getLogger(FileRuleSetRepository.class);

    private final Path stateFile;
    private final Path customRulesFile;
    private final Path exclusionsFile;
    private final ModSecurityRuleRenderer renderer;
    private final ObjectMapper objectMapper;
    private final ReentrantLock lock = new ReentrantLock();

    public FileRuleSetRepository(Path stateFile, Path customRulesFile, Path exclusionsFile,
            ModSecurityRuleRenderer renderer, ObjectMapper objectMapper) {
        this.stateFile = stateFile;
        this.customRulesFile = customRulesFile;
        this.exclusionsFile = exclusionsFile;
        this.renderer = renderer;
        this.objectMapper = objectMapper;
    }

    @Override
    public RuleSetState load() {
        if (!Files.exists(stateFile)) {
            return RuleSetState.initial();
        }
        try {
            return objectMapper.readValue(stateFile.toFile(), RuleSetState.class);
        } catch (IOException e) {
            throw new RuleSetPersistenceException("Cannot read rule set " + stateFile + ": " + e.getMessage(), e);
        }
    }

    @Override
    public RuleSetState compareAndWrite(long expectedVersion, RuleSetState proposed) {
        if (proposed.version() != expectedVersion + 1) {
            throw new IllegalArgumentException("Proposed version " + proposed.version()
                    + " does not follow " + expectedVersion);
        }
        lock.lock();
        try {
            Files.createDirectories(stateFile.toAbsolutePath().getParent());
            Path lockFile = stateFile.resolveSibling(stateFile.getFileName() + ".lock");
            try (FileChannel channel = FileChannel.open(lockFile, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
                    FileLock ignored = channel.lock()) {
                RuleSetState current = load();
                if (current.version() != expectedVersion) {
                    throw new RuleConflictException(expectedVersion, current.version());
                }
                RenderedRules rendered = renderer.render(proposed);
                replaceAll(List.of(
                        new Staged(customRulesFile, rendered.customRules()),
                        new Staged(exclusionsFile, rendered.exclusions()),
                        new Staged(stateFile, objectMapper.writerWithDefaultPrettyPrinter()
                                .writeValueAsString(proposed))));
            }
            log.info("Rule set version {} committed: {} active rule(s)",
                    proposed.version(), proposed.activeRuleIds().size());
            return proposed;
        } catch (IOException e) {
            throw new RuleSetPersistenceException("Cannot commit rule set version " + proposed.version()
                    + ": " + e.getMessage(), e);
        } finally {
            lock.unlock();
        }
    }

    private void replaceAll(List<Staged> files) throws IOException {
        List<Path> cleanup = new ArrayList<>();
        List<Staged> replaced = new ArrayList<>();
        try {
            for (Staged file : files) {
                Files.createDirectories(file.target().toAbsolutePath().getParent());
                file.temp = Files.createTempFile(file.target().toAbsolutePath().getParent(),
                        file.target().getFileName().toString(), ".tmp");
                cleanup.add(file.temp);
                Files.writeString(file.temp, file.content, StandardCharsets.UTF_8);
                if (Files.isRegularFile(file.target())) {
                    file.backup = Files.createTempFile(file.target().toAbsolutePath().getParent(),
                            file.target().getFileName().toString(), ".bak");
                    cleanup.add(file.backup);
                    Files.copy(file.target(), file.backup, StandardCopyOption.REPLACE_EXISTING);
                }
            }
            try {
                for (Staged file : files) {
                    Files.move(file.temp, file.target(), StandardCopyOption.REPLACE_EXISTING,
                            StandardCopyOption.ATOMIC_MOVE);
                    replaced.add(file);
                }
            } catch (IOException e) {
                log.error("Rule set commit failed while replacing files, restoring {} file(s): {}",
                        replaced.size(), e.getMessage());
                restore(replaced);
                throw e;
            }
        } finally {
            for (Path path : cleanup) {
                try {
                    Files.deleteIfExists(path);
                } catch (IOException e) {
                    log.warn("Could not delete staging file {}: {}", path, e.getMessage());
                }
            }
        }
    }

    private void restore(List<Staged> replaced) {
        for (Staged file : replaced) {
            try {
                if (file.backup != null) {
                    Files.move(file.backup, file.target(), StandardCopyOption.REPLACE_EXISTING,
                            StandardCopyOption.ATOMIC_MOVE);
                } else {
                    Files.deleteIfExists(file.target());
                }
                log.info("Restored {}", file.target());
            } catch (IOException restoreErr) {
                log.error("Restore failed: {} may not match the stored rule set: {}",
                        file.target(), restoreErr.getMessage());
            }
        }
    }

    private static final class Staged {
        private final Path target;
        private final String content;
        private Path temp;
        private Path backup;

        Staged(Path target, String content) {
            this.target = target;
            this.content = content;
        }

        Path target() {
            return target;
        }
    }
}
