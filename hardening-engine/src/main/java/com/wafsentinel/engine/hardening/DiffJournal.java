package com.wafsentinel.engine.hardening;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Append-only journal of signed rule set diffs, one JSON document per line.
 *
 * @author WAF Sentinel Team
 */
public class DiffJournal {

    private static final Logger log = LoggerFactory.getLogger(DiffJournal.class);

    private final Path file;
    private final ObjectMapper objectMapper;
    private final DiffSigner signer;

    public DiffJournal(Path file, ObjectMapper objectMapper, DiffSigner signer) {
        this.file = file;
        this.objectMapper = objectMapper;
        this.signer = signer;
    }

    /**
     * Append a signed diff.
     *
     * @throws RuleSetPersistenceException if the journal cannot be written
     */
    public synchronized void append(RuleSetDiff diff) {
        if (!signer.verify(diff)) {
            throw new JournalIntegrityException("Refusing to journal unsigned diff " + diff.cycleId());
        }
        try {
            Files.createDirectories(file.toAbsolutePath().getParent());
            String line = objectMapper.writeValueAsString(diff) + "\n";
            Files.writeString(file, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.SYNC);
        } catch (IOException e) {
            throw new RuleSetPersistenceException("Cannot append diff " + diff.cycleId() + " to " + file, e);
        }
        log.info("RULESET_DIFF: cycle={} version={}->{} transitions={}",
                diff.cycleId(), diff.baseVersion(), diff.resultingVersion(),
                diff.transitions().stream().map(t -> t.ruleId() + ":" + t.from() + "->" + t.to()).toList());
    }

    /**
     * Every journaled diff, oldest first.
     *
     * @throws JournalIntegrityException if an entry fails signature verification
     */
    public synchronized List<RuleSetDiff> entries() {
        if (!Files.exists(file)) {
            return List.of();
        }
        List<RuleSetDiff> diffs = new ArrayList<>();
        try {
            for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
                if (line.isBlank()) {
                    continue;
                }
                RuleSetDiff diff = objectMapper.readValue(line, RuleSetDiff.class);
                if (!signer.verify(diff)) {
                    throw new JournalIntegrityException("Invalid signature on journaled diff " + diff.cycleId());
                }
                diffs.add(diff);
            }
        } catch (IOException e) {
            throw new RuleSetPersistenceException("Cannot read journal " + file + ": " + e.getMessage(), e);
        }
        return diffs;
    }

    /** The latest diff journaled for {@code cycleId}. */
    public Optional<RuleSetDiff> find(String cycleId) {
        List<RuleSetDiff> diffs = entries();
        for (int i = diffs.size() - 1; i >= 0; i--) {
            if (diffs.get(i).cycleId().equals(cycleId)) {
                return Optional.of(diffs.get(i));
            }
        }
        return Optional.empty();
    }
}
