package com.wafsentinel.engine.hardening;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DiffJournalTest {

    @TempDir
    Path dir;

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
    private final DiffSigner signer = new DiffSigner("journal-key");

    private DiffJournal journal() {
        return new DiffJournal(dir.resolve("journal/ruleset-diffs.jsonl"), objectMapper, signer);
    }

    @Test
    void shouldAppendAndReadBackSignedDiffs() throws Exception {
        DiffJournal journal = journal();
        RuleSetDiff first = signer.sign(DiffSignerTest.diff("cycle-1"));
        RuleSetDiff second = signer.sign(DiffSignerTest.diff("cycle-2"));

        journal.append(first);
        journal.append(second);

        assertEquals(List.of(first, second), journal().entries());
        assertEquals(2, Files.readAllLines(dir.resolve("journal/ruleset-diffs.jsonl")).size());
        assertEquals(second, journal.find("cycle-2").orElseThrow());
        assertTrue(journal.find("cycle-9").isEmpty());
    }

    @Test
    void shouldRefuseUnsignedDiff() {
        assertThrows(JournalIntegrityException.class, () -> journal().append(DiffSignerTest.diff("cycle-1")));
        assertTrue(journal().entries().isEmpty());
    }

    @Test
    void shouldDetectTamperedEntry() throws Exception {
        DiffJournal journal = journal();
        journal.append(signer.sign(DiffSignerTest.diff("cycle-1")));
        Path file = dir.resolve("journal/ruleset-diffs.jsonl");
        String tampered = Files.readString(file, StandardCharsets.UTF_8).replace("\"ACTIVE\"", "\"DEMOTED\"");
        Files.writeString(file, tampered, StandardCharsets.UTF_8);

        assertThrows(JournalIntegrityException.class, journal::entries);
        assertThrows(JournalIntegrityException.class, () -> journal.find("cycle-1"));
    }
}
