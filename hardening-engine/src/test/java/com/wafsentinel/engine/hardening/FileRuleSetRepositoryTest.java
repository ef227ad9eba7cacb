package com.wafsentinel.engine.hardening;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Map;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class FileRuleSetRepositoryTest {

    private static final Instant AT = Instant.parse("2025-06-19T06:00:00Z");

    @TempDir
    Path dir;

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
    private ModSecurityRuleRenderer renderer;

    @BeforeEach
    void setUp() throws Exception {
        renderer = new ModSecurityRuleRenderer(ModSecurityRuleRendererTest.fixtureCatalog(dir), "999");
    }

    private FileRuleSetRepository repository(Path exclusions) {
        return new FileRuleSetRepository(dir.resolve("state/rule-set.json"), dir.resolve("rules/custom_rules.conf"),
                exclusions, renderer, objectMapper);
    }

    private static RuleSetState activeAt(long version, String ruleId) {
        return new RuleSetState(version, AT, Map.of(ruleId, new RuleEntry(ruleId, 4, RuleState.ACTIVE, 0, AT)));
    }

    @Test
    void shouldStartFromEmptyRuleSet() {
        assertEquals(RuleSetState.initial(), repository(dir.resolve("rules/exclusions.conf")).load());
    }

    @Test
    void shouldCommitStateAndRenderedFilesTogether() throws Exception {
        Path exclusions = dir.resolve("rules/exclusions.conf");
        FileRuleSetRepository repository = repository(exclusions);

        RuleSetState committed = repository.compareAndWrite(0, activeAt(1, "942421"));

        assertEquals(committed, repository.load());
        assertEquals(committed, repository(exclusions).load());
        assertTrue(Files.readString(dir.resolve("rules/custom_rules.conf")).contains("id:999942421"));
        assertTrue(Files.readString(exclusions).contains("SecRuleRemoveById 942421"));
        try (Stream<Path> staged = Files.list(dir.resolve("rules"))) {
            assertEquals(2, staged.count());
        }
    }

    @Test
    void shouldRejectStaleBaseVersion() {
        FileRuleSetRepository repository = repository(dir.resolve("rules/exclusions.conf"));
        repository.compareAndWrite(0, activeAt(1, "942421"));

        RuleConflictException e = assertThrows(RuleConflictException.class,
                () -> repository.compareAndWrite(0, activeAt(1, "920300")));

        assertEquals(0, e.getExpectedVersion());
        assertEquals(1, e.getActualVersion());
        assertEquals(activeAt(1, "942421"), repository.load());
    }

    @Test
    void shouldRejectVersionGap() {
        FileRuleSetRepository repository = repository(dir.resolve("rules/exclusions.conf"));

        assertThrows(IllegalArgumentException.class, () -> repository.compareAndWrite(0, activeAt(2, "942421")));
    }

    @Test
    void shouldRestoreReplacedFilesWhenCommitFails() throws Exception {
        Path customRules = dir.resolve("rules/custom_rules.conf");
        Files.createDirectories(customRules.getParent());
        Files.writeString(customRules, "# hand-maintained\n");
        Path exclusions = dir.resolve("rules/exclusions.conf");
        Files.createDirectories(exclusions);
        Files.writeString(exclusions.resolve("keep"), "x");
        FileRuleSetRepository repository = repository(exclusions);

        assertThrows(RuleSetPersistenceException.class, () -> repository.compareAndWrite(0, activeAt(1, "942421")));

        assertEquals("# hand-maintained\n", Files.readString(customRules));
        assertEquals(RuleSetState.initial(), repository.load());
        assertFalse(Files.exists(dir.resolve("state/rule-set.json")));
    }

    @Test
    void shouldNotWriteAnythingWhenRuleCannotBeRendered() {
        FileRuleSetRepository repository = repository(dir.resolve("rules/exclusions.conf"));

        assertThrows(RuleSetPersistenceException.class, () -> repository.compareAndWrite(0, activeAt(1, "942110")));

        assertFalse(Files.exists(dir.resolve("rules/custom_rules.conf")));
        assertEquals(RuleSetState.initial(), repository.load());
    }
}
