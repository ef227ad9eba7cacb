package com.wafsentinel.engine.hardening;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class CrsRuleCatalogTest {

    static final String SQLI_CONF = """
            # ------------------------------------------------------------------------
            # OWASP CRS ver.4 - REQUEST-942-APPLICATION-ATTACK-SQLI
            # ------------------------------------------------------------------------

            SecRule ARGS "@rx (?i)union.*select" \\
                "id:942100,\\
                phase:2,\\
                block,\\
                severity:'CRITICAL',\\
                tag:'paranoia-level/1',\\
                setvar:'tx.inbound_anomaly_score_pl1=+%{tx.critical_anomaly_score}'"

            SecRule REQUEST_COOKIES|ARGS_NAMES|ARGS "@rx ((?:[~!@#\\$%\\^&\\*\\(\\)\\-\\+=\\{\\}\\[\\]\\|:;\\"'´’‘`<>][^~!@#\\$%\\^&\\*\\(\\)\\-\\+=\\{\\}\\[\\]\\|:;\\"'´’‘`<>]*?){3})" \\
                "id:942421,\\
                phase:2,\\
                block,\\
                severity:'CRITICAL',\\
                tag:'paranoia-level/4',\\
                setvar:'tx.inbound_anomaly_score_pl4=+%{tx.critical_anomaly_score}'"

            SecRule REQUEST_HEADERS:Referer "@rx ^[^/]" \\
                "id:920300,\\
                phase:1,\\
                pass,\\
                severity:'NOTICE',\\
                tag:'paranoia-level/3',\\
                chain"
                SecRule REQUEST_METHOD "!@rx ^OPTIONS$" \\
                    "t:none,\\
                    setvar:'tx.inbound_anomaly_score_pl3=+%{tx.notice_anomaly_score}'"
            """;

    @TempDir
    Path dir;

    @Test
    void shouldKeepOnlyHighParanoiaRules() {
        Map<String, CrsRule> rules = CrsRuleCatalog.parse(SQLI_CONF, "REQUEST-942-APPLICATION-ATTACK-SQLI.conf");

        assertEquals(Set.of("942421", "920300"), rules.keySet());
        CrsRule rule = rules.get("942421");
        assertEquals(4, rule.paranoiaLevel());
        assertEquals("critical", rule.severity());
        assertEquals("REQUEST-942-APPLICATION-ATTACK-SQLI.conf", rule.source());
        assertTrue(rule.text().startsWith("SecRule REQUEST_COOKIES"));
    }

    @Test
    void shouldAbsorbChainedRuleIntoItsParent() {
        CrsRule chained = CrsRuleCatalog.parse(SQLI_CONF, "sqli.conf").get("920300");

        assertEquals(3, chained.paranoiaLevel());
        assertEquals("notice", chained.severity());
        assertTrue(chained.text().contains("SecRule REQUEST_METHOD"));
        assertTrue(chained.text().endsWith("setvar:'tx.inbound_anomaly_score_pl3=+%{tx.notice_anomaly_score}'\""));
    }

    @Test
    void shouldSplitDirectivesOnContinuationBoundaries() {
        List<String> directives = CrsRuleCatalog.directives("""
                SecRuleEngine On
                # comment
                SecRule ARGS "@rx a" \\
                    "id:1,\\
                    pass"
                SecAction "id:2,pass"
                """);

        assertEquals(3, directives.size());
        assertEquals("SecRuleEngine On", directives.get(0));
        assertEquals("SecRule ARGS \"@rx a\" \\\n\"id:1,\\\npass\"", directives.get(1));
    }

    @Test
    void shouldLoadFilesWithLaterDefinitionsWinning() throws Exception {
        Path first = Files.writeString(dir.resolve("a.conf"), SQLI_CONF);
        Path second = Files.writeString(dir.resolve("b.conf"), """
                SecRule ARGS "@rx override" \\
                    "id:942421,\\
                    severity:'WARNING',\\
                    tag:'paranoia-level/3'"
                """);

        CrsRuleCatalog catalog = CrsRuleCatalog.load(List.of(first, second));

        assertEquals(2, catalog.size());
        assertTrue(catalog.contains("920300"));
        assertEquals("b.conf", catalog.rule("942421").orElseThrow().source());
        assertEquals("warning", catalog.rule("942421").orElseThrow().severity());
        assertTrue(catalog.rule("942100").isEmpty());
    }

    @Test
    void shouldFailOnUnreadableFile() {
        assertThrows(RuleSetPersistenceException.class,
                () -> CrsRuleCatalog.load(List.of(dir.resolve("missing.conf"))));
    }
}
