package com.wafsentinel.engine.hardening;

import com.wafsentinel.engine.hardening.ModSecurityRuleRenderer.RenderedRules;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ModSecurityRuleRendererTest {

    private static final Instant AT = Instant.parse("2025-06-19T06:00:00Z");

    @TempDir
    Path dir;

    private CrsRuleCatalog catalog;
    private ModSecurityRuleRenderer renderer;

    static CrsRuleCatalog fixtureCatalog(Path dir) throws Exception {
        Path file = Files.writeString(dir.resolve("REQUEST-942-APPLICATION-ATTACK-SQLI.conf"),
                CrsRuleCatalogTest.SQLI_CONF);
        return CrsRuleCatalog.load(List.of(file));
    }

    @BeforeEach
    void setUp() throws Exception {
        catalog = fixtureCatalog(dir);
        renderer = new ModSecurityRuleRenderer(catalog, "999");
    }

    @Test
    void shouldPrefixIdsAndAdjustScoreBySeverity() {
        String critical = renderer.renderRule(catalog.rule("942421").orElseThrow());
        String notice = renderer.renderRule(catalog.rule("920300").orElseThrow());

        assertTrue(critical.contains("\"id:999942421,"));
        assertTrue(critical.contains("setvar:'tx.inbound_anomaly_score_pl4=+2'"));
        assertFalse(critical.contains("%{tx.critical_anomaly_score}"));
        assertTrue(notice.contains("\"id:999920300,"));
        assertTrue(notice.contains("setvar:'tx.inbound_anomaly_score_pl3=+0'"));
        assertEquals("999942421", renderer.customRuleId("942421"));
    }

    @Test
    void shouldKeepIncrementWhenSeverityIsUnknown() {
        CrsRule rule = new CrsRule("942500", 3, null,
                "SecRule ARGS \"@rx x\" \"id:942500,tag:'paranoia-level/3',"
                        + "setvar:'tx.inbound_anomaly_score_pl3=+%{tx.critical_anomaly_score}'\"",
                "x.conf");

        String rendered = renderer.renderRule(rule);

        assertTrue(rendered.contains("id:999942500"));
        assertTrue(rendered.contains("=+%{tx.critical_anomaly_score}'"));
    }

    @Test
    void shouldRenderOnlyEnforcedRules() {
        RuleSetState state = new RuleSetState(4, AT, Map.of(
                "942421", new RuleEntry("942421", 4, RuleState.ACTIVE, 0, AT),
                "920300", new RuleEntry("920300", 3, RuleState.CANDIDATE, 1, AT)));

        RenderedRules rendered = renderer.render(state);

        assertTrue(rendered.customRules().startsWith("# Managed by waf-sentinel, rule set version 4\n"));
        assertTrue(rendered.customRules().contains("id:999942421"));
        assertFalse(rendered.customRules().contains("999920300"));
        assertEquals("# Managed by waf-sentinel, rule set version 4\nSecRuleRemoveById 942421\n",
                rendered.exclusions());
    }

    @Test
    void shouldRenderHeadersOnlyForEmptyRuleSet() {
        RenderedRules rendered = renderer.render(RuleSetState.initial());

        assertEquals("# Managed by waf-sentinel, rule set version 0\n", rendered.customRules());
        assertEquals("# Managed by waf-sentinel, rule set version 0\n", rendered.exclusions());
    }

    @Test
    void shouldRefuseActiveRuleWithoutDefinition() {
        RuleSetState state = new RuleSetState(1, AT, Map.of(
                "942110", new RuleEntry("942110", 3, RuleState.ACTIVE, 0, AT)));

        assertThrows(RuleSetPersistenceException.class, () -> renderer.render(state));
    }

    @Test
    void shouldRejectNonNumericPrefix() {
        assertThrows(IllegalArgumentException.class, () -> new ModSecurityRuleRenderer(CrsRuleCatalog.empty(), "x9"));
    }
}
