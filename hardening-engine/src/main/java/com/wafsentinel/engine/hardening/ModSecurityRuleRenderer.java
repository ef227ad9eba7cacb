package com.wafsentinel.engine.hardening;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Renders the enforced rules into the two files ModSecurity includes:
 * the custom rules, re-numbered under an id prefix so they never collide with
 * the stock CRS ids, and the exclusions that remove the stock originals.
 *
 * <p>
 * The anomaly score increment of a rendered rule follows its severity:
 * critical adds 2, error and warning add 1, notice adds 0.
 * </p>
 *
 * @author WAF Sentinel Team
 */
public class ModSecurityRuleRenderer {

    private static final Pattern RULE_ID = Pattern.compile("\\bid(\\s*:\\s*'?)(\\d+)");
    private static final Pattern SCORE_INCREMENT = Pattern.compile(
            "setvar:'tx\\.inbound_anomaly_score_pl([34])=\\+%\\{tx\\.[a-z_]*?_anomaly_score\\}'");

    private final CrsRuleCatalog catalog;
    private final String idPrefix;

    public ModSecurityRuleRenderer(CrsRuleCatalog catalog, String idPrefix) {
        if (idPrefix == null || !idPrefix.matches("\\d+")) {
            throw new IllegalArgumentException("Rule id prefix must be numeric: " + idPrefix);
        }
        this.catalog = catalog;
        this.idPrefix = idPrefix;
    }

    /**
     * Render both files for the enforced rules of {@code state}.
     *
     * @throws RuleSetPersistenceException if an enforced rule is not in the catalog
     */
    public RenderedRules render(RuleSetState state) {
        StringBuilder custom = new StringBuilder();
        StringBuilder exclusions = new StringBuilder();
        custom.append("# Managed by waf-sentinel, rule set version ").append(state.version()).append('\n');
        exclusions.append("# Managed by waf-sentinel, rule set version ").append(state.version()).append('\n');

        for (String ruleId : state.activeRuleIds()) {
            CrsRule rule = catalog.rule(ruleId).orElseThrow(() -> new RuleSetPersistenceException(
                    "Active rule " + ruleId + " has no CRS definition"));
            custom.append('\n').append(renderRule(rule)).append('\n');
            exclusions.append("SecRuleRemoveById ").append(ruleId).append('\n');
        }
        return new RenderedRules(custom.toString(), exclusions.toString());
    }

    /** The rule text with prefixed ids and a severity-adjusted score increment. */
    public String renderRule(CrsRule rule) {
        Matcher ids = RULE_ID.matcher(rule.text());
        String renumbered = ids.replaceAll(m -> "id" + Matcher.quoteReplacement(m.group(1)) + idPrefix + m.group(2));

        String increment = increment(rule.severity());
        if (increment == null) {
            return renumbered;
        }
        return SCORE_INCREMENT.matcher(renumbered)
                .replaceAll(m -> "setvar:'tx.inbound_anomaly_score_pl" + m.group(1) + "=+" + increment + "'");
    }

    public String customRuleId(String ruleId) {
        return idPrefix + ruleId;
    }

    private static String increment(String severity) {
        if (severity == null) {
            return null;
        }
        return switch (severity.toLowerCase(Locale.ROOT)) {
            case "critical" -> "2";
            case "error", "warning" -> "1";
            case "notice" -> "0";
            default -> null;
        };
    }

    /** Contents of the custom rules file and of the exclusions file. */
    public record RenderedRules(String customRules, String exclusions) {
    }
}
