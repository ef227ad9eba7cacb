package com.wafsentinel.engine.hardening;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Paranoia level 3 and 4 rules of the OWASP CRS, keyed by rule id.
 *
 * <p>
 * Directives are reassembled from backslash continuation lines; a
 * {@code SecRule} carrying the {@code chain} action absorbs the rule that
 * follows it. Comments and blank lines are ignored.
 * </p>
 *
 * @author WAF Sentinel Team
 */
public final class CrsRuleCatalog {

    private static final Logger log = LoggerFactory.getLogger(CrsRuleCatalog.class);

    static final Pattern PARANOIA_TAG = Pattern.compile("tag:'paranoia-level/([34])'");
    static final Pattern RULE_ID = Pattern.compile("\\bid\\s*:\\s*'?(\\d+)");
    static final Pattern SEVERITY = Pattern.compile("severity\\s*:\\s*'?(\\w+)");
    private static final Pattern CHAIN = Pattern.compile("[\"',\\s]chain[\"',\\s]");

    private final Map<String, CrsRule> rules;

    private CrsRuleCatalog(Map<String, CrsRule> rules) {
        this.rules = Collections.unmodifiableMap(rules);
    }

    public static CrsRuleCatalog empty() {
        return new CrsRuleCatalog(new TreeMap<>());
    }

    /**
     * Read every file; a later definition of the same id replaces an earlier one.
     *
     * @throws RuleSetPersistenceException if a file cannot be read
     */
    public static CrsRuleCatalog load(List<Path> files) {
        Map<String, CrsRule> rules = new TreeMap<>();
        for (Path file : files) {
            String content;
            try {
                content = Files.readString(file, StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new RuleSetPersistenceException("Cannot read CRS rule file " + file, e);
            }
            Map<String, CrsRule> parsed = parse(content, file.getFileName().toString());
            log.info("Loaded {} paranoia level 3/4 rules from {}", parsed.size(), file);
            rules.putAll(parsed);
        }
        return new CrsRuleCatalog(rules);
    }

    /** Extract the high-paranoia rules of one configuration file. */
    public static Map<String, CrsRule> parse(String content, String source) {
        Map<String, CrsRule> rules = new TreeMap<>();
        for (String directive : directives(content)) {
            Matcher level = PARANOIA_TAG.matcher(directive);
            Matcher id = RULE_ID.matcher(directive);
            if (!level.find() || !id.find()) {
                continue;
            }
            Matcher severity = SEVERITY.matcher(directive);
            String ruleId = id.group(1);
            rules.put(ruleId, new CrsRule(
                    ruleId,
                    Integer.parseInt(level.group(1)),
                    severity.find() ? severity.group(1).toLowerCase(Locale.ROOT) : null,
                    directive,
                    source));
        }
        return rules;
    }

    static List<String> directives(String content) {
        List<String> directives = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean continued = false;
        boolean chained = false;

        for (String raw : content.split("\\R")) {
            String line = raw.strip();
            if (!continued && (line.isEmpty() || line.startsWith("#"))) {
                continue;
            }
            if (!continued && !chained && current.length() > 0) {
                directives.add(current.toString());
                current.setLength(0);
            }
            if (!continued && chained) {
                chained = false;
            }
            if (current.length() > 0) {
                current.append('\n');
            }
            current.append(line);
            continued = line.endsWith("\\");
            if (!continued && isChainStart(current)) {
                chained = true;
            }
        }
        if (current.length() > 0) {
            directives.add(current.toString());
        }
        return directives;
    }

    private static boolean isChainStart(CharSequence directive) {
        String text = directive.toString();
        int lastRule = text.lastIndexOf("SecRule");
        return lastRule >= 0 && CHAIN.matcher(text.substring(lastRule) + " ").find();
    }

    public Optional<CrsRule> rule(String ruleId) {
        return Optional.ofNullable(rules.get(ruleId));
    }

    public boolean contains(String ruleId) {
        return rules.containsKey(ruleId);
    }

    public Set<String> ruleIds() {
        return rules.keySet();
    }

    public int size() {
        return rules.size();
    }
}
