package com.property.knowledge.rules;

import com.property.knowledge.core.model.RecordField;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Built-in cleanup rule sets for the known property definition sources.
 * Each set is looked up by name from the pipeline configuration.
 */
public final class DefaultCleanupRules {

    public static final String COMMON = "common";
    public static final String PROPKEY_H = "propkey_h";
    public static final String WIN32DOCS = "win32docs";
    public static final String SYSTEM_PROPERTIES = "system_properties";

    private static final Map<String, CleanupRuleSet> RULE_SETS = createRuleSets();

    private DefaultCleanupRules() {
        // Utility class
    }

    /**
     * Looks up a built-in rule set by name.
     */
    public static Optional<CleanupRuleSet> forName(String name) {
        return Optional.ofNullable(RULE_SETS.get(name));
    }

    public static List<String> names() {
        return List.copyOf(RULE_SETS.keySet());
    }

    private static Map<String, CleanupRuleSet> createRuleSets() {
        Map<String, CleanupRuleSet> ruleSets = new TreeMap<>();
        ruleSets.put(COMMON, new CleanupRuleSet(COMMON, getCommonRules()));
        ruleSets.put(PROPKEY_H, new CleanupRuleSet(PROPKEY_H, getCommonRules()));
        ruleSets.put(WIN32DOCS, new CleanupRuleSet(WIN32DOCS, getCommonRules())
                .with(getDocumentationRules()));
        ruleSets.put(SYSTEM_PROPERTIES, new CleanupRuleSet(SYSTEM_PROPERTIES, getCommonRules())
                .with(getSystemPropertiesRules()));
        return Map.copyOf(ruleSets);
    }

    /**
     * Gets rules that apply to every source.
     */
    public static List<CleanupRule> getCommonRules() {
        return List.of(
                // Windows line endings left over from extraction
                CleanupRule.of("common-carriage-return", "[\\r\\n]+", "", 1),

                CleanupRule.of("common-html-ampersand", "&amp;", "&", 5),

                CleanupRule.of("common-non-breaking-space", "\\u00a0", " ", 5)
        );
    }

    /**
     * Gets rules for the Win32 documentation scrape, which quotes identifiers in markdown code spans.
     */
    public static List<CleanupRule> getDocumentationRules() {
        return List.of(
                CleanupRule.of("docs-code-span", "`", "", 10,
                        RecordField.NAME, RecordField.SHELL_PROPERTY_KEY)
        );
    }

    /**
     * Gets rules for the generated system properties table.
     * Its format class and alias columns look like {@code (FMTID_Storage) ...} and
     * {@code (PIDSI_TITLE)}, and its type column like {@code String -- VT_LPWSTR (For variants: VT_BSTR)}.
     */
    public static List<CleanupRule> getSystemPropertiesRules() {
        return List.of(
                CleanupRule.of("system-properties-parenthesized-identifier",
                        "^\\s*\\(\\s*([^\\s)]+)[^)]*\\).*$", "$1", 10, RecordField.FORMAT_CLASS, RecordField.ALIAS),

                // An alias without an underscore is descriptive text, not an identifier
                CleanupRule.of("system-properties-alias-not-identifier", "^[^_]*$", "", 20, RecordField.ALIAS),

                CleanupRule.of("system-properties-type-description", "^.*--\\s*", "", 10, RecordField.VALUE_TYPE),

                CleanupRule.of("system-properties-type-qualifier", "\\s*\\(.*\\)\\s*$", "", 20, RecordField.VALUE_TYPE)
        );
    }
}
