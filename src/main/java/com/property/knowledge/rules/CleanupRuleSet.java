package com.property.knowledge.rules;

import com.property.knowledge.core.model.RecordField;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * A named, ordered set of cleanup rules for one source.
 * Rules are applied in priority order (lower priority number = applied first).
 * Instances are immutable so one rule set can be shared by any number of loads.
 */
public final class CleanupRuleSet {
    private static final Logger log = LoggerFactory.getLogger(CleanupRuleSet.class);

    private final String name;
    private final List<CleanupRule> rules;

    public CleanupRuleSet(String name, List<CleanupRule> rules) {
        this.name = Objects.requireNonNull(name, "name is required");
        List<CleanupRule> sorted = new ArrayList<>(rules);
        // stable sort keeps declaration order within one priority
        sorted.sort(Comparator.comparingInt(CleanupRule::priority));
        this.rules = List.copyOf(sorted);
    }

    public static CleanupRuleSet empty(String name) {
        return new CleanupRuleSet(name, List.of());
    }

    public String getName() {
        return name;
    }

    public List<CleanupRule> getRules() {
        return rules;
    }

    /**
     * Returns a new rule set with the given rules added.
     */
    public CleanupRuleSet with(List<CleanupRule> additional) {
        List<CleanupRule> combined = new ArrayList<>(rules);
        combined.addAll(additional);
        return new CleanupRuleSet(name, combined);
    }

    /**
     * Cleans a field value. Returns {@code null} when the input is absent or
     * nothing meaningful remains after the rules ran.
     */
    public String clean(RecordField field, String value) {
        if (value == null) {
            return null;
        }

        String result = value;
        for (CleanupRule rule : rules) {
            if (rule.appliesTo(field)) {
                String before = result;
                result = rule.apply(result);
                if (!before.equals(result)) {
                    log.debug("Rule '{}' transformed {} '{}' -> '{}'", rule.name(), field.getKey(), before, result);
                }
            }
        }

        result = result.trim();
        return result.isEmpty() ? null : result;
    }

    @Override
    public String toString() {
        return "CleanupRuleSet{name='" + name + "', rules=" + rules.size() + '}';
    }
}
