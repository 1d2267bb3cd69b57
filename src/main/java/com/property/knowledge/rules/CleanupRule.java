package com.property.knowledge.rules;

import com.property.knowledge.core.model.RecordField;

import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A case-insensitive regex replacement applied to record field values before normalization.
 * An empty field set means the rule applies to every field.
 *
 * <p>Two rules are equal when they would rewrite values identically: same name, regex,
 * replacement, fields and priority.</p>
 */
public record CleanupRule(String name, Pattern pattern, String replacement, Set<RecordField> fields, int priority) {

    public static final int DEFAULT_PRIORITY = 100;

    private static final Pattern GROUP_REFERENCE = Pattern.compile("(?<!\\\\)\\$(\\d)");

    public CleanupRule {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Cleanup rule needs a name");
        }
        Objects.requireNonNull(pattern, () -> "Cleanup rule '" + name + "' needs a pattern");
        Objects.requireNonNull(replacement, () -> "Cleanup rule '" + name + "' needs a replacement");
        if (priority < 0) {
            throw new IllegalArgumentException("Cleanup rule '" + name + "' has negative priority " + priority);
        }
        int groups = pattern.matcher("").groupCount();
        Matcher reference = GROUP_REFERENCE.matcher(replacement);
        while (reference.find()) {
            int group = Integer.parseInt(reference.group(1));
            if (group > groups) {
                throw new IllegalArgumentException("Cleanup rule '" + name + "' refers to group " + group
                        + " but its pattern has " + groups);
            }
        }
        fields = fields != null ? Set.copyOf(fields) : Set.of();
    }

    /**
     * Compiles {@code regex} case-insensitively.
     *
     * @throws java.util.regex.PatternSyntaxException if the regex does not compile
     */
    public static CleanupRule of(String name, String regex, String replacement, int priority, Set<RecordField> fields) {
        Objects.requireNonNull(regex, () -> "Cleanup rule '" + name + "' needs a pattern");
        return new CleanupRule(name, Pattern.compile(regex, Pattern.CASE_INSENSITIVE), replacement, fields, priority);
    }

    public static CleanupRule of(String name, String regex, String replacement, int priority, RecordField... fields) {
        return of(name, regex, replacement, priority, Set.of(fields));
    }

    public boolean appliesTo(RecordField field) {
        return fields.isEmpty() || fields.contains(field);
    }

    public String apply(String input) {
        if (input == null) {
            return null;
        }
        return pattern.matcher(input).replaceAll(replacement);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CleanupRule that = (CleanupRule) o;
        return priority == that.priority
                && name.equals(that.name)
                && pattern.pattern().equals(that.pattern.pattern())
                && pattern.flags() == that.pattern.flags()
                && replacement.equals(that.replacement)
                && fields.equals(that.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, pattern.pattern(), pattern.flags(), replacement, fields, priority);
    }
}
