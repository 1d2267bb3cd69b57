package com.property.knowledge.normalize;

import com.property.knowledge.core.model.CandidateEntry;
import com.property.knowledge.core.model.PropertyKey;
import com.property.knowledge.core.model.RecordField;
import com.property.knowledge.core.model.SourceTag;
import com.property.knowledge.rules.CleanupRuleSet;

import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Canonicalizes raw records into candidate entries.
 *
 * <p>Key fields are parsed strictly; optional fields are passed through the
 * source's {@link CleanupRuleSet}. The normalizer holds no state besides its
 * rule set, so {@link #normalize(RawRecord)} is a pure function.</p>
 */
public class RecordNormalizer {

    public static final String FORMAT_IDENTIFIER = "format_identifier";
    public static final String PROPERTY_IDENTIFIER = "property_identifier";

    private static final Set<String> SUPPORTED_KEYS = Set.of(
            "alias",
            "format_class",
            FORMAT_IDENTIFIER,
            "name",
            PROPERTY_IDENTIFIER,
            "shell_property_key",
            "value_type");

    private static final Pattern VARTYPE_CODE = Pattern.compile("^\\d{1,5}$");

    private final CleanupRuleSet rules;

    public RecordNormalizer(CleanupRuleSet rules) {
        this.rules = Objects.requireNonNull(rules, "rules is required");
    }

    public CleanupRuleSet getRules() {
        return rules;
    }

    /**
     * Normalizes field values coming from the given source.
     */
    public NormalizationResult normalize(Map<String, String> values, SourceTag source) {
        return normalize(new RawRecord(source, 0, values));
    }

    /**
     * Normalizes one raw record. Never throws for bad input; failures are returned.
     */
    public NormalizationResult normalize(RawRecord record) {
        if (record.values().isEmpty()) {
            return NormalizationResult.failure(record, "Missing property definition values");
        }

        Set<String> unsupported = new TreeSet<>(record.values().keySet());
        unsupported.removeAll(SUPPORTED_KEYS);
        if (!unsupported.isEmpty()) {
            return NormalizationResult.failure(record, "Undefined keys: " + String.join(", ", unsupported));
        }

        PropertyKey key;
        try {
            String formatIdentifier = GuidFormat.canonicalize(record.get(FORMAT_IDENTIFIER));
            long propertyIdentifier = GuidFormat.parsePropertyIdentifier(record.get(PROPERTY_IDENTIFIER));
            key = PropertyKey.of(formatIdentifier, propertyIdentifier);
        } catch (MalformedIdentifierException e) {
            return NormalizationResult.failure(record, e.getMessage());
        }

        CandidateEntry.Builder builder = CandidateEntry.builder()
                .key(key)
                .source(record.source());
        for (RecordField field : RecordField.values()) {
            String value = rules.clean(field, record.get(field.getKey()));
            if (field == RecordField.VALUE_TYPE) {
                value = formatVarType(value);
            }
            builder.field(field, value);
        }
        return NormalizationResult.success(builder.build(), record);
    }

    /**
     * Renders a numeric VARTYPE code as {@code 0x%04x}; other values are returned unchanged.
     */
    static String formatVarType(String value) {
        if (value == null || !VARTYPE_CODE.matcher(value).matches()) {
            return value;
        }
        return String.format("0x%04x", Integer.parseInt(value));
    }
}
