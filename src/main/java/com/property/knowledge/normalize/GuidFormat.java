package com.property.knowledge.normalize;

import com.property.knowledge.core.model.PropertyKey;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Parsing of format identifier and property identifier text into their canonical forms.
 */
public final class GuidFormat {

    private static final Pattern COMPACT = Pattern.compile("^[0-9a-f]{32}$");

    private GuidFormat() {
        // Utility class
    }

    /**
     * Converts GUID text into lower-case hyphenated form.
     * Accepts surrounding braces and whitespace, any letter case and the 32-digit form without hyphens.
     *
     * @throws MalformedIdentifierException if the text is not a GUID
     */
    public static String canonicalize(String text) {
        if (text == null || text.isBlank()) {
            throw new MalformedIdentifierException("Missing format identifier");
        }

        String value = text.strip().toLowerCase(Locale.ROOT);
        if (value.startsWith("{") && value.endsWith("}")) {
            value = value.substring(1, value.length() - 1).strip();
        }

        if (PropertyKey.isCanonicalGuid(value)) {
            return value;
        }

        if (COMPACT.matcher(value).matches()) {
            return value.substring(0, 8) + '-' + value.substring(8, 12) + '-' + value.substring(12, 16)
                    + '-' + value.substring(16, 20) + '-' + value.substring(20);
        }
        throw new MalformedIdentifierException("Malformed format identifier: '" + text + "'");
    }

    /**
     * Parses a property identifier as an unsigned 32-bit value, in decimal or {@code 0x} hexadecimal.
     *
     * @throws MalformedIdentifierException if the text is not numeric, negative or out of range
     */
    public static long parsePropertyIdentifier(String text) {
        if (text == null || text.isBlank()) {
            throw new MalformedIdentifierException("Missing property identifier");
        }

        String value = text.strip();
        long parsed;
        try {
            if (value.startsWith("0x") || value.startsWith("0X")) {
                parsed = Long.parseLong(value.substring(2), 16);
            } else {
                parsed = Long.parseLong(value);
            }
        } catch (NumberFormatException e) {
            throw new MalformedIdentifierException("Malformed property identifier: '" + text + "'", e);
        }

        if (parsed < 0) {
            throw new MalformedIdentifierException("Negative property identifier: " + parsed);
        }
        if (parsed > PropertyKey.MAX_PROPERTY_IDENTIFIER) {
            throw new MalformedIdentifierException("Property identifier exceeds 32 bits: " + parsed);
        }
        return parsed;
    }
}
