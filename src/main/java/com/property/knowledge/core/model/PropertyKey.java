package com.property.knowledge.core.model;

import java.util.Comparator;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Primary key of a shell property: the format identifier (property set GUID)
 * and the property identifier within that set.
 *
 * @param formatIdentifier   canonical lower-case hyphenated GUID text
 * @param propertyIdentifier unsigned 32-bit property identifier
 */
public record PropertyKey(String formatIdentifier, long propertyIdentifier) implements Comparable<PropertyKey> {

    public static final long MAX_PROPERTY_IDENTIFIER = 0xFFFFFFFFL;

    private static final Pattern CANONICAL_GUID =
            Pattern.compile("^[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}$");

    private static final Comparator<PropertyKey> ORDER = Comparator
            .comparing(PropertyKey::formatIdentifier)
            .thenComparingLong(PropertyKey::propertyIdentifier);

    public PropertyKey {
        Objects.requireNonNull(formatIdentifier, "formatIdentifier is required");
        if (!CANONICAL_GUID.matcher(formatIdentifier).matches()) {
            throw new IllegalArgumentException("formatIdentifier is not a canonical GUID: " + formatIdentifier);
        }
        if (propertyIdentifier < 0 || propertyIdentifier > MAX_PROPERTY_IDENTIFIER) {
            throw new IllegalArgumentException("propertyIdentifier out of range: " + propertyIdentifier);
        }
    }

    public static PropertyKey of(String formatIdentifier, long propertyIdentifier) {
        return new PropertyKey(formatIdentifier, propertyIdentifier);
    }

    /**
     * Returns true if the given text is already in canonical GUID form.
     */
    public static boolean isCanonicalGuid(String text) {
        return text != null && CANONICAL_GUID.matcher(text).matches();
    }

    /**
     * The lookup key in the {@code {guid}/pid} notation used by the property definition files.
     */
    public String lookupKey() {
        return "{" + formatIdentifier + "}/" + propertyIdentifier;
    }

    @Override
    public int compareTo(PropertyKey other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return lookupKey();
    }
}
