package com.property.knowledge.core.model;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Names one of the recognized record sources (for example {@code propkey_h} or {@code win32docs}).
 * Recognized tags come from configuration; there is no fixed enumeration in code.
 */
public record SourceTag(String name) implements Comparable<SourceTag> {

    private static final Pattern VALID_NAME = Pattern.compile("^[a-z0-9][a-z0-9_\\-]*$");

    public SourceTag {
        Objects.requireNonNull(name, "name is required");
        if (!VALID_NAME.matcher(name).matches()) {
            throw new IllegalArgumentException("Invalid source tag: '" + name + "'");
        }
    }

    public static SourceTag of(String name) {
        return new SourceTag(name);
    }

    @Override
    public int compareTo(SourceTag other) {
        return name.compareTo(other.name);
    }

    @Override
    public String toString() {
        return name;
    }
}
