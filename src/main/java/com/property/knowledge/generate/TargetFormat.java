package com.property.knowledge.generate;

/**
 * Artifact formats the knowledge base can be generated into.
 */
public enum TargetFormat {
    /**
     * Persisted definitions file, one YAML document per entry.
     */
    YAML,

    /**
     * Java source of a static lookup table for the property store parser.
     */
    JAVA_SOURCE
}
