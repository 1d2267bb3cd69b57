package com.property.knowledge.merge;

import com.property.knowledge.core.model.PropertyKey;
import com.property.knowledge.core.model.RecordField;
import com.property.knowledge.core.model.SourceTag;

import java.util.List;
import java.util.Objects;

/**
 * Record of sources disagreeing on one field of one property key, and how it was settled.
 *
 * @param key          the property key
 * @param field        the field the sources disagree on
 * @param chosen       the claim that became the canonical value
 * @param rejected     the claims with different values, in resolution order
 * @param sameTier     true if a rejected claim came from the chosen claim's tier
 */
public record FieldConflict(
        PropertyKey key,
        RecordField field,
        Claim chosen,
        List<Claim> rejected,
        boolean sameTier
) {
    public FieldConflict {
        Objects.requireNonNull(key, "key is required");
        Objects.requireNonNull(field, "field is required");
        Objects.requireNonNull(chosen, "chosen is required");
        rejected = rejected != null ? List.copyOf(rejected) : List.of();
    }

    /**
     * One source's value for a field.
     */
    public record Claim(SourceTag source, int rank, String value) {}
}
