package com.property.knowledge.merge;

import com.property.knowledge.core.model.PropertyKey;
import com.property.knowledge.core.model.RecordField;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Append-only ledger of the field conflicts settled during one merge.
 */
public class ConflictLedger {
    private static final Logger log = LoggerFactory.getLogger(ConflictLedger.class);

    private final List<FieldConflict> conflicts = new ArrayList<>();

    /**
     * Records a settled conflict.
     */
    public FieldConflict record(FieldConflict conflict) {
        conflicts.add(conflict);
        log.debug("Conflict on {} {}: kept '{}' from {}, rejected {}",
                conflict.key(), conflict.field().getKey(),
                conflict.chosen().value(), conflict.chosen().source(), conflict.rejected());
        return conflict;
    }

    /**
     * Gets all conflicts (immutable view) in the order they were settled.
     */
    public List<FieldConflict> getAll() {
        return Collections.unmodifiableList(new ArrayList<>(conflicts));
    }

    public List<FieldConflict> forKey(PropertyKey key) {
        return conflicts.stream()
                .filter(c -> c.key().equals(key))
                .collect(Collectors.toList());
    }

    public List<FieldConflict> forField(RecordField field) {
        return conflicts.stream()
                .filter(c -> c.field() == field)
                .collect(Collectors.toList());
    }

    public int size() {
        return conflicts.size();
    }

    public boolean isEmpty() {
        return conflicts.isEmpty();
    }
}
