package com.property.knowledge.merge;

import com.property.knowledge.core.model.PropertyKey;
import com.property.knowledge.core.model.RecordField;
import com.property.knowledge.core.model.SourceTag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConflictLedgerTest {

    private static final PropertyKey TITLE = PropertyKey.of("f29f85e0-4ff9-1068-ab91-08002b27b3d9", 2);
    private static final PropertyKey AUTHOR = PropertyKey.of("f29f85e0-4ff9-1068-ab91-08002b27b3d9", 4);

    private static FieldConflict conflict(PropertyKey key, RecordField field) {
        return new FieldConflict(key, field,
                new FieldConflict.Claim(SourceTag.of("propkey_h"), 1, "chosen"),
                List.of(new FieldConflict.Claim(SourceTag.of("win32docs"), 2, "rejected")),
                false);
    }

    @Test
    void recordsAreKeptInOrder() {
        ConflictLedger ledger = new ConflictLedger();
        FieldConflict first = ledger.record(conflict(TITLE, RecordField.NAME));
        FieldConflict second = ledger.record(conflict(AUTHOR, RecordField.VALUE_TYPE));

        assertEquals(List.of(first, second), ledger.getAll());
        assertEquals(2, ledger.size());
    }

    @Test
    void filtersByKeyAndField() {
        ConflictLedger ledger = new ConflictLedger();
        ledger.record(conflict(TITLE, RecordField.NAME));
        ledger.record(conflict(TITLE, RecordField.VALUE_TYPE));
        ledger.record(conflict(AUTHOR, RecordField.VALUE_TYPE));

        assertEquals(2, ledger.forKey(TITLE).size());
        assertEquals(2, ledger.forField(RecordField.VALUE_TYPE).size());
        assertTrue(ledger.forField(RecordField.ALIAS).isEmpty());
    }

    @Test
    void snapshotIsImmutable() {
        ConflictLedger ledger = new ConflictLedger();
        assertTrue(ledger.isEmpty());

        List<FieldConflict> snapshot = ledger.getAll();
        ledger.record(conflict(TITLE, RecordField.NAME));

        assertTrue(snapshot.isEmpty());
        assertThrows(UnsupportedOperationException.class, () -> ledger.getAll().clear());
    }
}
