package com.property.knowledge.kb;

import com.property.knowledge.core.model.CanonicalEntry;
import com.property.knowledge.core.model.PropertyKey;
import com.property.knowledge.core.model.SourceTag;
import com.property.knowledge.normalize.MalformedIdentifierException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.SortedMap;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class KnowledgeBaseTest {

    private static final String SUMMARY_INFORMATION = "f29f85e0-4ff9-1068-ab91-08002b27b3d9";
    private static final String STORAGE = "b725f130-47ef-101a-a5f1-02608c9eebac";

    private KnowledgeBase kb;

    @BeforeEach
    void setUp() {
        kb = KnowledgeBase.builder()
                .add(entry(SUMMARY_INFORMATION, 4, "System.Author"))
                .add(entry(STORAGE, 12, "System.Size"))
                .add(entry(SUMMARY_INFORMATION, 2, "System.Title"))
                .build();
    }

    private static CanonicalEntry entry(String formatIdentifier, long propertyIdentifier, String name) {
        return CanonicalEntry.builder()
                .key(formatIdentifier, propertyIdentifier)
                .name(name)
                .addProvenance(SourceTag.of("propkey_h"))
                .build();
    }

    @Test
    @DisplayName("Lookup accepts any GUID notation")
    void testLookup() {
        assertEquals("System.Title", kb.lookup(SUMMARY_INFORMATION, 2).orElseThrow().name());
        assertEquals("System.Title", kb.lookup("{F29F85E0-4FF9-1068-AB91-08002B27B3D9}", 2).orElseThrow().name());
        assertEquals("System.Size", kb.lookup(PropertyKey.of(STORAGE, 12)).orElseThrow().name());
    }

    @Test
    @DisplayName("Unknown keys are absent, not errors")
    void testLookupAbsent() {
        assertTrue(kb.lookup(SUMMARY_INFORMATION, 3).isEmpty());
        assertTrue(kb.lookup(SUMMARY_INFORMATION, -1).isEmpty());
        assertTrue(kb.lookup(SUMMARY_INFORMATION, PropertyKey.MAX_PROPERTY_IDENTIFIER + 1).isEmpty());
        assertFalse(kb.contains(PropertyKey.of(STORAGE, 2)));
    }

    @Test
    @DisplayName("A malformed format identifier is rejected")
    void testLookupMalformed() {
        assertThrows(MalformedIdentifierException.class, () -> kb.lookup("not-a-guid", 2));
    }

    @Test
    @DisplayName("Enumeration is in key order and restartable")
    void testEnumerationOrder() {
        List<String> first = kb.stream().map(CanonicalEntry::name).collect(Collectors.toList());
        List<String> second = kb.stream().map(CanonicalEntry::name).collect(Collectors.toList());

        assertEquals(List.of("System.Size", "System.Title", "System.Author"), first);
        assertEquals(first, second);
        assertEquals(kb.entries(), kb.stream().collect(Collectors.toList()));
    }

    @Test
    @DisplayName("Entries group into property sets")
    void testPropertySets() {
        SortedMap<String, List<CanonicalEntry>> sets = kb.propertySets();

        assertEquals(List.of(STORAGE, SUMMARY_INFORMATION), List.copyOf(sets.keySet()));
        assertEquals(2, sets.get(SUMMARY_INFORMATION).size());
        assertEquals(2, sets.get(SUMMARY_INFORMATION).get(0).propertyIdentifier());
    }

    @Test
    @DisplayName("Adding the same key twice is rejected")
    void testDuplicateKey() {
        KnowledgeBase.Builder builder = KnowledgeBase.builder().add(entry(SUMMARY_INFORMATION, 2, "System.Title"));

        assertThrows(IllegalStateException.class,
                () -> builder.add(entry(SUMMARY_INFORMATION, 2, "System.Caption")));
    }

    @Test
    @DisplayName("Equivalence ignores provenance")
    void testEquivalence() {
        KnowledgeBase other = KnowledgeBase.builder()
                .add(CanonicalEntry.builder().key(SUMMARY_INFORMATION, 2).name("System.Title").build())
                .add(CanonicalEntry.builder().key(SUMMARY_INFORMATION, 4).name("System.Author").build())
                .add(CanonicalEntry.builder().key(STORAGE, 12).name("System.Size").build())
                .build();

        assertTrue(kb.equivalentTo(other));
        assertNotEquals(kb, other);
        assertFalse(kb.equivalentTo(KnowledgeBase.empty()));
        assertTrue(KnowledgeBase.empty().isEmpty());
    }
}
