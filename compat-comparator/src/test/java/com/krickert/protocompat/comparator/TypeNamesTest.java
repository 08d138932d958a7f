package com.krickert.protocompat.comparator;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TypeNamesTest {

    @Test
    void testIdenticalNamesAreEquivalent() {
        assertTrue(TypeNames.isEquivalent(".a.v1.Book", ".a.v1.Book", null, null));
        assertTrue(TypeNames.isEquivalent(null, null, "v1", "v2"));
    }

    @Test
    void testVersionMove() {
        assertTrue(TypeNames.isEquivalent(".google.example.v1.Book", ".google.example.v1beta1.Book", "v1", "v1beta1"));
        assertFalse(TypeNames.isEquivalent(".google.example.v1.Book", ".google.example.v2.Book", "v1", "v1beta1"));
    }

    @Test
    void testMissingVersionIsNotEquivalent() {
        assertFalse(TypeNames.isEquivalent(".google.example.v1.Book", ".google.example.v1beta1.Book", null, "v1beta1"));
        assertFalse(TypeNames.isEquivalent(".google.example.v1.Book", null, "v1", "v1"));
    }

    @Test
    void testOnlyWholeSegmentsAreSubstituted() {
        assertEquals(".google.example.v2.v1beta1Book",
                TypeNames.substituteVersion(".google.example.v1.v1beta1Book", "v1", "v2"));
        assertEquals("v2.Book", TypeNames.substituteVersion("v1.Book", "v1", "v2"));
        assertFalse(TypeNames.isEquivalent(".a.v1beta1.Book", ".a.v2beta1.Book", "v1", "v2"));
    }
}
