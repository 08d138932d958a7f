package com.krickert.protocompat.model.finding;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FindingTest {

    private ObjectMapper objectMapper;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper();
    }

    @Test
    void testSerializationDeserialization() throws Exception {
        Finding finding = new Finding(FindingCategory.FIELD_REMOVAL, ChangeType.MAJOR,
                "An existing field `language` is removed.", "google/example/v1/library.proto", 42);

        String json = objectMapper.writeValueAsString(finding);
        Finding deserialized = objectMapper.readValue(json, Finding.class);

        assertEquals(finding, deserialized);
    }

    @Test
    void testJsonShape() throws Exception {
        Finding finding = new Finding(FindingCategory.FIELD_ADDITION, ChangeType.MINOR,
                "A new field `title` is added.", null, -1);

        JsonNode node = objectMapper.readTree(objectMapper.writeValueAsString(finding));

        assertEquals("FIELD_ADDITION", node.get("category").asText());
        assertEquals("MINOR", node.get("severity").asText());
        assertEquals(-1, node.get("line").asInt());
        assertTrue(node.get("file").isNull());
        assertFalse(node.has("breaking"), "derived flag should not be serialized");
    }

    @Test
    void testIsBreaking() {
        assertTrue(new Finding(FindingCategory.FIELD_REMOVAL, ChangeType.MAJOR, "m", null, -1).isBreaking());
        assertFalse(new Finding(FindingCategory.FIELD_ADDITION, ChangeType.MINOR, "m", null, -1).isBreaking());
        assertFalse(new Finding(FindingCategory.FIELD_ADDITION, ChangeType.PATCH, "m", null, -1).isBreaking());
    }

    @Test
    void testRequiredComponents() {
        assertThrows(IllegalArgumentException.class,
                () -> new Finding(null, ChangeType.MAJOR, "m", null, -1));
        assertThrows(IllegalArgumentException.class,
                () -> new Finding(FindingCategory.FIELD_REMOVAL, null, "m", null, -1));
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> new Finding(FindingCategory.FIELD_REMOVAL, ChangeType.MAJOR, null, null, -1));
        assertEquals("Finding message cannot be null.", e.getMessage());
    }
}
