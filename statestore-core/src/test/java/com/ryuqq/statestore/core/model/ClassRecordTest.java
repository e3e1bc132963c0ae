package com.ryuqq.statestore.core.model;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ClassRecord 테스트.
 *
 * @author StateStore Team
 * @since 1.0.0
 */
class ClassRecordTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    @Test
    void of_SetsFileFields() {
        ClassRecord record = ClassRecord.of("Foo", "/work/demo/Foo.java", T0);

        assertEquals("Foo", record.name());
        assertEquals("/work/demo/Foo.java", record.filePath());
        assertTrue(record.hasFilePath());
        assertEquals(T0, record.lastModified());
        assertEquals(0, record.attributes().size());
    }

    @Test
    void of_WithoutPath_HasNoFilePath() {
        ClassRecord record = ClassRecord.of("Generated", null, null);

        assertFalse(record.hasFilePath());
        assertNull(record.lastModified());
    }

    @Test
    void attributes_AreDeepCopiedInAndOut() {
        // Given
        ObjectNode attributes = JsonNodeFactory.instance.objectNode();
        attributes.putArray("methods").add("run");
        ClassRecord record = ClassRecord.builder("Foo").attributes(attributes).build();

        // When
        ((ArrayNode) attributes.get("methods")).add("stop");
        ((ArrayNode) record.attributes().get("methods")).add("close");

        // Then
        assertEquals(1, record.attribute("methods").orElseThrow().size());
    }

    @Test
    void builder_AttributeOperations() {
        ClassRecord record = ClassRecord.builder("Foo")
            .attribute("status", "ANALYZED")
            .attribute("package", "com.example")
            .removeAttribute("package")
            .build();

        assertEquals("ANALYZED", record.attribute("status").orElseThrow().asText());
        assertTrue(record.attribute("package").isEmpty());
        assertThrows(IllegalArgumentException.class, () -> ClassRecord.builder("Foo").attribute(null, "x"));
    }

    @Test
    void toBuilder_ProducesIndependentModifiedCopy() {
        // Given
        ClassRecord original = ClassRecord.builder("Foo").attribute("status", "PENDING").build();

        // When
        ClassRecord modified = original.toBuilder().attribute("status", "DONE").lastModified(T0).build();

        // Then
        assertEquals("PENDING", original.attribute("status").orElseThrow().asText());
        assertEquals("DONE", modified.attribute("status").orElseThrow().asText());
        assertNotEquals(original, modified);
    }

    @Test
    void copy_IsEqualButNotSame() {
        ClassRecord record = ClassRecord.builder("Foo").filePath("/a/Foo.java").attribute("k", "v").build();

        ClassRecord copy = record.copy();

        assertEquals(record, copy);
        assertEquals(record.hashCode(), copy.hashCode());
        assertNotSame(record, copy);
    }
}
