package com.krickert.protocompat.detector;

import com.google.protobuf.DescriptorProtos.FieldDescriptorProto.Type;
import com.krickert.protocompat.comparator.MalformedResourceReferenceException;
import com.krickert.protocompat.detector.config.DetectorConfiguration;
import com.krickert.protocompat.model.finding.ChangeType;
import com.krickert.protocompat.model.finding.Finding;
import com.krickert.protocompat.model.finding.FindingCategory;
import io.micronaut.test.extensions.junit5.annotation.MicronautTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.krickert.protocompat.detector.LibrarySchemas.field;
import static com.krickert.protocompat.detector.LibrarySchemas.library;
import static org.junit.jupiter.api.Assertions.*;

@MicronautTest
class BreakingChangeDetectorTest {

    @Inject
    BreakingChangeDetector detector;

    @Inject
    DetectorConfiguration configuration;

    @Test
    void testDefaultConfiguration() {
        assertEquals(1, configuration.getParallelism());
        assertEquals("compat-detector", configuration.getThreadNamePrefix());
        assertTrue(configuration.isSkipGoogleImports());
    }

    @Test
    void testIdenticalSchemas() {
        DetectionResult result = detector.detect(library("v1"), library("v1"));

        assertTrue(result.findings().isEmpty());
        assertFalse(result.breaking());
    }

    @Test
    void testVersionMoveIsNotBreaking() {
        DetectionResult result = detector.detect(library("v1"), library("v1beta1"));

        assertTrue(result.findings().isEmpty(), () -> "unexpected findings: " + result.findings());
    }

    @Test
    void testBreakingChanges() {
        DetectionResult result = detector.detect(library("v1"), library("v1", book -> book
                .setField(0, field("name", 1, Type.TYPE_BYTES))
                .removeField(1)
                .addField(field("isbn", 4, Type.TYPE_STRING))));

        List<Finding> findings = result.findings();
        assertEquals(3, findings.size(), () -> "unexpected findings: " + findings);
        assertEquals(FindingCategory.FIELD_TYPE_CHANGE, findings.get(0).category());
        assertEquals("Type of an existing field `name` is changed from `TYPE_STRING` to `TYPE_BYTES`.",
                findings.get(0).message());
        assertEquals(FindingCategory.FIELD_REMOVAL, findings.get(1).category());
        assertEquals(FindingCategory.FIELD_ADDITION, findings.get(2).category());
        assertEquals("google/example/library/v1/library.proto", findings.get(2).file());

        assertTrue(result.breaking());
        assertEquals(2, result.count(ChangeType.MAJOR));
        assertEquals(1, result.count(ChangeType.MINOR));
        assertEquals(2, result.breakingFindings().size());
    }

    @Test
    void testAdditionsOnlyAreNotBreaking() {
        DetectionResult result = detector.detect(library("v1"), library("v1", book -> book
                .addField(field("isbn", 4, Type.TYPE_STRING))));

        assertEquals(1, result.findings().size());
        assertFalse(result.breaking());
    }

    @Test
    void testMalformedResourceReferenceFailsDetection() {
        MalformedResourceReferenceException e = assertThrows(MalformedResourceReferenceException.class,
                () -> detector.detect(library("v1"), library("v1", book -> book
                        .setField(1, field("title", 2, Type.TYPE_STRING)
                                .setOptions(LibrarySchemas.emptyResourceReference())))));

        assertEquals("title", e.getFieldName());
    }
}
