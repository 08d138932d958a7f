package com.krickert.protocompat.model.view;

import com.krickert.protocompat.model.resource.ResourceDatabase;
import com.krickert.protocompat.model.resource.ResourceDefinition;
import com.krickert.protocompat.model.resource.ResourceReference;
import lombok.Builder;

/**
 * Normalized view of one field at one schema revision.
 *
 * @param name             The field name. Must not be null.
 * @param number           The field number, used to pair fields across revisions.
 * @param repeated         Whether the field carries the repeated label.
 * @param required         Whether the field is required (proto2 label or {@code field_behavior = REQUIRED}).
 * @param protoType        The descriptor type, e.g. {@code TYPE_INT32}. Must not be null.
 * @param typeName         Fully-qualified message or enum type name for non-scalar fields. Can be null.
 * @param mapType          Whether the field is a map.
 * @param mapEntryType     Key and value types when {@code mapType} is set. Can be null.
 * @param oneofName        The enclosing oneof (synthetic for proto3 optional). Can be null.
 * @param proto3Optional   Whether the field is declared {@code optional} in proto3.
 * @param resourceReference The field's {@code google.api.resource_reference}. Can be null.
 * @param apiVersion       Version segment of the declaring package, e.g. {@code v1}. Can be null.
 * @param messageResource  The {@code google.api.resource} of the enclosing message. Can be null.
 * @param resourceDatabase Resource index of the schema tree the field belongs to. Can be null.
 * @param file             Declaring proto file. Can be null.
 * @param line             1-based source line, or -1.
 */
@Builder(toBuilder = true)
public record FieldView(
        String name,
        int number,
        boolean repeated,
        boolean required,
        String protoType,
        String typeName,
        boolean mapType,
        MapEntryType mapEntryType,
        String oneofName,
        boolean proto3Optional,
        ResourceReference resourceReference,
        String apiVersion,
        ResourceDefinition messageResource,
        ResourceDatabase resourceDatabase,
        String file,
        int line
) {
    public FieldView {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("FieldView name cannot be null or blank.");
        }
        if (protoType == null || protoType.isBlank()) {
            throw new IllegalArgumentException("FieldView protoType cannot be null or blank for field " + name);
        }
        if (mapType && mapEntryType == null) {
            throw new IllegalArgumentException("Map field " + name + " must carry its key and value types.");
        }
    }

    public boolean isInOneof() {
        return oneofName != null;
    }

    public boolean isChildTypeReference() {
        return resourceReference != null && resourceReference.isChildType();
    }
}
