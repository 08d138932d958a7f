package com.krickert.protocompat.comparator;

/**
 * Thrown when a {@code google.api.resource_reference} annotation sets neither {@code type} nor
 * {@code child_type}. The schema violates the annotation's own contract, so comparison cannot continue.
 */
public class MalformedResourceReferenceException extends RuntimeException {
    private final String fieldName;

    public MalformedResourceReferenceException(String fieldName) {
        super("In a resource_reference annotation, either `type` or `child_type` should be defined (field `"
                + fieldName + "`).");
        this.fieldName = fieldName;
    }

    public String getFieldName() {
        return fieldName;
    }
}
