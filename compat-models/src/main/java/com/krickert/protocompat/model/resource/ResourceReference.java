package com.krickert.protocompat.model.resource;

/**
 * A {@code google.api.resource_reference} annotation on a field.
 * <p>
 * Well-formed references set exactly one of {@code type} or {@code childType}. The record does not
 * enforce that, so a malformed annotation can reach the comparator and be reported there.
 *
 * @param type      The referenced resource type, e.g. {@code pubsub.googleapis.com/Topic}. Can be null.
 * @param childType A resource type whose parent is referenced. Can be null.
 */
public record ResourceReference(String type, String childType) {

    public ResourceReference {
        type = blankToNull(type);
        childType = blankToNull(childType);
    }

    public static ResourceReference ofType(String type) {
        return new ResourceReference(type, null);
    }

    public static ResourceReference ofChildType(String childType) {
        return new ResourceReference(null, childType);
    }

    public boolean isChildType() {
        return type == null && childType != null;
    }

    public boolean isMalformed() {
        return type == null && childType == null;
    }

    /**
     * @return {@code type} if set, otherwise {@code childType}
     */
    public String effectiveType() {
        return type != null ? type : childType;
    }

    private static String blankToNull(String value) {
        return (value == null || value.isBlank()) ? null : value;
    }
}
