package com.krickert.protocompat.model.view;

/**
 * Key and value types of a map field. Scalars are spelled as proto keywords ({@code string}),
 * messages and enums by their fully-qualified name.
 */
public record MapEntryType(String key, String value) {

    public MapEntryType {
        if (key == null || value == null) {
            throw new IllegalArgumentException("Map key and value types cannot be null.");
        }
    }

    @Override
    public String toString() {
        return "map<" + key + ", " + value + ">";
    }
}
