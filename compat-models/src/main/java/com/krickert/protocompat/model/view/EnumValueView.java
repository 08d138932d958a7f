package com.krickert.protocompat.model.view;

/**
 * An enum value carries only its identity and name.
 */
public record EnumValueView(String name, int number, String file, int line) {

    public EnumValueView {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("EnumValueView name cannot be null or blank.");
        }
    }

    public EnumValueView(String name, int number) {
        this(name, number, null, -1);
    }
}
