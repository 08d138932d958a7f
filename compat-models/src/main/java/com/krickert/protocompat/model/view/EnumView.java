package com.krickert.protocompat.model.view;

import java.util.List;

public record EnumView(String name, String fullName, List<EnumValueView> values, String file, int line) {

    public EnumView {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("EnumView name cannot be null or blank.");
        }
        values = (values == null) ? List.of() : List.copyOf(values);
    }
}
