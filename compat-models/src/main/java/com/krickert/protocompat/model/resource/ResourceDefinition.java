package com.krickert.protocompat.model.resource;

import java.util.List;

/**
 * A resource declared by {@code google.api.resource} on a message or by
 * {@code google.api.resource_definition} on a file.
 *
 * @param type     The resource type name. Must not be null or blank.
 * @param patterns The resource name patterns, e.g. {@code projects/{project}/topics/{topic}}. Never null.
 * @param file     The declaring proto file. Can be null.
 * @param line     1-based source line of the declaration, or -1.
 */
public record ResourceDefinition(String type, List<String> patterns, String file, int line) {

    public ResourceDefinition {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("ResourceDefinition type cannot be null or blank.");
        }
        patterns = (patterns == null) ? List.of() : List.copyOf(patterns);
    }

    public ResourceDefinition(String type, List<String> patterns) {
        this(type, patterns, null, -1);
    }
}
