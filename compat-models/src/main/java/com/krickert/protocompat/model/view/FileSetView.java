package com.krickert.protocompat.model.view;

import com.krickert.protocompat.model.resource.ResourceDatabase;

import java.util.Map;

/**
 * One revision of a schema tree: its top-level entities keyed by simple name, plus the resource
 * index shared by every view in the tree.
 */
public record FileSetView(
        Map<String, MessageView> messages,
        Map<String, EnumView> enums,
        Map<String, ServiceView> services,
        ResourceDatabase resourceDatabase,
        String apiVersion
) {
    public FileSetView {
        messages = (messages == null) ? Map.of() : Map.copyOf(messages);
        enums = (enums == null) ? Map.of() : Map.copyOf(enums);
        services = (services == null) ? Map.of() : Map.copyOf(services);
        resourceDatabase = (resourceDatabase == null) ? ResourceDatabase.empty() : resourceDatabase;
    }
}
