package com.krickert.protocompat.model.resource;

import java.util.Set;

/**
 * Read-only index over every resource definition visible in one schema tree.
 * Built once per tree before any comparison runs.
 */
public interface ResourceDatabase {

    /**
     * @param type a resource type name
     * @return the definitions declaring {@code type}; empty when unknown or when {@code type} is null
     */
    Set<ResourceDefinition> getResourceByType(String type);

    /**
     * Resolves the parents of a child resource type: the resources whose pattern is the parent pattern
     * of one of the child's patterns.
     *
     * @param childType a resource type name
     * @return the parent definitions; empty when the child is unknown or has no parent
     */
    Set<ResourceDefinition> getParentResourcesByChildType(String childType);

    static ResourceDatabase empty() {
        return InMemoryResourceDatabase.builder().build();
    }
}
