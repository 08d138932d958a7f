package com.krickert.protocompat.model.resource;

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSetMultimap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Set;

/**
 * Immutable {@link ResourceDatabase} indexed by resource type and by resource pattern.
 */
public final class InMemoryResourceDatabase implements ResourceDatabase {
    private static final Logger LOG = LoggerFactory.getLogger(InMemoryResourceDatabase.class);

    private static final String PATTERN_SEPARATOR = "/";

    private final ImmutableSetMultimap<String, ResourceDefinition> resourcesByType;
    private final ImmutableSetMultimap<String, ResourceDefinition> resourcesByPattern;

    private InMemoryResourceDatabase(Builder builder) {
        this.resourcesByType = builder.byType.build();
        this.resourcesByPattern = builder.byPattern.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public Set<ResourceDefinition> getResourceByType(String type) {
        if (type == null) {
            return ImmutableSet.of();
        }
        return resourcesByType.get(type);
    }

    @Override
    public Set<ResourceDefinition> getParentResourcesByChildType(String childType) {
        if (childType == null) {
            return ImmutableSet.of();
        }
        ImmutableSet.Builder<ResourceDefinition> parents = ImmutableSet.builder();
        for (ResourceDefinition child : resourcesByType.get(childType)) {
            for (String pattern : child.patterns()) {
                String parentPattern = parentPattern(pattern);
                if (parentPattern != null) {
                    parents.addAll(resourcesByPattern.get(parentPattern));
                }
            }
        }
        ImmutableSet<ResourceDefinition> result = parents.build();
        LOG.debug("Resolved {} parent resource(s) for child type '{}'", result.size(), childType);
        return result;
    }

    public int size() {
        return resourcesByType.size();
    }

    /**
     * Drops the trailing {@code collection/{id}} pair of a pattern.
     *
     * @return the parent pattern, or null for a top-level pattern
     */
    static String parentPattern(String pattern) {
        if (pattern == null) {
            return null;
        }
        String[] segments = pattern.split(PATTERN_SEPARATOR);
        if (segments.length <= 2) {
            return null;
        }
        return String.join(PATTERN_SEPARATOR, Arrays.copyOf(segments, segments.length - 2));
    }

    public static final class Builder {
        private final ImmutableSetMultimap.Builder<String, ResourceDefinition> byType = ImmutableSetMultimap.builder();
        private final ImmutableSetMultimap.Builder<String, ResourceDefinition> byPattern = ImmutableSetMultimap.builder();

        private Builder() {
        }

        public Builder register(ResourceDefinition resource) {
            if (resource == null) {
                throw new IllegalArgumentException("Cannot register a null ResourceDefinition.");
            }
            byType.put(resource.type(), resource);
            for (String pattern : resource.patterns()) {
                byPattern.put(pattern, resource);
            }
            return this;
        }

        public Builder registerAll(Iterable<ResourceDefinition> resources) {
            for (ResourceDefinition resource : resources) {
                register(resource);
            }
            return this;
        }

        public InMemoryResourceDatabase build() {
            return new InMemoryResourceDatabase(this);
        }
    }
}
