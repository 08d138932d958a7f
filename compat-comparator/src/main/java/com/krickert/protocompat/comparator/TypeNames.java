package com.krickert.protocompat.comparator;

import java.util.Objects;

/**
 * Type name equivalence that tolerates an API version move, so {@code .example.v1.Enum} and
 * {@code .example.v1beta1.Enum} match when the packages moved from {@code v1} to {@code v1beta1}.
 * A renamed type never matches.
 */
final class TypeNames {

    private static final String SEGMENT_SEPARATOR = ".";

    private TypeNames() {
    }

    static boolean isEquivalent(String originalType, String updatedType,
                                String originalVersion, String updatedVersion) {
        if (Objects.equals(originalType, updatedType)) {
            return true;
        }
        if (originalType == null || updatedType == null || originalVersion == null || updatedVersion == null) {
            return false;
        }
        return substituteVersion(originalType, originalVersion, updatedVersion).equals(updatedType);
    }

    /**
     * Replaces every dot-delimited segment equal to {@code fromVersion}. Partial segments are left alone,
     * so {@code v1} never rewrites the {@code v1} prefix of {@code v1beta1}.
     */
    static String substituteVersion(String typeName, String fromVersion, String toVersion) {
        String[] segments = typeName.split("\\.", -1);
        for (int i = 0; i < segments.length; i++) {
            if (segments[i].equals(fromVersion)) {
                segments[i] = toVersion;
            }
        }
        return String.join(SEGMENT_SEPARATOR, segments);
    }
}
