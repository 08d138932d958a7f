package com.krickert.protocompat.descriptor;

import java.util.regex.Pattern;

/**
 * Extracts the API version segment ({@code v1}, {@code v1beta1}, {@code v2p1alpha}) from a proto package.
 */
public final class ApiVersions {

    private static final Pattern VERSION_SEGMENT = Pattern.compile("^v\\d+(p\\d+)?((alpha|beta)\\d*)?$");

    private ApiVersions() {
    }

    /**
     * @param protoPackage a proto package such as {@code google.pubsub.v1}
     * @return the last version-like segment, or null when the package is unversioned
     */
    public static String fromPackage(String protoPackage) {
        if (protoPackage == null || protoPackage.isEmpty()) {
            return null;
        }
        String[] segments = protoPackage.split("\\.");
        for (int i = segments.length - 1; i >= 0; i--) {
            if (VERSION_SEGMENT.matcher(segments[i]).matches()) {
                return segments[i];
            }
        }
        return null;
    }
}
