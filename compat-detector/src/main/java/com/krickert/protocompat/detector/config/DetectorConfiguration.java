package com.krickert.protocompat.detector.config;

import io.micronaut.context.annotation.ConfigurationProperties;
import lombok.Data;

/**
 * Configuration properties for the breaking change detector.
 */
@ConfigurationProperties("proto-compat.detector")
@Data
public class DetectorConfiguration {

    /**
     * Number of worker threads comparing top-level entities. 1 compares on the calling thread.
     */
    private int parallelism = 1;

    /**
     * Prefix of the worker thread names.
     */
    private String threadNamePrefix = "compat-detector";

    /**
     * Whether google/protobuf and google/api files in a descriptor set are left out of the comparison.
     * They are still indexed for resource definitions.
     */
    private boolean skipGoogleImports = true;
}
