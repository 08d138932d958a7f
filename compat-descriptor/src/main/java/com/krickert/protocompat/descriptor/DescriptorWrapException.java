package com.krickert.protocompat.descriptor;

/**
 * Thrown when a descriptor cannot be turned into a view, e.g. when its options fail to re-parse.
 */
public class DescriptorWrapException extends RuntimeException {
    public DescriptorWrapException(String message, Throwable cause) {
        super(message, cause);
    }

    public DescriptorWrapException(String message) {
        super(message);
    }
}
