package com.krickert.protocompat.model.finding;

/**
 * Severity of a detected change. Only {@link #MAJOR} is breaking.
 */
public enum ChangeType {
    MAJOR,
    MINOR,
    PATCH
}
