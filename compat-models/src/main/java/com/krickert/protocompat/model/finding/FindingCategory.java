package com.krickert.protocompat.model.finding;

// Serialized by name. Renaming a constant breaks downstream report consumers.
public enum FindingCategory {
    FIELD_ADDITION,
    FIELD_REMOVAL,
    FIELD_NAME_CHANGE,
    FIELD_REPEATED_CHANGE,
    FIELD_BEHAVIOR_CHANGE,
    FIELD_TYPE_CHANGE,
    FIELD_ONEOF_REMOVAL,
    FIELD_ONEOF_ADDITION,
    FIELD_PROTO3_OPTIONAL_CHANGE,

    RESOURCE_REFERENCE_ADDITION,
    RESOURCE_REFERENCE_REMOVAL,
    RESOURCE_REFERENCE_CHANGE,

    ENUM_VALUE_ADDITION,
    ENUM_VALUE_REMOVAL,
    ENUM_VALUE_NAME_CHANGE,

    ENUM_ADDITION,
    ENUM_REMOVAL,

    MESSAGE_ADDITION,
    MESSAGE_REMOVAL,

    RESOURCE_DEFINITION_ADDITION,
    RESOURCE_DEFINITION_REMOVAL,
    RESOURCE_DEFINITION_CHANGE,
    RESOURCE_PATTERN_ADDITION,
    RESOURCE_PATTERN_REMOVAL,

    SERVICE_ADDITION,
    SERVICE_REMOVAL,

    METHOD_ADDITION,
    METHOD_REMOVAL,
    METHOD_INPUT_TYPE_CHANGE,
    METHOD_RESPONSE_TYPE_CHANGE,
    METHOD_CLIENT_STREAMING_CHANGE,
    METHOD_SERVER_STREAMING_CHANGE
}
