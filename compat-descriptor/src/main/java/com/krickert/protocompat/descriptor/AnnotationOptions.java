package com.krickert.protocompat.descriptor;

import com.google.api.FieldBehaviorProto;
import com.google.api.ResourceProto;
import com.google.protobuf.DescriptorProtos.DescriptorProto;
import com.google.protobuf.DescriptorProtos.FieldDescriptorProto;
import com.google.protobuf.DescriptorProtos.FieldOptions;
import com.google.protobuf.DescriptorProtos.FileDescriptorProto;
import com.google.protobuf.DescriptorProtos.FileOptions;
import com.google.protobuf.DescriptorProtos.MessageOptions;
import com.google.protobuf.ExtensionRegistry;
import com.google.protobuf.InvalidProtocolBufferException;

/**
 * Re-reads descriptor options with the {@code google.api} extensions registered. A descriptor set parsed
 * without an extension registry keeps the annotations as unknown fields; re-parsing makes them readable.
 */
final class AnnotationOptions {

    private static final ExtensionRegistry REGISTRY = createRegistry();

    private AnnotationOptions() {
    }

    static FieldOptions of(FieldDescriptorProto field) {
        if (!field.hasOptions()) {
            return FieldOptions.getDefaultInstance();
        }
        try {
            return FieldOptions.parseFrom(field.getOptions().toByteString(), REGISTRY);
        } catch (InvalidProtocolBufferException e) {
            throw new DescriptorWrapException("Failed to read options of field " + field.getName(), e);
        }
    }

    static MessageOptions of(DescriptorProto message) {
        if (!message.hasOptions()) {
            return MessageOptions.getDefaultInstance();
        }
        try {
            return MessageOptions.parseFrom(message.getOptions().toByteString(), REGISTRY);
        } catch (InvalidProtocolBufferException e) {
            throw new DescriptorWrapException("Failed to read options of message " + message.getName(), e);
        }
    }

    static FileOptions of(FileDescriptorProto file) {
        if (!file.hasOptions()) {
            return FileOptions.getDefaultInstance();
        }
        try {
            return FileOptions.parseFrom(file.getOptions().toByteString(), REGISTRY);
        } catch (InvalidProtocolBufferException e) {
            throw new DescriptorWrapException("Failed to read options of file " + file.getName(), e);
        }
    }

    private static ExtensionRegistry createRegistry() {
        ExtensionRegistry registry = ExtensionRegistry.newInstance();
        ResourceProto.registerAllExtensions(registry);
        FieldBehaviorProto.registerAllExtensions(registry);
        return registry;
    }
}
