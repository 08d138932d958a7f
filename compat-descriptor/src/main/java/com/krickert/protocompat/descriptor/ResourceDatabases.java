package com.krickert.protocompat.descriptor;

import com.google.api.ResourceDescriptor;
import com.google.api.ResourceProto;
import com.google.common.collect.ImmutableList;
import com.google.protobuf.DescriptorProtos.DescriptorProto;
import com.google.protobuf.DescriptorProtos.FileDescriptorProto;
import com.google.protobuf.DescriptorProtos.MessageOptions;
import com.krickert.protocompat.model.resource.InMemoryResourceDatabase;
import com.krickert.protocompat.model.resource.ResourceDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Builds the resource database of a schema tree from its file-level {@code google.api.resource_definition}
 * and message-level {@code google.api.resource} annotations.
 */
public final class ResourceDatabases {
    private static final Logger LOG = LoggerFactory.getLogger(ResourceDatabases.class);

    private ResourceDatabases() {
    }

    public static InMemoryResourceDatabase fromFiles(Iterable<FileDescriptorProto> files) {
        InMemoryResourceDatabase.Builder builder = InMemoryResourceDatabase.builder();
        for (FileDescriptorProto file : files) {
            SourceLocations locations = SourceLocations.of(file);
            for (ResourceDescriptor descriptor : AnnotationOptions.of(file).getExtension(ResourceProto.resourceDefinition)) {
                // File-level definitions are reported without a line.
                builder.register(toDefinition(descriptor, file.getName(), SourceLocations.UNKNOWN_LINE));
            }
            for (int i = 0; i < file.getMessageTypeCount(); i++) {
                registerMessage(builder, file.getMessageType(i), file.getName(), locations,
                        ImmutableList.of(SourceLocations.FILE_MESSAGE_TYPE, i));
            }
        }
        InMemoryResourceDatabase database = builder.build();
        LOG.debug("Built resource database with {} resource definition(s)", database.size());
        return database;
    }

    /**
     * @return the message's {@code google.api.resource}, or null when it declares none
     */
    static ResourceDefinition messageResource(DescriptorProto message, String fileName, int line) {
        MessageOptions options = AnnotationOptions.of(message);
        if (!options.hasExtension(ResourceProto.resource)) {
            return null;
        }
        return toDefinition(options.getExtension(ResourceProto.resource), fileName, line);
    }

    private static void registerMessage(InMemoryResourceDatabase.Builder builder, DescriptorProto message,
                                        String fileName, SourceLocations locations, List<Integer> path) {
        ResourceDefinition resource = messageResource(message, fileName, locations.lineOf(path));
        if (resource != null) {
            builder.register(resource);
        }
        for (int i = 0; i < message.getNestedTypeCount(); i++) {
            registerMessage(builder, message.getNestedType(i), fileName, locations,
                    SourceLocations.child(path, SourceLocations.MESSAGE_NESTED_TYPE, i));
        }
    }

    private static ResourceDefinition toDefinition(ResourceDescriptor descriptor, String fileName, int line) {
        if (descriptor.getType().isBlank()) {
            throw new DescriptorWrapException("A resource annotation in " + fileName + " declares no type.");
        }
        return new ResourceDefinition(descriptor.getType(), descriptor.getPatternList(), fileName, line);
    }
}
