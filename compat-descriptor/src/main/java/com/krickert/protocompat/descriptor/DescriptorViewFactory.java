package com.krickert.protocompat.descriptor;

import com.google.api.FieldBehavior;
import com.google.api.FieldBehaviorProto;
import com.google.api.ResourceProto;
import com.google.common.collect.ImmutableList;
import com.google.protobuf.DescriptorProtos.DescriptorProto;
import com.google.protobuf.DescriptorProtos.EnumDescriptorProto;
import com.google.protobuf.DescriptorProtos.EnumValueDescriptorProto;
import com.google.protobuf.DescriptorProtos.FieldDescriptorProto;
import com.google.protobuf.DescriptorProtos.FieldOptions;
import com.google.protobuf.DescriptorProtos.FileDescriptorProto;
import com.google.protobuf.DescriptorProtos.FileDescriptorSet;
import com.google.protobuf.DescriptorProtos.MethodDescriptorProto;
import com.google.protobuf.DescriptorProtos.ServiceDescriptorProto;
import com.krickert.protocompat.model.resource.ResourceDatabase;
import com.krickert.protocompat.model.resource.ResourceDefinition;
import com.krickert.protocompat.model.resource.ResourceReference;
import com.krickert.protocompat.model.view.EnumValueView;
import com.krickert.protocompat.model.view.EnumView;
import com.krickert.protocompat.model.view.FieldView;
import com.krickert.protocompat.model.view.FileSetView;
import com.krickert.protocompat.model.view.MapEntryType;
import com.krickert.protocompat.model.view.MessageView;
import com.krickert.protocompat.model.view.MethodView;
import com.krickert.protocompat.model.view.ServiceView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Predicate;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Turns an already-compiled {@link FileDescriptorSet} into a {@link FileSetView}.
 * <p>
 * Every file in the set feeds the resource database, but only files accepted by the filter contribute
 * messages, enums and services. The default filter drops the well-known {@code google/protobuf} and
 * {@code google/api} imports that {@code protoc --include_imports} pulls in.
 */
public class DescriptorViewFactory {
    private static final Logger LOG = LoggerFactory.getLogger(DescriptorViewFactory.class);

    private static final int MAP_KEY_FIELD_NUMBER = 1;
    private static final int MAP_VALUE_FIELD_NUMBER = 2;
    private static final String SCALAR_TYPE_PREFIX = "TYPE_";

    public static final Predicate<FileDescriptorProto> SKIP_GOOGLE_IMPORTS =
            file -> !file.getName().startsWith("google/protobuf/") && !file.getName().startsWith("google/api/");

    private final Predicate<FileDescriptorProto> fileFilter;

    public DescriptorViewFactory() {
        this(SKIP_GOOGLE_IMPORTS);
    }

    public DescriptorViewFactory(Predicate<FileDescriptorProto> fileFilter) {
        this.fileFilter = checkNotNull(fileFilter, "fileFilter");
    }

    public FileSetView create(FileDescriptorSet descriptorSet) {
        return create(descriptorSet, fileFilter);
    }

    /**
     * Wraps the descriptor set, comparing only the files accepted by {@code filter}.
     */
    public FileSetView create(FileDescriptorSet descriptorSet, Predicate<FileDescriptorProto> filter) {
        checkNotNull(descriptorSet, "descriptorSet cannot be null");
        checkNotNull(filter, "filter cannot be null");
        List<FileDescriptorProto> files = descriptorSet.getFileList();
        ResourceDatabase database = ResourceDatabases.fromFiles(files);
        Map<String, DescriptorProto> messagesByFullName = indexMessages(files);

        Map<String, MessageView> messages = new LinkedHashMap<>();
        Map<String, EnumView> enums = new LinkedHashMap<>();
        Map<String, ServiceView> services = new LinkedHashMap<>();
        String apiVersion = null;

        for (FileDescriptorProto file : files) {
            if (!filter.test(file)) {
                LOG.debug("Skipping file {}", file.getName());
                continue;
            }
            FileContext context = new FileContext(file, database, messagesByFullName);
            if (apiVersion == null) {
                apiVersion = context.apiVersion;
            }
            String packagePrefix = file.getPackage().isEmpty() ? "" : "." + file.getPackage();
            for (int i = 0; i < file.getMessageTypeCount(); i++) {
                MessageView message = wrapMessage(context, file.getMessageType(i), packagePrefix,
                        ImmutableList.of(SourceLocations.FILE_MESSAGE_TYPE, i));
                putUnique(messages, message.name(), message, file);
            }
            for (int i = 0; i < file.getEnumTypeCount(); i++) {
                EnumView enumView = wrapEnum(context, file.getEnumType(i), packagePrefix,
                        ImmutableList.of(SourceLocations.FILE_ENUM_TYPE, i));
                putUnique(enums, enumView.name(), enumView, file);
            }
            for (int i = 0; i < file.getServiceCount(); i++) {
                ServiceView service = wrapService(context, file.getService(i),
                        ImmutableList.of(SourceLocations.FILE_SERVICE, i));
                putUnique(services, service.name(), service, file);
            }
        }
        LOG.info("Wrapped {} file(s): {} message(s), {} enum(s), {} service(s), api version {}",
                files.size(), messages.size(), enums.size(), services.size(), apiVersion);
        return new FileSetView(messages, enums, services, database, apiVersion);
    }

    private MessageView wrapMessage(FileContext context, DescriptorProto message, String parentName, List<Integer> path) {
        String fullName = parentName + "." + message.getName();
        int line = context.locations.lineOf(path);
        ResourceDefinition resource = ResourceDatabases.messageResource(message, context.fileName, line);

        List<FieldView> fields = new ArrayList<>(message.getFieldCount());
        for (int i = 0; i < message.getFieldCount(); i++) {
            fields.add(wrapField(context, message, message.getField(i), resource,
                    SourceLocations.child(path, SourceLocations.MESSAGE_FIELD, i)));
        }
        List<MessageView> nestedMessages = new ArrayList<>(message.getNestedTypeCount());
        for (int i = 0; i < message.getNestedTypeCount(); i++) {
            nestedMessages.add(wrapMessage(context, message.getNestedType(i), fullName,
                    SourceLocations.child(path, SourceLocations.MESSAGE_NESTED_TYPE, i)));
        }
        List<EnumView> nestedEnums = new ArrayList<>(message.getEnumTypeCount());
        for (int i = 0; i < message.getEnumTypeCount(); i++) {
            nestedEnums.add(wrapEnum(context, message.getEnumType(i), fullName,
                    SourceLocations.child(path, SourceLocations.MESSAGE_ENUM_TYPE, i)));
        }

        return MessageView.builder()
                .name(message.getName())
                .fullName(fullName)
                .fields(fields)
                .nestedMessages(nestedMessages)
                .nestedEnums(nestedEnums)
                .resource(resource)
                .mapEntry(message.getOptions().getMapEntry())
                .file(context.fileName)
                .line(line)
                .build();
    }

    private FieldView wrapField(FileContext context, DescriptorProto owner, FieldDescriptorProto field,
                                ResourceDefinition messageResource, List<Integer> path) {
        FieldOptions options = AnnotationOptions.of(field);
        String typeName = field.getTypeName().isEmpty() ? null : field.getTypeName();

        MapEntryType mapEntryType = null;
        if (typeName != null && field.getType() == FieldDescriptorProto.Type.TYPE_MESSAGE) {
            DescriptorProto entry = context.messagesByFullName.get(typeName);
            if (entry != null && entry.getOptions().getMapEntry()) {
                mapEntryType = new MapEntryType(
                        typeOf(entryField(entry, MAP_KEY_FIELD_NUMBER)),
                        typeOf(entryField(entry, MAP_VALUE_FIELD_NUMBER)));
            }
        }

        boolean required = field.getLabel() == FieldDescriptorProto.Label.LABEL_REQUIRED
                || options.getExtension(FieldBehaviorProto.fieldBehavior).contains(FieldBehavior.REQUIRED);

        ResourceReference resourceReference = null;
        if (options.hasExtension(ResourceProto.resourceReference)) {
            com.google.api.ResourceReference annotation = options.getExtension(ResourceProto.resourceReference);
            resourceReference = new ResourceReference(annotation.getType(), annotation.getChildType());
        }

        return FieldView.builder()
                .name(field.getName())
                .number(field.getNumber())
                .repeated(field.getLabel() == FieldDescriptorProto.Label.LABEL_REPEATED)
                .required(required)
                .protoType(field.getType().name())
                .typeName(typeName)
                .mapType(mapEntryType != null)
                .mapEntryType(mapEntryType)
                .oneofName(field.hasOneofIndex() ? owner.getOneofDecl(field.getOneofIndex()).getName() : null)
                .proto3Optional(field.getProto3Optional())
                .resourceReference(resourceReference)
                .apiVersion(context.apiVersion)
                .messageResource(messageResource)
                .resourceDatabase(context.database)
                .file(context.fileName)
                .line(context.locations.lineOf(path))
                .build();
    }

    private EnumView wrapEnum(FileContext context, EnumDescriptorProto enumType, String parentName, List<Integer> path) {
        List<EnumValueView> values = new ArrayList<>(enumType.getValueCount());
        for (int i = 0; i < enumType.getValueCount(); i++) {
            EnumValueDescriptorProto value = enumType.getValue(i);
            values.add(new EnumValueView(value.getName(), value.getNumber(), context.fileName,
                    context.locations.lineOf(SourceLocations.child(path, SourceLocations.ENUM_VALUE, i))));
        }
        return new EnumView(enumType.getName(), parentName + "." + enumType.getName(), values,
                context.fileName, context.locations.lineOf(path));
    }

    private ServiceView wrapService(FileContext context, ServiceDescriptorProto service, List<Integer> path) {
        List<MethodView> methods = new ArrayList<>(service.getMethodCount());
        for (int i = 0; i < service.getMethodCount(); i++) {
            MethodDescriptorProto method = service.getMethod(i);
            methods.add(MethodView.builder()
                    .name(method.getName())
                    .inputType(method.getInputType())
                    .outputType(method.getOutputType())
                    .clientStreaming(method.getClientStreaming())
                    .serverStreaming(method.getServerStreaming())
                    .apiVersion(context.apiVersion)
                    .file(context.fileName)
                    .line(context.locations.lineOf(SourceLocations.child(path, SourceLocations.SERVICE_METHOD, i)))
                    .build());
        }
        return new ServiceView(service.getName(), methods, context.fileName, context.locations.lineOf(path));
    }

    private static FieldDescriptorProto entryField(DescriptorProto entry, int number) {
        return entry.getFieldList().stream()
                .filter(f -> f.getNumber() == number)
                .findFirst()
                .orElseThrow(() -> new DescriptorWrapException(
                        "Map entry " + entry.getName() + " has no field #" + number));
    }

    /**
     * Scalars as proto keywords ({@code TYPE_INT32 -> int32}), messages and enums by type name.
     */
    private static String typeOf(FieldDescriptorProto field) {
        if (!field.getTypeName().isEmpty()) {
            return field.getTypeName();
        }
        return field.getType().name().substring(SCALAR_TYPE_PREFIX.length()).toLowerCase(Locale.ROOT);
    }

    private static Map<String, DescriptorProto> indexMessages(List<FileDescriptorProto> files) {
        Map<String, DescriptorProto> index = new HashMap<>();
        for (FileDescriptorProto file : files) {
            String packagePrefix = file.getPackage().isEmpty() ? "" : "." + file.getPackage();
            for (DescriptorProto message : file.getMessageTypeList()) {
                indexMessage(index, message, packagePrefix);
            }
        }
        return index;
    }

    private static void indexMessage(Map<String, DescriptorProto> index, DescriptorProto message, String parentName) {
        String fullName = parentName + "." + message.getName();
        index.put(fullName, message);
        for (DescriptorProto nested : message.getNestedTypeList()) {
            indexMessage(index, nested, fullName);
        }
    }

    private static <T> void putUnique(Map<String, T> entities, String name, T entity, FileDescriptorProto file) {
        if (entities.put(name, entity) != null) {
            LOG.warn("Duplicate top-level name '{}' in {}; the later definition is compared", name, file.getName());
        }
    }

    private static final class FileContext {
        private final String fileName;
        private final String apiVersion;
        private final SourceLocations locations;
        private final ResourceDatabase database;
        private final Map<String, DescriptorProto> messagesByFullName;

        private FileContext(FileDescriptorProto file, ResourceDatabase database,
                            Map<String, DescriptorProto> messagesByFullName) {
            this.fileName = file.getName();
            this.apiVersion = ApiVersions.fromPackage(file.getPackage());
            this.locations = SourceLocations.of(file);
            this.database = database;
            this.messagesByFullName = messagesByFullName;
        }
    }
}
