package com.krickert.protocompat.detector;

import com.google.api.ResourceProto;
import com.google.api.ResourceReference;
import com.google.protobuf.DescriptorProtos.DescriptorProto;
import com.google.protobuf.DescriptorProtos.EnumDescriptorProto;
import com.google.protobuf.DescriptorProtos.EnumValueDescriptorProto;
import com.google.protobuf.DescriptorProtos.FieldDescriptorProto;
import com.google.protobuf.DescriptorProtos.FieldDescriptorProto.Label;
import com.google.protobuf.DescriptorProtos.FieldDescriptorProto.Type;
import com.google.protobuf.DescriptorProtos.FieldOptions;
import com.google.protobuf.DescriptorProtos.FileDescriptorProto;
import com.google.protobuf.DescriptorProtos.FileDescriptorSet;
import com.google.protobuf.DescriptorProtos.MethodDescriptorProto;
import com.google.protobuf.DescriptorProtos.ServiceDescriptorProto;

import java.util.function.UnaryOperator;

/**
 * Builds revisions of a small library API as descriptor sets.
 */
final class LibrarySchemas {

    private LibrarySchemas() {
    }

    static FileDescriptorSet library(String version) {
        return library(version, UnaryOperator.identity());
    }

    /**
     * @param bookChanges applied to the {@code Book} message before the file is built
     */
    static FileDescriptorSet library(String version, UnaryOperator<DescriptorProto.Builder> bookChanges) {
        String pkg = "google.example.library." + version;
        DescriptorProto.Builder book = DescriptorProto.newBuilder()
                .setName("Book")
                .addField(field("name", 1, Type.TYPE_STRING))
                .addField(field("title", 2, Type.TYPE_STRING))
                .addField(field("genre", 3, Type.TYPE_ENUM).setTypeName("." + pkg + ".Genre"));

        FileDescriptorProto file = FileDescriptorProto.newBuilder()
                .setName("google/example/library/" + version + "/library.proto")
                .setPackage(pkg)
                .setSyntax("proto3")
                .addMessageType(bookChanges.apply(book))
                .addMessageType(DescriptorProto.newBuilder()
                        .setName("GetBookRequest")
                        .addField(field("name", 1, Type.TYPE_STRING)))
                .addEnumType(EnumDescriptorProto.newBuilder()
                        .setName("Genre")
                        .addValue(EnumValueDescriptorProto.newBuilder().setName("GENRE_UNSPECIFIED").setNumber(0))
                        .addValue(EnumValueDescriptorProto.newBuilder().setName("FICTION").setNumber(1)))
                .addService(ServiceDescriptorProto.newBuilder()
                        .setName("Library")
                        .addMethod(MethodDescriptorProto.newBuilder()
                                .setName("GetBook")
                                .setInputType("." + pkg + ".GetBookRequest")
                                .setOutputType("." + pkg + ".Book")))
                .build();
        return FileDescriptorSet.newBuilder().addFile(file).build();
    }

    /**
     * A file with {@code count} messages named {@code Message0..n}, each holding one field named {@code fieldName}.
     */
    static FileDescriptorSet manyMessages(int count, String fieldName) {
        FileDescriptorProto.Builder file = FileDescriptorProto.newBuilder()
                .setName("google/example/bulk/v1/bulk.proto")
                .setPackage("google.example.bulk.v1")
                .setSyntax("proto3");
        for (int i = 0; i < count; i++) {
            file.addMessageType(DescriptorProto.newBuilder()
                    .setName("Message" + i)
                    .addField(field(fieldName, 1, Type.TYPE_STRING)));
        }
        return FileDescriptorSet.newBuilder().addFile(file).build();
    }

    static FieldDescriptorProto.Builder field(String name, int number, Type type) {
        return FieldDescriptorProto.newBuilder()
                .setName(name)
                .setNumber(number)
                .setType(type)
                .setLabel(Label.LABEL_OPTIONAL);
    }

    /**
     * A resource reference with neither {@code type} nor {@code child_type}.
     */
    static FieldOptions emptyResourceReference() {
        return FieldOptions.newBuilder()
                .setExtension(ResourceProto.resourceReference, ResourceReference.getDefaultInstance())
                .build();
    }
}
