package com.krickert.protocompat.descriptor;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.protobuf.DescriptorProtos.FileDescriptorProto;
import com.google.protobuf.DescriptorProtos.SourceCodeInfo;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Line lookup over a file's {@code SourceCodeInfo}. Paths follow {@code descriptor.proto} field numbers,
 * e.g. {@code [4, 0, 2, 1]} is the second field of the first top-level message.
 */
final class SourceLocations {

    static final int UNKNOWN_LINE = -1;

    static final int FILE_MESSAGE_TYPE = 4;
    static final int FILE_ENUM_TYPE = 5;
    static final int FILE_SERVICE = 6;
    static final int MESSAGE_FIELD = 2;
    static final int MESSAGE_NESTED_TYPE = 3;
    static final int MESSAGE_ENUM_TYPE = 4;
    static final int ENUM_VALUE = 2;
    static final int SERVICE_METHOD = 2;

    private final Map<List<Integer>, Integer> lineByPath;

    private SourceLocations(Map<List<Integer>, Integer> lineByPath) {
        this.lineByPath = lineByPath;
    }

    static SourceLocations of(FileDescriptorProto file) {
        if (!file.hasSourceCodeInfo()) {
            return new SourceLocations(ImmutableMap.of());
        }
        Map<List<Integer>, Integer> lines = new HashMap<>();
        for (SourceCodeInfo.Location location : file.getSourceCodeInfo().getLocationList()) {
            if (location.getSpanCount() > 0) {
                // Spans are 0-based. Keep the first location seen for a path.
                lines.putIfAbsent(ImmutableList.copyOf(location.getPathList()), location.getSpan(0) + 1);
            }
        }
        return new SourceLocations(ImmutableMap.copyOf(lines));
    }

    int lineOf(List<Integer> path) {
        return lineByPath.getOrDefault(path, UNKNOWN_LINE);
    }

    static List<Integer> child(List<Integer> parent, int fieldNumber, int index) {
        return ImmutableList.<Integer>builder().addAll(parent).add(fieldNumber).add(index).build();
    }
}
