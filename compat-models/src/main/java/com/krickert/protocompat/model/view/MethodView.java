package com.krickert.protocompat.model.view;

import lombok.Builder;

@Builder(toBuilder = true)
public record MethodView(
        String name,
        String inputType,
        String outputType,
        boolean clientStreaming,
        boolean serverStreaming,
        String apiVersion,
        String file,
        int line
) {
    public MethodView {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("MethodView name cannot be null or blank.");
        }
    }
}
