package com.krickert.protocompat.model.view;

import java.util.List;

public record ServiceView(String name, List<MethodView> methods, String file, int line) {

    public ServiceView {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("ServiceView name cannot be null or blank.");
        }
        methods = (methods == null) ? List.of() : List.copyOf(methods);
    }
}
