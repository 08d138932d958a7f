package com.krickert.protocompat.model.view;

import com.krickert.protocompat.model.resource.ResourceDefinition;
import lombok.Builder;

import java.util.List;

/**
 * A message with its fields, nested types and message-level resource.
 *
 * @param mapEntry Whether this is the synthetic entry message of a map field.
 */
@Builder(toBuilder = true)
public record MessageView(
        String name,
        String fullName,
        List<FieldView> fields,
        List<MessageView> nestedMessages,
        List<EnumView> nestedEnums,
        ResourceDefinition resource,
        boolean mapEntry,
        String file,
        int line
) {
    public MessageView {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("MessageView name cannot be null or blank.");
        }
        fields = (fields == null) ? List.of() : List.copyOf(fields);
        nestedMessages = (nestedMessages == null) ? List.of() : List.copyOf(nestedMessages);
        nestedEnums = (nestedEnums == null) ? List.of() : List.copyOf(nestedEnums);
    }
}
