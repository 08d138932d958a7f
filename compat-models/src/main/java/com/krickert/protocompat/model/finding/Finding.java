package com.krickert.protocompat.model.finding;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * One detected difference between the original and the updated schema.
 * This record is immutable.
 *
 * @param category The kind of change. Cannot be null.
 * @param severity Whether the change is breaking ({@link ChangeType#MAJOR}) or informational. Cannot be null.
 * @param message  Human-readable description of the change. Cannot be null.
 * @param file     The proto file the change is reported against. Can be null when the view carries no file.
 * @param line     1-based source line, or -1 when the descriptor carried no source info.
 */
@JsonPropertyOrder({"category", "severity", "message", "file", "line"})
public record Finding(
        @JsonProperty("category") FindingCategory category,
        @JsonProperty("severity") ChangeType severity,
        @JsonProperty("message") String message,
        @JsonProperty("file") String file,
        @JsonProperty("line") int line
) {
    public Finding {
        if (category == null) {
            throw new IllegalArgumentException("Finding category cannot be null.");
        }
        if (severity == null) {
            throw new IllegalArgumentException("Finding severity cannot be null.");
        }
        if (message == null) {
            throw new IllegalArgumentException("Finding message cannot be null.");
        }
    }

    @JsonIgnore
    public boolean isBreaking() {
        return severity == ChangeType.MAJOR;
    }
}
