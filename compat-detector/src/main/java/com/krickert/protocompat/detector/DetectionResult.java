package com.krickert.protocompat.detector;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.krickert.protocompat.model.finding.ChangeType;
import com.krickert.protocompat.model.finding.Finding;

import java.util.List;

/**
 * Outcome of comparing two schema trees.
 *
 * @param findings every finding, grouped by top-level entity in name order
 */
public record DetectionResult(@JsonProperty("findings") List<Finding> findings) {

    public DetectionResult {
        findings = (findings == null) ? List.of() : List.copyOf(findings);
    }

    @JsonProperty("breaking")
    public boolean breaking() {
        return findings.stream().anyMatch(Finding::isBreaking);
    }

    @JsonIgnore
    public List<Finding> breakingFindings() {
        return findings.stream().filter(Finding::isBreaking).toList();
    }

    @JsonIgnore
    public long count(ChangeType severity) {
        return findings.stream().filter(f -> f.severity() == severity).count();
    }
}
