package com.krickert.protocompat.model.finding;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Append-only sink that comparators report findings into.
 * <p>
 * Appends are safe from several threads, but the detector gives each worker its own container and
 * merges them with {@link #addAll(FindingContainer)} so the final order stays deterministic.
 * Findings are never de-duplicated: one field can legitimately produce several findings of the same category.
 */
public class FindingContainer {

    private final ConcurrentLinkedQueue<Finding> findings = new ConcurrentLinkedQueue<>();

    public void addFinding(FindingCategory category, String file, int line, String message, ChangeType severity) {
        findings.add(new Finding(category, severity, message, file, line));
    }

    public void addFinding(Finding finding) {
        if (finding == null) {
            throw new IllegalArgumentException("Finding cannot be null.");
        }
        findings.add(finding);
    }

    /**
     * Appends every finding of {@code other}, in its order.
     */
    public void addAll(FindingContainer other) {
        if (other != null) {
            findings.addAll(other.findings);
        }
    }

    /**
     * @return an immutable snapshot of the findings in insertion order
     */
    public List<Finding> getFindings() {
        return ImmutableList.copyOf(findings);
    }

    /**
     * @return the {@link ChangeType#MAJOR} findings only, in insertion order
     */
    public List<Finding> getBreakingFindings() {
        return findings.stream().filter(Finding::isBreaking).collect(ImmutableList.toImmutableList());
    }

    public int size() {
        return findings.size();
    }

    public boolean isEmpty() {
        return findings.isEmpty();
    }

    public void reset() {
        findings.clear();
    }

    @Override
    public String toString() {
        return "FindingContainer{findings=" + findings + '}';
    }
}
