package com.krickert.protocompat.comparator;

import com.krickert.protocompat.model.finding.FindingContainer;

/**
 * One independent unit of comparison: a matched pair of top-level entities and the comparator for them.
 * Tasks share no state besides the read-only views, so they may run on different threads as long as each
 * gets its own {@link FindingContainer}.
 *
 * @param description what is compared, e.g. {@code message Topic}
 * @param action      runs the comparison into the given container
 */
public record ComparisonTask(String description, Action action) {

    @FunctionalInterface
    public interface Action {
        void run(FindingContainer findings);
    }

    public void run(FindingContainer findings) {
        action.run(findings);
    }
}
