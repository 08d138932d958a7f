package com.krickert.protocompat.comparator;

import com.krickert.protocompat.model.finding.Finding;
import com.krickert.protocompat.model.finding.FindingContainer;
import com.krickert.protocompat.model.view.EntityPair;

import java.util.List;

/**
 * Compares the original and updated revision of one kind of schema entity.
 * <p>
 * Implementations only append to the supplied {@link FindingContainer}; they never mutate the views.
 *
 * @param <T> the entity view type
 */
public interface EntityComparator<T> {

    /**
     * Compares one matched pair and reports every difference found.
     *
     * @param pair     the original and updated entity; at most one side is absent
     * @param findings the sink to append findings to
     */
    void compare(EntityPair<T> pair, FindingContainer findings);

    /**
     * Compares one pair into a fresh container.
     *
     * @param original the original entity, or null for an addition
     * @param updated  the updated entity, or null for a removal
     * @return the findings, in the order they were reported
     */
    default List<Finding> compare(T original, T updated) {
        FindingContainer findings = new FindingContainer();
        compare(EntityPair.of(original, updated), findings);
        return findings.getFindings();
    }

    /**
     * Gets the name of this comparator for logging.
     */
    default String getComparatorName() {
        return this.getClass().getSimpleName();
    }
}
