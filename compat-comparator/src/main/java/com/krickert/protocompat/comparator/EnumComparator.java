package com.krickert.protocompat.comparator;

import com.krickert.protocompat.model.finding.ChangeType;
import com.krickert.protocompat.model.finding.FindingCategory;
import com.krickert.protocompat.model.finding.FindingContainer;
import com.krickert.protocompat.model.view.EntityPair;
import com.krickert.protocompat.model.view.EnumValueView;
import com.krickert.protocompat.model.view.EnumView;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Compares two revisions of an enum. Values are matched by name, so a renamed value reads as a removal
 * plus an addition.
 */
public class EnumComparator implements EntityComparator<EnumView> {

    private final EntityComparator<EnumValueView> enumValueComparator;

    public EnumComparator() {
        this(new EnumValueComparator());
    }

    public EnumComparator(EntityComparator<EnumValueView> enumValueComparator) {
        this.enumValueComparator = checkNotNull(enumValueComparator, "enumValueComparator");
    }

    @Override
    public void compare(EntityPair<EnumView> pair, FindingContainer findings) {
        checkNotNull(pair, "pair cannot be null");
        checkNotNull(findings, "findings cannot be null");

        if (pair.isAddition()) {
            EnumView added = pair.requireUpdated();
            findings.addFinding(FindingCategory.ENUM_ADDITION, added.file(), added.line(),
                    String.format("A new Enum `%s` is added.", added.name()),
                    ChangeType.MINOR);
            return;
        }
        if (pair.isRemoval()) {
            EnumView removed = pair.requireOriginal();
            findings.addFinding(FindingCategory.ENUM_REMOVAL, removed.file(), removed.line(),
                    String.format("An existing Enum `%s` is removed.", removed.name()),
                    ChangeType.MAJOR);
            return;
        }

        for (EntityPair<EnumValueView> values : EntityPairing.pairBy(
                pair.requireOriginal().values(), pair.requireUpdated().values(), EnumValueView::name)) {
            enumValueComparator.compare(values, findings);
        }
    }
}
