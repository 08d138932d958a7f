package com.krickert.protocompat.comparator;

import com.krickert.protocompat.model.finding.ChangeType;
import com.krickert.protocompat.model.finding.FindingCategory;
import com.krickert.protocompat.model.finding.FindingContainer;
import com.krickert.protocompat.model.view.EntityPair;
import com.krickert.protocompat.model.view.EnumValueView;

import static com.google.common.base.Preconditions.checkNotNull;

public class EnumValueComparator implements EntityComparator<EnumValueView> {

    @Override
    public void compare(EntityPair<EnumValueView> pair, FindingContainer findings) {
        checkNotNull(pair, "pair cannot be null");
        checkNotNull(findings, "findings cannot be null");

        if (pair.isAddition()) {
            EnumValueView added = pair.requireUpdated();
            findings.addFinding(FindingCategory.ENUM_VALUE_ADDITION, added.file(), added.line(),
                    String.format("A new EnumValue `%s` is added.", added.name()),
                    ChangeType.MINOR);
        } else if (pair.isRemoval()) {
            EnumValueView removed = pair.requireOriginal();
            findings.addFinding(FindingCategory.ENUM_VALUE_REMOVAL, removed.file(), removed.line(),
                    String.format("An existing EnumValue `%s` is removed.", removed.name()),
                    ChangeType.MAJOR);
        } else {
            EnumValueView original = pair.requireOriginal();
            EnumValueView updated = pair.requireUpdated();
            if (!original.name().equals(updated.name())) {
                findings.addFinding(FindingCategory.ENUM_VALUE_NAME_CHANGE, updated.file(), updated.line(),
                        String.format("Name of the EnumValue is changed from `%s` to `%s`.", original.name(), updated.name()),
                        ChangeType.MAJOR);
            }
        }
    }
}
