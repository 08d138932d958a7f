package com.krickert.protocompat.comparator;

import com.krickert.protocompat.model.finding.ChangeType;
import com.krickert.protocompat.model.finding.FindingCategory;
import com.krickert.protocompat.model.finding.FindingContainer;
import com.krickert.protocompat.model.view.EntityPair;
import com.krickert.protocompat.model.view.FieldView;
import com.krickert.protocompat.model.view.MapEntryType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Compares two revisions of a field.
 * <p>
 * The checks run in a fixed order. Addition, removal and rename end the comparison; every other check
 * runs in turn, and the resource reference is always checked last.
 */
public class FieldComparator implements EntityComparator<FieldView> {
    private static final Logger LOG = LoggerFactory.getLogger(FieldComparator.class);

    private static final String LABEL_REPEATED = "LABEL_REPEATED";
    private static final String LABEL_OPTIONAL = "LABEL_OPTIONAL";

    private final ResourceReferenceResolver resourceReferenceResolver;

    public FieldComparator() {
        this(new ResourceReferenceResolver());
    }

    public FieldComparator(ResourceReferenceResolver resourceReferenceResolver) {
        this.resourceReferenceResolver = checkNotNull(resourceReferenceResolver, "resourceReferenceResolver");
    }

    @Override
    public void compare(EntityPair<FieldView> pair, FindingContainer findings) {
        checkNotNull(pair, "pair cannot be null");
        checkNotNull(findings, "findings cannot be null");

        if (pair.isAddition()) {
            FieldView added = pair.requireUpdated();
            findings.addFinding(FindingCategory.FIELD_ADDITION, added.file(), added.line(),
                    String.format("A new field `%s` is added.", added.name()),
                    ChangeType.MINOR);
            return;
        }
        if (pair.isRemoval()) {
            FieldView removed = pair.requireOriginal();
            findings.addFinding(FindingCategory.FIELD_REMOVAL, removed.file(), removed.line(),
                    String.format("An existing field `%s` is removed.", removed.name()),
                    ChangeType.MAJOR);
            return;
        }

        FieldView original = pair.requireOriginal();
        FieldView updated = pair.requireUpdated();
        LOG.debug("Comparing field '{}' (#{})", original.name(), original.number());

        if (!original.name().equals(updated.name())) {
            findings.addFinding(FindingCategory.FIELD_NAME_CHANGE, updated.file(), updated.line(),
                    String.format("Name of an existing field is changed from `%s` to `%s`.", original.name(), updated.name()),
                    ChangeType.MAJOR);
            return;
        }

        if (original.repeated() != updated.repeated()) {
            findings.addFinding(FindingCategory.FIELD_REPEATED_CHANGE, updated.file(), updated.line(),
                    String.format("Repeated state of an existing field `%s` is changed from `%s` to `%s`.",
                            original.name(), label(original), label(updated)),
                    ChangeType.MAJOR);
        }
        // Loosening a requirement is fine, only optional -> required breaks callers.
        if (!original.required() && updated.required()) {
            findings.addFinding(FindingCategory.FIELD_BEHAVIOR_CHANGE, updated.file(), updated.line(),
                    String.format("Field behavior of an existing field `%s` is changed.", original.name()),
                    ChangeType.MAJOR);
        }

        compareType(original, updated, findings);
        compareOneof(original, updated, findings);
        resourceReferenceResolver.compare(original, updated, findings);
    }

    private void compareType(FieldView original, FieldView updated, FindingContainer findings) {
        if (!original.protoType().equals(updated.protoType())) {
            reportTypeChange(original, updated, original.protoType(), updated.protoType(), findings);
        } else if (original.typeName() != null && !original.typeName().equals(updated.typeName())) {
            if (!TypeNames.isEquivalent(original.typeName(), updated.typeName(),
                    original.apiVersion(), updated.apiVersion())) {
                reportTypeChange(original, updated, original.typeName(), updated.typeName(), findings);
            }
        } else if (original.typeName() != null) {
            if (original.mapType() && !updated.mapType()) {
                findings.addFinding(FindingCategory.FIELD_TYPE_CHANGE, updated.file(), updated.line(),
                        String.format("Type of an existing field `%s` is changed from a map to `%s`.",
                                original.name(), updated.typeName()),
                        ChangeType.MAJOR);
            } else if (!original.mapType() && updated.mapType()) {
                findings.addFinding(FindingCategory.FIELD_TYPE_CHANGE, updated.file(), updated.line(),
                        String.format("Type of an existing field `%s` is changed from `%s` to a map.",
                                original.name(), original.typeName()),
                        ChangeType.MAJOR);
            } else if (original.mapType()) {
                compareMapEntries(original, updated, findings);
            }
        }
    }

    private void compareMapEntries(FieldView original, FieldView updated, FindingContainer findings) {
        MapEntryType originalEntry = original.mapEntryType();
        MapEntryType updatedEntry = updated.mapEntryType();
        boolean sameKey = TypeNames.isEquivalent(originalEntry.key(), updatedEntry.key(),
                original.apiVersion(), updated.apiVersion());
        boolean sameValue = TypeNames.isEquivalent(originalEntry.value(), updatedEntry.value(),
                original.apiVersion(), updated.apiVersion());
        if (!(sameKey && sameValue)) {
            reportTypeChange(original, updated, originalEntry.toString(), updatedEntry.toString(), findings);
        }
    }

    private void compareOneof(FieldView original, FieldView updated, FindingContainer findings) {
        if (original.isInOneof() != updated.isInOneof()) {
            if (original.isInOneof()) {
                findings.addFinding(FindingCategory.FIELD_ONEOF_REMOVAL, updated.file(), updated.line(),
                        String.format("An existing field `%s` is moved out of One-of.", original.name()),
                        ChangeType.MAJOR);
            } else {
                findings.addFinding(FindingCategory.FIELD_ONEOF_ADDITION, updated.file(), updated.line(),
                        String.format("An existing field `%s` is moved into One-of.", original.name()),
                        ChangeType.MAJOR);
            }
        } else if (original.isInOneof() && original.proto3Optional() != updated.proto3Optional()) {
            if (original.proto3Optional()) {
                findings.addFinding(FindingCategory.FIELD_PROTO3_OPTIONAL_CHANGE, updated.file(), updated.line(),
                        String.format("Proto3 optional state of an existing field `%s` is changed to required.",
                                original.name()),
                        ChangeType.MAJOR);
            } else {
                findings.addFinding(FindingCategory.FIELD_PROTO3_OPTIONAL_CHANGE, updated.file(), updated.line(),
                        String.format("An existing field `%s` is changed to proto3 optional.", original.name()),
                        ChangeType.MINOR);
            }
        }
    }

    private static void reportTypeChange(FieldView original, FieldView updated, String from, String to,
                                         FindingContainer findings) {
        findings.addFinding(FindingCategory.FIELD_TYPE_CHANGE, updated.file(), updated.line(),
                String.format("Type of an existing field `%s` is changed from `%s` to `%s`.", original.name(), from, to),
                ChangeType.MAJOR);
    }

    private static String label(FieldView field) {
        return field.repeated() ? LABEL_REPEATED : LABEL_OPTIONAL;
    }
}
