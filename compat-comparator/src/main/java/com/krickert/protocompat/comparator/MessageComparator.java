package com.krickert.protocompat.comparator;

import com.krickert.protocompat.model.finding.ChangeType;
import com.krickert.protocompat.model.finding.FindingCategory;
import com.krickert.protocompat.model.finding.FindingContainer;
import com.krickert.protocompat.model.resource.ResourceDefinition;
import com.krickert.protocompat.model.view.EntityPair;
import com.krickert.protocompat.model.view.EnumView;
import com.krickert.protocompat.model.view.FieldView;
import com.krickert.protocompat.model.view.MessageView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.stream.Collectors;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Compares two revisions of a message: its fields (by number), nested messages and enums (by name) and
 * its message-level resource definition. Map entry messages are skipped; the owning field's map check
 * covers them.
 */
public class MessageComparator implements EntityComparator<MessageView> {
    private static final Logger LOG = LoggerFactory.getLogger(MessageComparator.class);

    private final EntityComparator<FieldView> fieldComparator;
    private final EntityComparator<EnumView> enumComparator;

    public MessageComparator() {
        this(new FieldComparator(), new EnumComparator());
    }

    public MessageComparator(EntityComparator<FieldView> fieldComparator, EntityComparator<EnumView> enumComparator) {
        this.fieldComparator = checkNotNull(fieldComparator, "fieldComparator");
        this.enumComparator = checkNotNull(enumComparator, "enumComparator");
    }

    @Override
    public void compare(EntityPair<MessageView> pair, FindingContainer findings) {
        checkNotNull(pair, "pair cannot be null");
        checkNotNull(findings, "findings cannot be null");

        if (pair.isAddition()) {
            MessageView added = pair.requireUpdated();
            findings.addFinding(FindingCategory.MESSAGE_ADDITION, added.file(), added.line(),
                    String.format("A new message `%s` is added.", added.name()),
                    ChangeType.MINOR);
            return;
        }
        if (pair.isRemoval()) {
            MessageView removed = pair.requireOriginal();
            findings.addFinding(FindingCategory.MESSAGE_REMOVAL, removed.file(), removed.line(),
                    String.format("An existing message `%s` is removed.", removed.name()),
                    ChangeType.MAJOR);
            return;
        }

        MessageView original = pair.requireOriginal();
        MessageView updated = pair.requireUpdated();
        LOG.debug("Comparing message '{}' ({} -> {} fields)", original.fullName(),
                original.fields().size(), updated.fields().size());

        for (EntityPair<FieldView> fields : EntityPairing.pairBy(original.fields(), updated.fields(), FieldView::number)) {
            fieldComparator.compare(fields, findings);
        }
        for (EntityPair<MessageView> nested : EntityPairing.pairBy(
                withoutMapEntries(original.nestedMessages()), withoutMapEntries(updated.nestedMessages()), MessageView::name)) {
            compare(nested, findings);
        }
        for (EntityPair<EnumView> nested : EntityPairing.pairBy(original.nestedEnums(), updated.nestedEnums(), EnumView::name)) {
            enumComparator.compare(nested, findings);
        }
        compareResource(original, updated, findings);
    }

    private void compareResource(MessageView original, MessageView updated, FindingContainer findings) {
        ResourceDefinition originalResource = original.resource();
        ResourceDefinition updatedResource = updated.resource();
        if (originalResource == null && updatedResource == null) {
            return;
        }
        if (originalResource == null) {
            findings.addFinding(FindingCategory.RESOURCE_DEFINITION_ADDITION, updated.file(), updated.line(),
                    String.format("A message-level resource definition `%s` is added to the message `%s`.",
                            updatedResource.type(), updated.name()),
                    ChangeType.MINOR);
            return;
        }
        if (updatedResource == null) {
            findings.addFinding(FindingCategory.RESOURCE_DEFINITION_REMOVAL, original.file(), original.line(),
                    String.format("The message-level resource definition `%s` of the message `%s` is removed.",
                            originalResource.type(), original.name()),
                    ChangeType.MAJOR);
            return;
        }
        if (!originalResource.type().equals(updatedResource.type())) {
            findings.addFinding(FindingCategory.RESOURCE_DEFINITION_CHANGE, updated.file(), updated.line(),
                    String.format("The type of the message-level resource definition of the message `%s` is changed from `%s` to `%s`.",
                            original.name(), originalResource.type(), updatedResource.type()),
                    ChangeType.MAJOR);
            return;
        }
        for (String pattern : originalResource.patterns()) {
            if (!updatedResource.patterns().contains(pattern)) {
                findings.addFinding(FindingCategory.RESOURCE_PATTERN_REMOVAL, updated.file(), updated.line(),
                        String.format("The pattern `%s` of the resource `%s` is removed.", pattern, originalResource.type()),
                        ChangeType.MAJOR);
            }
        }
        for (String pattern : updatedResource.patterns()) {
            if (!originalResource.patterns().contains(pattern)) {
                findings.addFinding(FindingCategory.RESOURCE_PATTERN_ADDITION, updated.file(), updated.line(),
                        String.format("A new pattern `%s` is added to the resource `%s`.", pattern, updatedResource.type()),
                        ChangeType.MINOR);
            }
        }
    }

    private static List<MessageView> withoutMapEntries(List<MessageView> messages) {
        return messages.stream().filter(m -> !m.mapEntry()).collect(Collectors.toList());
    }
}
