package com.krickert.protocompat.comparator;

import com.krickert.protocompat.model.finding.ChangeType;
import com.krickert.protocompat.model.finding.FindingCategory;
import com.krickert.protocompat.model.finding.FindingContainer;
import com.krickert.protocompat.model.resource.ResourceDatabase;
import com.krickert.protocompat.model.resource.ResourceDefinition;
import com.krickert.protocompat.model.resource.ResourceReference;
import com.krickert.protocompat.model.view.FieldView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Decides whether a change to a field's {@code google.api.resource_reference} annotation is breaking.
 * <p>
 * A reference can name its resource directly ({@code type}) or through a child resource whose parent is
 * meant ({@code child_type}), and the two forms may describe the same resource. Telling them apart needs
 * the resource database of the schema tree. Every parent lookup runs against the database of the tree
 * that owns the {@code child_type} reference; a missing database behaves as an empty one.
 */
public class ResourceReferenceResolver {
    private static final Logger LOG = LoggerFactory.getLogger(ResourceReferenceResolver.class);

    /**
     * Compares the resource references of two revisions of the same field.
     *
     * @throws MalformedResourceReferenceException if either reference sets neither {@code type} nor {@code child_type}
     */
    public void compare(FieldView original, FieldView updated, FindingContainer findings) {
        checkNotNull(original, "original field cannot be null");
        checkNotNull(updated, "updated field cannot be null");
        checkNotNull(findings, "findings cannot be null");

        ResourceReference originalRef = original.resourceReference();
        ResourceReference updatedRef = updated.resourceReference();
        requireWellFormed(originalRef, original);
        requireWellFormed(updatedRef, updated);

        if (originalRef == null && updatedRef == null) {
            return;
        }
        if (originalRef == null) {
            compareAddition(original, updated, updatedRef, findings);
            return;
        }
        if (updatedRef == null) {
            compareRemoval(original, updated, originalRef, findings);
            return;
        }
        if (originalRef.isChildType() == updatedRef.isChildType()) {
            String originalType = originalRef.effectiveType();
            String updatedType = updatedRef.effectiveType();
            if (!originalType.equals(updatedType)) {
                findings.addFinding(FindingCategory.RESOURCE_REFERENCE_CHANGE, updated.file(), updated.line(),
                        String.format("The type of resource reference option of the field `%s` is changed from `%s` to `%s`.",
                                original.name(), originalType, updatedType),
                        ChangeType.MAJOR);
            }
            return;
        }
        // `type` flipped to `child_type` or back. Still fine if the child's parent is the other side's type.
        if (originalRef.isChildType()) {
            checkResolvesToParent(originalRef.childType(), updatedRef.type(), databaseOf(original),
                    original, updated, findings);
        } else {
            checkResolvesToParent(updatedRef.childType(), originalRef.type(), databaseOf(updated),
                    original, updated, findings);
        }
    }

    private void compareAddition(FieldView original, FieldView updated, ResourceReference added,
                                 FindingContainer findings) {
        if (isRegistered(added, databaseOf(updated))) {
            findings.addFinding(FindingCategory.RESOURCE_REFERENCE_ADDITION, updated.file(), updated.line(),
                    String.format("A resource reference option is added to the field `%s`.", original.name()),
                    ChangeType.MINOR);
        } else {
            findings.addFinding(FindingCategory.RESOURCE_REFERENCE_ADDITION, updated.file(), updated.line(),
                    String.format("A resource reference option is added to the field `%s`, but it is not defined anywhere.",
                            original.name()),
                    ChangeType.MAJOR);
        }
    }

    private void compareRemoval(FieldView original, FieldView updated, ResourceReference removed,
                                FindingContainer findings) {
        if (isMovedToMessageOptions(removed, original, updated)) {
            findings.addFinding(FindingCategory.RESOURCE_REFERENCE_REMOVAL, original.file(), original.line(),
                    String.format("A resource reference option of the field `%s` is removed, but added back to the message options.",
                            original.name()),
                    ChangeType.MINOR);
        } else {
            findings.addFinding(FindingCategory.RESOURCE_REFERENCE_REMOVAL, original.file(), original.line(),
                    String.format("A resource reference option of the field `%s` is removed.", original.name()),
                    ChangeType.MAJOR);
        }
    }

    private boolean isRegistered(ResourceReference reference, ResourceDatabase database) {
        Set<ResourceDefinition> resources = reference.isChildType()
                ? database.getParentResourcesByChildType(reference.childType())
                : database.getResourceByType(reference.type());
        LOG.debug("Resource reference {} resolves to {} registered resource(s)", reference, resources.size());
        return !resources.isEmpty();
    }

    /**
     * A field-level reference dropped in favour of an equivalent message-level resource is not a regression.
     */
    private boolean isMovedToMessageOptions(ResourceReference removed, FieldView original, FieldView updated) {
        ResourceDefinition messageResource = updated.messageResource();
        if (messageResource == null) {
            return false;
        }
        if (removed.isChildType()) {
            return databaseOf(original).getParentResourcesByChildType(removed.childType()).stream()
                    .anyMatch(parent -> parent.type().equals(messageResource.type()));
        }
        return messageResource.type().equals(removed.type());
    }

    private void checkResolvesToParent(String childType, String parentType, ResourceDatabase database,
                                       FieldView original, FieldView updated, FindingContainer findings) {
        boolean resolved = database.getParentResourcesByChildType(childType).stream()
                .anyMatch(parent -> parent.type().equals(parentType));
        if (!resolved) {
            findings.addFinding(FindingCategory.RESOURCE_REFERENCE_CHANGE, updated.file(), updated.line(),
                    String.format("The child_type `%s` and type `%s` of resource reference option in field `%s` "
                            + "cannot be resolved to the identical resource.", childType, parentType, original.name()),
                    ChangeType.MAJOR);
        }
    }

    private static ResourceDatabase databaseOf(FieldView field) {
        return field.resourceDatabase() != null ? field.resourceDatabase() : ResourceDatabase.empty();
    }

    private static void requireWellFormed(ResourceReference reference, FieldView field) {
        if (reference != null && reference.isMalformed()) {
            throw new MalformedResourceReferenceException(field.name());
        }
    }
}
