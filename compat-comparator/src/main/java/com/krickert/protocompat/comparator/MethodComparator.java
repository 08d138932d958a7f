package com.krickert.protocompat.comparator;

import com.krickert.protocompat.model.finding.ChangeType;
import com.krickert.protocompat.model.finding.FindingCategory;
import com.krickert.protocompat.model.finding.FindingContainer;
import com.krickert.protocompat.model.view.EntityPair;
import com.krickert.protocompat.model.view.MethodView;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Compares two revisions of an RPC method. Request and response types tolerate an API version move the
 * same way field types do.
 */
public class MethodComparator implements EntityComparator<MethodView> {

    @Override
    public void compare(EntityPair<MethodView> pair, FindingContainer findings) {
        checkNotNull(pair, "pair cannot be null");
        checkNotNull(findings, "findings cannot be null");

        if (pair.isAddition()) {
            MethodView added = pair.requireUpdated();
            findings.addFinding(FindingCategory.METHOD_ADDITION, added.file(), added.line(),
                    String.format("A new rpc method `%s` is added.", added.name()),
                    ChangeType.MINOR);
            return;
        }
        if (pair.isRemoval()) {
            MethodView removed = pair.requireOriginal();
            findings.addFinding(FindingCategory.METHOD_REMOVAL, removed.file(), removed.line(),
                    String.format("An existing rpc method `%s` is removed.", removed.name()),
                    ChangeType.MAJOR);
            return;
        }

        MethodView original = pair.requireOriginal();
        MethodView updated = pair.requireUpdated();

        if (!TypeNames.isEquivalent(original.inputType(), updated.inputType(), original.apiVersion(), updated.apiVersion())) {
            findings.addFinding(FindingCategory.METHOD_INPUT_TYPE_CHANGE, updated.file(), updated.line(),
                    String.format("Input type of an existing method `%s` is changed from `%s` to `%s`.",
                            original.name(), original.inputType(), updated.inputType()),
                    ChangeType.MAJOR);
        }
        if (!TypeNames.isEquivalent(original.outputType(), updated.outputType(), original.apiVersion(), updated.apiVersion())) {
            findings.addFinding(FindingCategory.METHOD_RESPONSE_TYPE_CHANGE, updated.file(), updated.line(),
                    String.format("Response type of an existing method `%s` is changed from `%s` to `%s`.",
                            original.name(), original.outputType(), updated.outputType()),
                    ChangeType.MAJOR);
        }
        if (original.clientStreaming() != updated.clientStreaming()) {
            findings.addFinding(FindingCategory.METHOD_CLIENT_STREAMING_CHANGE, updated.file(), updated.line(),
                    String.format("The request streaming type of an existing method `%s` is changed.", original.name()),
                    ChangeType.MAJOR);
        }
        if (original.serverStreaming() != updated.serverStreaming()) {
            findings.addFinding(FindingCategory.METHOD_SERVER_STREAMING_CHANGE, updated.file(), updated.line(),
                    String.format("The response streaming type of an existing method `%s` is changed.", original.name()),
                    ChangeType.MAJOR);
        }
    }
}
