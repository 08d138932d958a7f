package com.krickert.protocompat.comparator;

import com.krickert.protocompat.model.finding.ChangeType;
import com.krickert.protocompat.model.finding.FindingCategory;
import com.krickert.protocompat.model.finding.FindingContainer;
import com.krickert.protocompat.model.view.EntityPair;
import com.krickert.protocompat.model.view.MethodView;
import com.krickert.protocompat.model.view.ServiceView;

import static com.google.common.base.Preconditions.checkNotNull;

public class ServiceComparator implements EntityComparator<ServiceView> {

    private final EntityComparator<MethodView> methodComparator;

    public ServiceComparator() {
        this(new MethodComparator());
    }

    public ServiceComparator(EntityComparator<MethodView> methodComparator) {
        this.methodComparator = checkNotNull(methodComparator, "methodComparator");
    }

    @Override
    public void compare(EntityPair<ServiceView> pair, FindingContainer findings) {
        checkNotNull(pair, "pair cannot be null");
        checkNotNull(findings, "findings cannot be null");

        if (pair.isAddition()) {
            ServiceView added = pair.requireUpdated();
            findings.addFinding(FindingCategory.SERVICE_ADDITION, added.file(), added.line(),
                    String.format("A new service `%s` is added.", added.name()),
                    ChangeType.MINOR);
            return;
        }
        if (pair.isRemoval()) {
            ServiceView removed = pair.requireOriginal();
            findings.addFinding(FindingCategory.SERVICE_REMOVAL, removed.file(), removed.line(),
                    String.format("An existing service `%s` is removed.", removed.name()),
                    ChangeType.MAJOR);
            return;
        }

        for (EntityPair<MethodView> methods : EntityPairing.pairBy(
                pair.requireOriginal().methods(), pair.requireUpdated().methods(), MethodView::name)) {
            methodComparator.compare(methods, findings);
        }
    }
}
