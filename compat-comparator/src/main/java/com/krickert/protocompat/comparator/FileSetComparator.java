package com.krickert.protocompat.comparator;

import com.krickert.protocompat.model.finding.FindingContainer;
import com.krickert.protocompat.model.view.EntityPair;
import com.krickert.protocompat.model.view.EnumView;
import com.krickert.protocompat.model.view.FileSetView;
import com.krickert.protocompat.model.view.MessageView;
import com.krickert.protocompat.model.view.ServiceView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Compares two revisions of a whole schema tree. Top-level messages, enums and services are matched by
 * simple name, so a package version move does not read as a removal of everything.
 */
public class FileSetComparator {
    private static final Logger LOG = LoggerFactory.getLogger(FileSetComparator.class);

    private final EntityComparator<MessageView> messageComparator;
    private final EntityComparator<EnumView> enumComparator;
    private final EntityComparator<ServiceView> serviceComparator;

    public FileSetComparator() {
        this(new MessageComparator(), new EnumComparator(), new ServiceComparator());
    }

    public FileSetComparator(EntityComparator<MessageView> messageComparator,
                             EntityComparator<EnumView> enumComparator,
                             EntityComparator<ServiceView> serviceComparator) {
        this.messageComparator = checkNotNull(messageComparator, "messageComparator");
        this.enumComparator = checkNotNull(enumComparator, "enumComparator");
        this.serviceComparator = checkNotNull(serviceComparator, "serviceComparator");
    }

    /**
     * Lists the independent comparisons between two trees: messages first, then enums, then services,
     * each sorted by name.
     */
    public List<ComparisonTask> plan(FileSetView original, FileSetView updated) {
        checkNotNull(original, "original file set cannot be null");
        checkNotNull(updated, "updated file set cannot be null");

        List<ComparisonTask> tasks = new ArrayList<>();
        for (EntityPair<MessageView> pair : EntityPairing.pairByKey(original.messages(), updated.messages())) {
            tasks.add(new ComparisonTask("message " + nameOf(pair, MessageView::name), findings -> messageComparator.compare(pair, findings)));
        }
        for (EntityPair<EnumView> pair : EntityPairing.pairByKey(original.enums(), updated.enums())) {
            tasks.add(new ComparisonTask("enum " + nameOf(pair, EnumView::name), findings -> enumComparator.compare(pair, findings)));
        }
        for (EntityPair<ServiceView> pair : EntityPairing.pairByKey(original.services(), updated.services())) {
            tasks.add(new ComparisonTask("service " + nameOf(pair, ServiceView::name), findings -> serviceComparator.compare(pair, findings)));
        }
        LOG.debug("Planned {} comparison task(s)", tasks.size());
        return tasks;
    }

    /**
     * Runs every planned comparison in order on the calling thread.
     */
    public void compare(FileSetView original, FileSetView updated, FindingContainer findings) {
        checkNotNull(findings, "findings cannot be null");
        for (ComparisonTask task : plan(original, updated)) {
            task.run(findings);
        }
    }

    private static <T> String nameOf(EntityPair<T> pair, Function<T, String> name) {
        return name.apply(pair.original().orElseGet(pair::requireUpdated));
    }
}
