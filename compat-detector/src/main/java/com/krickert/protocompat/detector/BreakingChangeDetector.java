package com.krickert.protocompat.detector;

import com.google.protobuf.DescriptorProtos.FileDescriptorSet;
import com.krickert.protocompat.comparator.ComparisonTask;
import com.krickert.protocompat.comparator.FileSetComparator;
import com.krickert.protocompat.descriptor.DescriptorViewFactory;
import com.krickert.protocompat.detector.config.DetectorConfiguration;
import com.krickert.protocompat.detector.config.DetectorFactory;
import com.krickert.protocompat.model.finding.ChangeType;
import com.krickert.protocompat.model.finding.FindingContainer;
import com.krickert.protocompat.model.view.FileSetView;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Compares two revisions of a schema tree and collects every finding.
 * <p>
 * Top-level messages, enums and services are compared as independent tasks. With a parallelism above one
 * the tasks run on the detector executor, each into its own container; the containers are merged in task
 * order, so the result does not depend on thread scheduling.
 */
@Singleton
public class BreakingChangeDetector {
    private static final Logger LOG = LoggerFactory.getLogger(BreakingChangeDetector.class);

    private final FileSetComparator fileSetComparator;
    private final DescriptorViewFactory viewFactory;
    private final ExecutorService executor;
    private final DetectorConfiguration configuration;

    @Inject
    public BreakingChangeDetector(FileSetComparator fileSetComparator,
                                  DescriptorViewFactory viewFactory,
                                  @Named(DetectorFactory.EXECUTOR_NAME) ExecutorService executor,
                                  DetectorConfiguration configuration) {
        this.fileSetComparator = fileSetComparator;
        this.viewFactory = viewFactory;
        this.executor = executor;
        this.configuration = configuration;
        LOG.info("BreakingChangeDetector initialized with parallelism {}", configuration.getParallelism());
    }

    /**
     * Wraps both descriptor sets and compares them.
     */
    public DetectionResult detect(FileDescriptorSet original, FileDescriptorSet updated) {
        checkNotNull(original, "original descriptor set cannot be null");
        checkNotNull(updated, "updated descriptor set cannot be null");
        return detect(viewFactory.create(original), viewFactory.create(updated));
    }

    public DetectionResult detect(FileSetView original, FileSetView updated) {
        List<ComparisonTask> tasks = fileSetComparator.plan(original, updated);
        LOG.debug("Running {} comparison task(s)", tasks.size());

        FindingContainer findings = (configuration.getParallelism() > 1 && tasks.size() > 1)
                ? runParallel(tasks)
                : runSequential(tasks);

        DetectionResult result = new DetectionResult(findings.getFindings());
        LOG.info("Detection finished: {} finding(s), {} major, {} minor",
                result.findings().size(), result.count(ChangeType.MAJOR), result.count(ChangeType.MINOR));
        return result;
    }

    private FindingContainer runSequential(List<ComparisonTask> tasks) {
        FindingContainer findings = new FindingContainer();
        for (ComparisonTask task : tasks) {
            task.run(findings);
        }
        return findings;
    }

    private FindingContainer runParallel(List<ComparisonTask> tasks) {
        List<Future<FindingContainer>> futures = new ArrayList<>(tasks.size());
        for (ComparisonTask task : tasks) {
            futures.add(executor.submit(() -> {
                FindingContainer taskFindings = new FindingContainer();
                task.run(taskFindings);
                return taskFindings;
            }));
        }

        FindingContainer merged = new FindingContainer();
        for (int i = 0; i < futures.size(); i++) {
            try {
                merged.addAll(futures.get(i).get());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                cancelAll(futures);
                throw new DetectionException("Interrupted while comparing " + tasks.get(i).description(), e);
            } catch (ExecutionException e) {
                cancelAll(futures);
                Throwable cause = e.getCause();
                LOG.error("Comparison of {} failed", tasks.get(i).description(), cause);
                // Same exception the sequential path would throw, e.g. a malformed resource reference.
                if (cause instanceof RuntimeException runtimeException) {
                    throw runtimeException;
                }
                throw new DetectionException("Comparison of " + tasks.get(i).description() + " failed", cause);
            }
        }
        return merged;
    }

    private static void cancelAll(List<Future<FindingContainer>> futures) {
        futures.forEach(f -> f.cancel(true));
    }
}
