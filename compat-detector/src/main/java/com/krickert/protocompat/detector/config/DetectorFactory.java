package com.krickert.protocompat.detector.config;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.krickert.protocompat.comparator.FileSetComparator;
import com.krickert.protocompat.descriptor.DescriptorViewFactory;
import io.micronaut.context.annotation.Bean;
import io.micronaut.context.annotation.Factory;
import jakarta.inject.Named;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Factory
public class DetectorFactory {
    private static final Logger LOG = LoggerFactory.getLogger(DetectorFactory.class);

    public static final String EXECUTOR_NAME = "compat-detector-executor";

    @Singleton
    @Named(EXECUTOR_NAME)
    @Bean(preDestroy = "shutdown")
    public ExecutorService detectorExecutor(DetectorConfiguration config) {
        int threads = Math.max(1, config.getParallelism());
        LOG.info("Creating detector executor with {} thread(s), namePrefix: {}", threads, config.getThreadNamePrefix());
        return Executors.newFixedThreadPool(threads, new ThreadFactoryBuilder()
                .setNameFormat(config.getThreadNamePrefix() + "-%d")
                .setDaemon(true)
                .build());
    }

    @Singleton
    public DescriptorViewFactory descriptorViewFactory(DetectorConfiguration config) {
        return config.isSkipGoogleImports()
                ? new DescriptorViewFactory()
                : new DescriptorViewFactory(file -> true);
    }

    @Singleton
    public FileSetComparator fileSetComparator() {
        return new FileSetComparator();
    }
}
