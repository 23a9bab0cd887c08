package com.libragraph.vfs.core.dir;

import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Named;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@ApplicationScoped
public class FanoutExecutorProducer {

    @ConfigProperty(name = "vfs.move.fanout-threads", defaultValue = "8")
    int threads;

    private ExecutorService executor;

    @Produces
    @ApplicationScoped
    @Named("fanoutExecutor")
    public ExecutorService fanoutExecutor() {
        executor = Executors.newFixedThreadPool(threads, threadFactory());
        return executor;
    }

    static ThreadFactory threadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "vfs-fanout-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        };
    }

    @PreDestroy
    void shutdown() {
        if (executor != null) executor.shutdown();
    }
}
