package com.eainde.verify.thread;

import org.slf4j.MDC;

import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bounded executor that carries the caller's MDC ({@code runId}, {@code iteration}) into the
 * worker thread, so claim verification logs stay attributable to their run.
 */
public class MdcAwareExecutor implements Executor {

    private final ExecutorService delegate;

    public MdcAwareExecutor(ExecutorService delegate) {
        this.delegate = delegate;
    }

    public static MdcAwareExecutor fixed(String namePrefix, int threads) {
        return new MdcAwareExecutor(Executors.newFixedThreadPool(threads, namedDaemonThreads(namePrefix)));
    }

    public static MdcAwareExecutor cached(String namePrefix) {
        return new MdcAwareExecutor(Executors.newCachedThreadPool(namedDaemonThreads(namePrefix)));
    }

    @Override
    public void execute(Runnable command) {
        // Capture MDC context from the calling (parent) thread
        Map<String, String> parentMdc = MDC.getCopyOfContextMap();

        delegate.execute(() -> {
            if (parentMdc != null) {
                MDC.setContextMap(parentMdc);
            }
            try {
                command.run();
            } finally {
                MDC.clear();
            }
        });
    }

    /**
     * Same MDC propagation for callers that need a {@link Future} they can cancel.
     */
    public <T> Future<T> submit(Callable<T> task) {
        Map<String, String> parentMdc = MDC.getCopyOfContextMap();

        return delegate.submit(() -> {
            if (parentMdc != null) {
                MDC.setContextMap(parentMdc);
            }
            try {
                return task.call();
            } finally {
                MDC.clear();
            }
        });
    }

    public void shutdown() {
        delegate.shutdown();
        try {
            if (!delegate.awaitTermination(5, TimeUnit.SECONDS)) {
                delegate.shutdownNow();
            }
        } catch (InterruptedException e) {
            delegate.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static ThreadFactory namedDaemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
