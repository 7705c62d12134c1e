package com.eainde.compliance.support;

import org.slf4j.MDC;

import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Executor that carries the caller's MDC (e.g. {@code questionId}) onto the worker thread.
 */
public class MdcAwareExecutor implements Executor, AutoCloseable {

    private final ExecutorService delegate;

    public MdcAwareExecutor(String threadNamePrefix) {
        this(Executors.newCachedThreadPool(daemonThreads(threadNamePrefix)));
    }

    public MdcAwareExecutor(ExecutorService delegate) {
        this.delegate = delegate;
    }

    @Override
    public void execute(Runnable command) {
        delegate.execute(wrap(command));
    }

    /**
     * Submits a task whose {@link Future#cancel(boolean) cancel(true)} interrupts the worker.
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

    private Runnable wrap(Runnable command) {
        // Capture MDC context from the calling thread
        Map<String, String> parentMdc = MDC.getCopyOfContextMap();
        return () -> {
            if (parentMdc != null) {
                MDC.setContextMap(parentMdc);
            }
            try {
                command.run();
            } finally {
                MDC.clear();
            }
        };
    }

    @Override
    public void close() throws InterruptedException {
        delegate.shutdown();
        if (!delegate.awaitTermination(5, TimeUnit.SECONDS)) {
            delegate.shutdownNow();
        }
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
