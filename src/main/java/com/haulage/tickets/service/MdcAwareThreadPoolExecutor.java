package com.haulage.tickets.service;

import org.slf4j.MDC;

import java.util.Map;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed-size pool that carries the submitting thread's MDC (run id, file)
 * into the worker thread, and clears it afterwards so pooled threads never
 * log under a stale context.
 */
public class MdcAwareThreadPoolExecutor extends ThreadPoolExecutor {

    public MdcAwareThreadPoolExecutor(int threads, String namePrefix) {
        super(threads, threads, 0L, TimeUnit.MILLISECONDS, new LinkedBlockingQueue<>(),
                namedDaemonThreads(namePrefix));
    }

    @Override
    public void execute(Runnable command) {
        Map<String, String> parentMdc = MDC.getCopyOfContextMap();

        super.execute(() -> {
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

    private static ThreadFactory namedDaemonThreads(String namePrefix) {
        AtomicInteger sequence = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, namePrefix + "-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
