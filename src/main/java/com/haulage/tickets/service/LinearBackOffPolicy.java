package com.haulage.tickets.service;

import org.springframework.retry.RetryContext;
import org.springframework.retry.backoff.BackOffContext;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.retry.backoff.BackOffPolicy;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.backoff.ThreadWaitSleeper;

import java.time.Duration;

/**
 * Back-off that grows linearly: the n-th retry waits {@code n * base}.
 */
public class LinearBackOffPolicy implements BackOffPolicy {

    private final long baseMillis;
    private final Sleeper sleeper;

    public LinearBackOffPolicy(Duration base) {
        this(base, new ThreadWaitSleeper());
    }

    public LinearBackOffPolicy(Duration base, Sleeper sleeper) {
        if (base.isNegative()) {
            throw new IllegalArgumentException("Back-off base must not be negative: " + base);
        }
        this.baseMillis = base.toMillis();
        this.sleeper = sleeper;
    }

    @Override
    public BackOffContext start(RetryContext context) {
        return new LinearBackOffContext();
    }

    @Override
    public void backOff(BackOffContext backOffContext) throws BackOffInterruptedException {
        LinearBackOffContext context = (LinearBackOffContext) backOffContext;
        long delay = delayFor(++context.retries);
        if (delay <= 0) {
            return;
        }
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BackOffInterruptedException("Interrupted while backing off", e);
        }
    }

    public long delayFor(int retry) {
        return baseMillis * retry;
    }

    private static class LinearBackOffContext implements BackOffContext {
        private int retries;
    }
}
