package com.haulage.tickets.service;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Fixed set of locks selected by key hash. Two workers handling the same
 * (ticket number, vendor) pair always contend on the same lock; unrelated
 * keys rarely do.
 */
@Component
public class StripedKeyLock {

    private final ReentrantLock[] stripes;

    public StripedKeyLock(@Value("${tickets.duplicates.lock-stripes:64}") int stripeCount) {
        if (stripeCount < 1) {
            throw new IllegalArgumentException("Stripe count must be positive: " + stripeCount);
        }
        this.stripes = new ReentrantLock[stripeCount];
        for (int i = 0; i < stripeCount; i++) {
            stripes[i] = new ReentrantLock();
        }
    }

    public Lock lockFor(String ticketNumber, String vendor) {
        int hash = (ticketNumber + '\u0000' + vendor).hashCode();
        return stripes[Math.floorMod(hash, stripes.length)];
    }

    int stripeCount() {
        return stripes.length;
    }
}
