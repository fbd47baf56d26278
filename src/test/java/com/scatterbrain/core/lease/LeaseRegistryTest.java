package com.scatterbrain.core.lease;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link LeaseRegistry}.
 */
class LeaseRegistryTest {

    private LeaseRegistry leases;

    @BeforeEach
    void setUp() {
        leases = new LeaseRegistry();
    }

    @Test
    @DisplayName("issued tokens strictly increase")
    void tokensIncrease() {
        long first = leases.issue(1, 1);
        long second = leases.issue(1, 2);
        long third = leases.issue(2, 1);
        assertTrue(first < second);
        assertTrue(second < third);
    }

    @Test
    @DisplayName("a lease is consumed exactly once")
    void consumedOnce() {
        long token = leases.issue(1, 7);
        assertTrue(leases.isOutstanding(1, 7));

        assertEquals(LeaseRegistry.Outcome.CONSUMED, leases.consume(1, 7, token));
        assertFalse(leases.isOutstanding(1, 7));
        assertEquals(LeaseRegistry.Outcome.NONE, leases.consume(1, 7, token));
    }

    @Test
    @DisplayName("a newer lease supersedes the older one")
    void newerSupersedes() {
        long older = leases.issue(1, 7);
        long newer = leases.issue(1, 7);

        assertEquals(LeaseRegistry.Outcome.MISMATCH, leases.consume(1, 7, older));
        assertEquals(LeaseRegistry.Outcome.CONSUMED, leases.consume(1, 7, newer));
    }

    @Test
    @DisplayName("leases are scoped to plan and task")
    void scoped() {
        long token = leases.issue(1, 7);
        assertEquals(LeaseRegistry.Outcome.NONE, leases.consume(2, 7, token));
        assertEquals(LeaseRegistry.Outcome.NONE, leases.consume(1, 8, token));
        assertTrue(leases.isOutstanding(1, 7));
    }

    @Test
    @DisplayName("revokeAll and revokePlan drop outstanding leases")
    void revocation() {
        leases.issue(1, 1);
        leases.issue(1, 2);
        leases.issue(1, 3);
        leases.issue(2, 1);

        leases.revokeAll(1, List.of(1L, 2L));
        assertFalse(leases.isOutstanding(1, 1));
        assertFalse(leases.isOutstanding(1, 2));
        assertTrue(leases.isOutstanding(1, 3));

        leases.revokePlan(1);
        assertFalse(leases.isOutstanding(1, 3));
        assertTrue(leases.isOutstanding(2, 1));
        assertEquals(1, leases.outstandingCount());
    }

    @Test
    @DisplayName("concurrent consumers of the same token: exactly one wins")
    void concurrentConsume() throws Exception {
        long token = leases.issue(1, 1);
        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        ConcurrentLinkedQueue<LeaseRegistry.Outcome> outcomes = new ConcurrentLinkedQueue<>();
        try {
            for (int i = 0; i < threads; i++) {
                pool.execute(() -> {
                    try {
                        start.await();
                        outcomes.add(leases.consume(1, 1, token));
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                });
            }
            start.countDown();
        } finally {
            pool.shutdown();
            assertTrue(pool.awaitTermination(5, TimeUnit.SECONDS));
        }

        assertEquals(threads, outcomes.size());
        assertEquals(1, outcomes.stream().filter(o -> o == LeaseRegistry.Outcome.CONSUMED).count());
    }
}
