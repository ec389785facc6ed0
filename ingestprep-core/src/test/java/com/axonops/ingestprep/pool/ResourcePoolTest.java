package com.axonops.ingestprep.pool;

import com.axonops.ingestprep.metrics.NoOpMetricsRegistry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for ResourcePool reuse, bounds and exclusivity.
 */
class ResourcePoolTest {

    /** Pooled stand-in that records its lease state. */
    static final class Lease {
        final int id;
        volatile boolean leased;
        final StringBuilder scratch = new StringBuilder();

        Lease(int id) {
            this.id = id;
        }
    }

    private final AtomicInteger ids = new AtomicInteger();

    private ResourcePool<Lease> newPool(int maxIdle) {
        return new ResourcePool<>(
            "test",
            p -> new Lease(ids.incrementAndGet()),
            l -> l.leased = true,
            l -> {
                if (!l.leased) {
                    return false;
                }
                l.leased = false;
                l.scratch.setLength(0);
                return true;
            },
            maxIdle,
            NoOpMetricsRegistry.INSTANCE);
    }

    @Test
    void testReusesReleasedObjects() {
        ResourcePool<Lease> pool = newPool(8);

        Lease first = pool.acquire();
        first.scratch.append("state");
        pool.release(first);
        Lease second = pool.acquire();

        assertThat(second).isSameAs(first);
        assertThat(second.leased).isTrue();
        assertThat(second.scratch).isEmpty();

        PoolStatistics stats = pool.getStatistics();
        assertThat(stats.created()).isEqualTo(1);
        assertThat(stats.acquired()).isEqualTo(2);
        assertThat(stats.released()).isEqualTo(1);
        assertThat(stats.active()).isEqualTo(1);
        assertThat(stats.reuseRate()).isEqualTo(0.5);
        assertThat(pool.getResourceTracker().getActiveCount()).isEqualTo(1);
        assertThat(pool.getName()).isEqualTo("test");
        assertThat(pool.getMaxIdle()).isEqualTo(8);
    }

    @Test
    void testDiscardsBeyondMaxIdle() {
        ResourcePool<Lease> pool = newPool(2);
        List<Lease> leased = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            leased.add(pool.acquire());
        }
        leased.forEach(pool::release);

        PoolStatistics stats = pool.getStatistics();
        assertThat(pool.getIdleCount()).isEqualTo(2);
        assertThat(stats.idle()).isEqualTo(2);
        assertThat(stats.discarded()).isEqualTo(3);
        assertThat(stats.active()).isZero();
        assertThat(stats.hasPotentialLeaks()).isFalse();
    }

    @Test
    void testZeroMaxIdleDisablesReuse() {
        ResourcePool<Lease> pool = newPool(0);

        Lease first = pool.acquire();
        pool.release(first);
        Lease second = pool.acquire();

        assertThat(second).isNotSameAs(first);
        assertThat(pool.getStatistics().created()).isEqualTo(2);
    }

    @Test
    void testWithResourceReleasesOnException() {
        ResourcePool<Lease> pool = newPool(4);

        assertThatThrownBy(() -> pool.withResource(l -> {
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class).hasMessage("boom");

        assertThat(pool.getStatistics().active()).isZero();
        assertThat(pool.getIdleCount()).isEqualTo(1);
    }

    @Test
    void testSecondReleaseOfSameObjectIgnored() {
        ResourcePool<Lease> pool = newPool(4);

        Lease lease = pool.acquire();
        pool.release(lease);
        pool.release(lease);

        assertThat(pool.getIdleCount()).isEqualTo(1);
        assertThat(pool.getStatistics().released()).isEqualTo(1);
        assertThat(pool.getStatistics().active()).isZero();

        Lease first = pool.acquire();
        Lease second = pool.acquire();
        assertThat(second).isNotSameAs(first);
        assertThat(pool.getStatistics().active()).isEqualTo(2);
    }

    @Test
    void testReleaseInsideWithResourceNotDoubled() {
        ResourcePool<Lease> pool = newPool(4);

        pool.withResource(l -> {
            pool.release(l);
            return null;
        });

        assertThat(pool.getIdleCount()).isEqualTo(1);
        assertThat(pool.acquire()).isNotSameAs(pool.acquire());
    }

    @Test
    void testClearDropsIdleObjects() {
        ResourcePool<Lease> pool = newPool(4);
        pool.release(pool.acquire());
        pool.release(pool.acquire());

        pool.clear();

        assertThat(pool.getIdleCount()).isZero();
        assertThat(pool.acquire().id).isEqualTo(2);
    }

    @Test
    void testInvalidArguments() {
        assertThatThrownBy(() -> newPool(-1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ResourcePool<Lease>(
            null, p -> new Lease(0), l -> { }, l -> true, 1, NoOpMetricsRegistry.INSTANCE))
            .isInstanceOf(NullPointerException.class);
    }

    @Test
    @Timeout(value = 30, unit = TimeUnit.SECONDS)
    void testConcurrentLeasesAreExclusive() throws InterruptedException {
        ResourcePool<Lease> pool = newPool(16);
        int threads = 16;
        int iterations = 2_000;
        Set<Lease> inUse = ConcurrentHashMap.newKeySet();
        AtomicInteger overlaps = new AtomicInteger();
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threads);
        ExecutorService executor = Executors.newFixedThreadPool(threads);

        for (int t = 0; t < threads; t++) {
            executor.submit(() -> {
                try {
                    start.await();
                    for (int i = 0; i < iterations; i++) {
                        Lease l = pool.acquire();
                        if (!inUse.add(l)) {
                            overlaps.incrementAndGet();
                        }
                        l.scratch.append(i);
                        inUse.remove(l);
                        pool.release(l);
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            });
        }

        start.countDown();
        assertThat(done.await(20, TimeUnit.SECONDS)).isTrue();
        executor.shutdown();

        PoolStatistics stats = pool.getStatistics();
        assertThat(overlaps.get()).isZero();
        assertThat(stats.active()).isZero();
        assertThat(stats.acquired()).isEqualTo((long) threads * iterations);
        assertThat(stats.created()).isLessThanOrEqualTo(threads);
        assertThat(pool.getIdleCount()).isLessThanOrEqualTo(16);
    }
}
