package com.bazaarvoice.feedgate.admission.store;

import com.google.common.collect.Lists;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertTrue;

public class InMemoryAdmissionStoreTest {

    private static final Duration WINDOW = Duration.ofMinutes(5);

    private Instant _now;
    private Clock _clock;
    private InMemoryAdmissionStore _store;

    @BeforeMethod
    public void setUp() {
        _now = Instant.parse("2024-07-24T12:00:00Z");
        _clock = mock(Clock.class);
        when(_clock.instant()).then(ignore -> _now);
        when(_clock.millis()).then(ignore -> _now.toEpochMilli());
        _store = new InMemoryAdmissionStore(_clock);
    }

    @Test
    public void testAcquireUpToLimit() {
        assertTrue(_store.tryAcquire("env_1", "r1", 2, WINDOW));
        assertTrue(_store.tryAcquire("env_1", "r2", 2, WINDOW));
        assertFalse(_store.tryAcquire("env_1", "r3", 2, WINDOW));
        assertEquals(_store.count("env_1", WINDOW), 2);
    }

    @Test
    public void testConcurrentAcquiresGrantExactlyLimit() throws Exception {
        final int limit = 25;
        ExecutorService executor = Executors.newFixedThreadPool(16,
                new ThreadFactoryBuilder().setNameFormat("acquire-%d").setDaemon(true).build());
        try {
            final CountDownLatch start = new CountDownLatch(1);
            List<Future<Boolean>> results = Lists.newArrayList();
            for (int i = 0; i < limit * 2; i++) {
                final String requestId = "r" + i;
                results.add(executor.submit((Callable<Boolean>) () -> {
                    start.await();
                    return _store.tryAcquire("env_1", requestId, limit, WINDOW);
                }));
            }
            start.countDown();

            int granted = 0;
            for (Future<Boolean> result : results) {
                if (result.get(10, TimeUnit.SECONDS)) {
                    granted++;
                }
            }
            assertEquals(granted, limit);
            assertEquals(_store.count("env_1", WINDOW), limit);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    public void testReleaseIsIdempotent() {
        assertTrue(_store.tryAcquire("env_1", "r1", 1, WINDOW));
        assertTrue(_store.tryAcquire("env_2", "r2", 1, WINDOW));

        _store.release("env_1", "r1");
        _store.release("env_1", "r1");
        _store.release("env_1", "never-acquired");
        _store.release("env_3", "r1");

        assertEquals(_store.count("env_1", WINDOW), 0);
        assertEquals(_store.count("env_2", WINDOW), 1);
        assertTrue(_store.tryAcquire("env_1", "r3", 1, WINDOW));
    }

    @Test
    public void testLeakedSlotIsReclaimedAfterWindow() {
        assertTrue(_store.tryAcquire("env_1", "leaked", 1, WINDOW));
        assertFalse(_store.tryAcquire("env_1", "r2", 1, WINDOW));

        _now = _now.plus(WINDOW).minusSeconds(1);
        assertFalse(_store.tryAcquire("env_1", "r3", 1, WINDOW));

        _now = _now.plusSeconds(2);
        assertEquals(_store.count("env_1", WINDOW), 0);
        assertTrue(_store.tryAcquire("env_1", "r4", 1, WINDOW));
    }

    @Test
    public void testReleaseAfterExpiryIsNoOp() {
        assertTrue(_store.tryAcquire("env_1", "r1", 1, WINDOW));
        _now = _now.plus(WINDOW).plusSeconds(1);
        assertTrue(_store.tryAcquire("env_1", "r2", 1, WINDOW));

        _store.release("env_1", "r1");
        assertEquals(_store.count("env_1", WINDOW), 1);
    }

    @Test
    public void testEmptyTenantRecordsAreDropped() {
        assertTrue(_store.tryAcquire("env_1", "r1", 1, WINDOW));
        assertFalse(_store.tryAcquire("env_2", "r2", 0, WINDOW));
        assertEquals(_store.tenantCount(), 1);

        _store.release("env_1", "r1");
        assertEquals(_store.tenantCount(), 0);
    }
}
