package com.bazaarvoice.feedgate.checkpoint;

import com.bazaarvoice.feedgate.checkpoint.store.CheckpointEntry;
import com.bazaarvoice.feedgate.checkpoint.store.CheckpointStore;
import com.bazaarvoice.feedgate.checkpoint.store.CheckpointStoreException;
import com.bazaarvoice.feedgate.checkpoint.store.InMemoryCheckpointStore;
import com.bazaarvoice.feedgate.common.dropwizard.log.RateLimitedLog;
import com.bazaarvoice.feedgate.common.dropwizard.log.RateLimitedLogFactory;
import com.codahale.metrics.MetricRegistry;
import org.slf4j.Logger;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;

public class CheckpointCacheTest {

    private static final Duration FRESH = Duration.ofDays(7);
    private static final Duration STALE = Duration.ofDays(14);
    private static final String HANDLE = "3833821-1721811548143";

    private Instant _now;
    private Clock _clock;
    private MetricRegistry _metricRegistry;
    private RateLimitedLog _rateLimitedLog;
    private RateLimitedLogFactory _logFactory;
    private InMemoryCheckpointStore _store;

    @BeforeMethod
    public void setUp() {
        _now = Instant.parse("2024-07-24T12:00:00Z");
        _clock = mock(Clock.class);
        when(_clock.instant()).then(ignore -> _now);
        when(_clock.millis()).then(ignore -> _now.toEpochMilli());
        _metricRegistry = new MetricRegistry();
        _rateLimitedLog = mock(RateLimitedLog.class);
        _logFactory = mock(RateLimitedLogFactory.class);
        when(_logFactory.from(any(Logger.class))).thenReturn(_rateLimitedLog);
        _store = new InMemoryCheckpointStore(_clock);
    }

    private CheckpointCache newCache(CheckpointStore store) {
        return new CheckpointCache(store, FRESH, STALE, 100, _clock, _metricRegistry, _logFactory);
    }

    private long meterCount(String name) {
        return _metricRegistry.meter(MetricRegistry.name("bv.feedgate.checkpoint", "CheckpointCache", name)).getCount();
    }

    @Test
    public void testMissForUnknownHandle() {
        assertEquals(newCache(_store).get(HANDLE), Optional.empty());
        assertEquals(meterCount("miss"), 1);
    }

    @Test
    public void testFreshHit() {
        CheckpointCache cache = newCache(_store);
        Instant cutoff = _now.minus(Duration.ofHours(24));
        cache.set(HANDLE, cutoff);

        _now = _now.plus(Duration.ofDays(6));
        assertEquals(cache.get(HANDLE), Optional.of(cutoff));
        assertEquals(meterCount("fresh"), 1);
    }

    @Test
    public void testSharedTierPopulatesLocalTier() {
        CheckpointStore store = spy(_store);
        Instant cutoff = _now.minus(Duration.ofHours(24));
        newCache(store).set(HANDLE, cutoff);

        // A second instance sees the checkpoint through the shared tier, then serves it locally
        CheckpointCache otherInstance = newCache(store);
        assertEquals(otherInstance.get(HANDLE), Optional.of(cutoff));
        assertEquals(otherInstance.get(HANDLE), Optional.of(cutoff));
        verify(store, times(1)).get(HANDLE);
    }

    @Test
    public void testCutoffIsWrittenOnce() {
        CheckpointCache cache = newCache(_store);
        Instant original = _now.minus(Duration.ofHours(24));
        cache.set(HANDLE, original);

        _now = _now.plus(Duration.ofMinutes(10));
        cache.set(HANDLE, _now.minus(Duration.ofHours(24)));

        assertEquals(cache.get(HANDLE), Optional.of(original));
        assertEquals(newCache(_store).get(HANDLE), Optional.of(original));
    }

    @Test
    public void testStaleHitRevalidatesWithSameCutoff() {
        CheckpointCache cache = newCache(_store);
        Instant cutoff = _now.minus(Duration.ofDays(8));
        cache.set(HANDLE, cutoff);

        _now = _now.plus(Duration.ofDays(10));
        assertEquals(cache.get(HANDLE), Optional.of(cutoff));
        assertEquals(meterCount("stale"), 1);
        assertEquals(_store.get(HANDLE), Optional.of(new CheckpointEntry(cutoff, _now)));

        // Revalidation restarts both windows
        _now = _now.plus(Duration.ofDays(6));
        assertEquals(cache.get(HANDLE), Optional.of(cutoff));
        assertEquals(meterCount("fresh"), 1);
    }

    @Test
    public void testExpiredEntryIsMiss() {
        CheckpointCache cache = newCache(_store);
        cache.set(HANDLE, _now.minus(Duration.ofHours(1)));

        _now = _now.plus(STALE).plusSeconds(1);
        assertEquals(cache.get(HANDLE), Optional.empty());
        assertEquals(meterCount("miss"), 1);
    }

    @Test
    public void testEntryPastStaleWindowIsMissEvenIfStored() {
        CheckpointStore store = mock(CheckpointStore.class);
        when(store.get(HANDLE)).thenReturn(Optional.of(
                new CheckpointEntry(_now.minus(Duration.ofDays(20)), _now.minus(Duration.ofDays(15)))));

        assertFalse(newCache(store).get(HANDLE).isPresent());
    }

    @Test
    public void testStoreReadFailureIsMiss() {
        CheckpointStore store = mock(CheckpointStore.class);
        CheckpointStoreException failure = new CheckpointStoreException("read failed", new RuntimeException());
        when(store.get(anyString())).thenThrow(failure);

        assertEquals(newCache(store).get(HANDLE), Optional.empty());
        assertEquals(meterCount("store-failures"), 1);
        verify(_rateLimitedLog).warn(failure, "Checkpoint store unavailable, treating lookup as a miss");
    }

    @Test
    public void testStoreWriteFailureKeepsLocalCheckpoint() {
        CheckpointStore store = mock(CheckpointStore.class);
        when(store.putIfAbsent(anyString(), any(CheckpointEntry.class), eq(STALE)))
                .thenThrow(new CheckpointStoreException("write failed", new RuntimeException()));
        CheckpointCache cache = newCache(store);
        Instant cutoff = _now.minus(Duration.ofHours(24));

        cache.set(HANDLE, cutoff);
        assertEquals(cache.get(HANDLE), Optional.of(cutoff));
    }
}
