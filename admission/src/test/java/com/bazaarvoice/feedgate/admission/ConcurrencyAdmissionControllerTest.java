package com.bazaarvoice.feedgate.admission;

import com.bazaarvoice.feedgate.admission.store.AdmissionStore;
import com.bazaarvoice.feedgate.admission.store.AdmissionStoreException;
import com.bazaarvoice.feedgate.admission.store.InMemoryAdmissionStore;
import com.bazaarvoice.feedgate.common.dropwizard.log.RateLimitedLog;
import com.bazaarvoice.feedgate.common.dropwizard.log.RateLimitedLogFactory;
import com.bazaarvoice.feedgate.shape.api.TenantEnvironment;
import com.codahale.metrics.MetricRegistry;
import org.slf4j.Logger;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertTrue;

public class ConcurrencyAdmissionControllerTest {

    private static final Duration WINDOW = Duration.ofMinutes(5);
    private static final TenantEnvironment TENANT = new TenantEnvironment("env_1", "org_1");

    private Instant _now;
    private InMemoryAdmissionStore _fallbackStore;
    private RateLimitedLog _rateLimitedLog;
    private RateLimitedLogFactory _logFactory;
    private MetricRegistry _metricRegistry;

    @BeforeMethod
    public void setUp() {
        _now = Instant.parse("2024-07-24T12:00:00Z");
        Clock clock = mock(Clock.class);
        when(clock.instant()).then(ignore -> _now);
        when(clock.millis()).then(ignore -> _now.toEpochMilli());

        _fallbackStore = new InMemoryAdmissionStore(clock);
        _rateLimitedLog = mock(RateLimitedLog.class);
        _logFactory = mock(RateLimitedLogFactory.class);
        when(_logFactory.from(any(Logger.class))).thenReturn(_rateLimitedLog);
        _metricRegistry = new MetricRegistry();
    }

    private ConcurrencyAdmissionController newController(AdmissionStore store, StoreFailurePolicy policy) {
        return new ConcurrencyAdmissionController(store, _fallbackStore, WINDOW, policy, _metricRegistry, _logFactory);
    }

    private AdmissionStore unreachableStore() {
        AdmissionStore store = mock(AdmissionStore.class);
        when(store.tryAcquire(anyString(), anyString(), anyInt(), any(Duration.class)))
                .thenThrow(new AdmissionStoreException("connection refused"));
        when(store.count(anyString(), any(Duration.class))).thenThrow(new AdmissionStoreException("connection refused"));
        doThrow(new AdmissionStoreException("connection refused")).when(store).release(anyString(), anyString());
        return store;
    }

    private long meterCount(String name) {
        return _metricRegistry.meter(MetricRegistry.name("bv.feedgate.admission", "ConcurrencyAdmissionController", name)).getCount();
    }

    @Test
    public void testGrantsUntilLimitThenRejects() {
        InMemoryAdmissionStore store = new InMemoryAdmissionStore(Clock.systemUTC());
        ConcurrencyAdmissionController controller = newController(store, StoreFailurePolicy.REJECT);

        Optional<AdmissionSlot> first = controller.tryAcquire(TENANT, 2);
        Optional<AdmissionSlot> second = controller.tryAcquire(TENANT, 2);
        Optional<AdmissionSlot> third = controller.tryAcquire(TENANT, 2);

        assertTrue(first.isPresent());
        assertTrue(second.isPresent());
        assertFalse(third.isPresent());
        assertEquals(controller.countLiveRequests(TENANT), 2);
        assertEquals(meterCount("granted"), 2);
        assertEquals(meterCount("rejected"), 1);

        first.get().release();
        assertTrue(controller.tryAcquire(TENANT, 2).isPresent());
    }

    @Test
    public void testSlotReleasesExactlyOnce() {
        AdmissionStore store = mock(AdmissionStore.class);
        when(store.tryAcquire(eq("env_1"), anyString(), eq(5), eq(WINDOW))).thenReturn(true);
        ConcurrencyAdmissionController controller = newController(store, StoreFailurePolicy.REJECT);

        AdmissionSlot slot = controller.tryAcquire(TENANT, 5).get();
        assertTrue(slot.isHeld());
        slot.release();
        slot.release();

        assertTrue(slot.isReleased());
        verify(store, times(1)).release("env_1", slot.getRequestId());
    }

    @Test
    public void testLocalFallbackEnforcesSameLimit() {
        ConcurrencyAdmissionController controller = newController(unreachableStore(), StoreFailurePolicy.LOCAL_FALLBACK);

        Optional<AdmissionSlot> first = controller.tryAcquire(TENANT, 1);
        assertTrue(first.isPresent());
        assertFalse(controller.tryAcquire(TENANT, 1).isPresent());
        assertEquals(controller.countLiveRequests(TENANT), 1);
        assertEquals(meterCount("store-failures"), 3);

        // Release goes back to the store that granted the slot
        first.get().release();
        assertEquals(_fallbackStore.count("env_1", WINDOW), 0);
        assertTrue(controller.tryAcquire(TENANT, 1).isPresent());
    }

    @Test
    public void testRejectPolicy() {
        ConcurrencyAdmissionController controller = newController(unreachableStore(), StoreFailurePolicy.REJECT);

        assertFalse(controller.tryAcquire(TENANT, 100).isPresent());
        assertEquals(meterCount("rejected"), 1);
        verify(_rateLimitedLog).warn(any(AdmissionStoreException.class), eq("Admission store unavailable, applying {} policy"),
                eq(StoreFailurePolicy.REJECT));
    }

    @Test
    public void testAdmitPolicyGrantsUnheldSlot() {
        AdmissionStore store = unreachableStore();
        ConcurrencyAdmissionController controller = newController(store, StoreFailurePolicy.ADMIT);

        AdmissionSlot slot = controller.tryAcquire(TENANT, 1).get();
        assertFalse(slot.isHeld());
        assertTrue(controller.tryAcquire(TENANT, 1).isPresent());

        slot.release();
        verify(store, times(0)).release(anyString(), anyString());
    }

    @Test
    public void testReleaseFailureIsLogged() {
        AdmissionStore store = mock(AdmissionStore.class);
        when(store.tryAcquire(anyString(), anyString(), anyInt(), any(Duration.class))).thenReturn(true);
        AdmissionStoreException failure = new AdmissionStoreException("connection reset");
        doThrow(failure).when(store).release(anyString(), anyString());
        ConcurrencyAdmissionController controller = newController(store, StoreFailurePolicy.LOCAL_FALLBACK);

        controller.tryAcquire(TENANT, 1).get().release();

        verify(_rateLimitedLog).warn(failure, "Unable to release admission slot for tenant {}", "env_1");
    }
}
