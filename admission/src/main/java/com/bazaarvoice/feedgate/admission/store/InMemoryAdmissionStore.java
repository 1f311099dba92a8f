package com.bazaarvoice.feedgate.admission.store;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.Maps;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentMap;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * {@link AdmissionStore} that keeps slots in process memory.  Used as the shared store when running a single
 * instance, and as the local fallback when the shared store is unreachable.  Each tenant's record is updated under
 * {@link ConcurrentMap#compute}, which makes the acquire sequence atomic per tenant.
 */
public class InMemoryAdmissionStore implements AdmissionStore {

    private final ConcurrentMap<String, TenantSlots> _tenants = Maps.newConcurrentMap();
    private final Clock _clock;

    public InMemoryAdmissionStore(Clock clock) {
        _clock = requireNonNull(clock, "clock");
    }

    @Override
    public boolean tryAcquire(String tenantKey, String requestId, int limit, Duration window) {
        requireNonNull(tenantKey, "tenantKey");
        requireNonNull(requestId, "requestId");
        checkArgument(!window.isNegative() && !window.isZero(), "window must be positive");

        Instant now = _clock.instant();
        Instant cutoff = now.minus(window);
        boolean[] granted = new boolean[1];

        _tenants.compute(tenantKey, (key, existing) -> {
            TenantSlots slots = existing != null && !existing.isExpired(now) ? existing : new TenantSlots();
            slots.removeAcquiredBefore(cutoff);
            slots.put(requestId, now);
            slots.expireAt(now.plus(window));
            if (slots.size() > limit) {
                slots.remove(requestId);
                granted[0] = false;
            } else {
                granted[0] = true;
            }
            return slots.isEmpty() ? null : slots;
        });

        return granted[0];
    }

    @Override
    public void release(String tenantKey, String requestId) {
        _tenants.computeIfPresent(tenantKey, (key, slots) -> {
            slots.remove(requestId);
            return slots.isEmpty() ? null : slots;
        });
    }

    @Override
    public int count(String tenantKey, Duration window) {
        Instant now = _clock.instant();
        TenantSlots slots = _tenants.get(tenantKey);
        if (slots == null) {
            return 0;
        }
        synchronized (slots) {
            return slots.isExpired(now) ? 0 : slots.countAcquiredSince(now.minus(window));
        }
    }

    @VisibleForTesting
    int tenantCount() {
        return _tenants.size();
    }

    /** Slots for one tenant.  Mutated only inside {@code compute}; reads synchronize on the instance. */
    private static class TenantSlots {
        private final Map<String, Instant> _acquiredAt = Maps.newHashMap();
        private Instant _expiresAt = Instant.MAX;

        synchronized boolean isExpired(Instant now) {
            return !now.isBefore(_expiresAt);
        }

        synchronized void expireAt(Instant expiresAt) {
            _expiresAt = expiresAt;
        }

        synchronized void removeAcquiredBefore(Instant cutoff) {
            _acquiredAt.values().removeIf(acquiredAt -> acquiredAt.isBefore(cutoff));
        }

        synchronized void put(String requestId, Instant acquiredAt) {
            _acquiredAt.put(requestId, acquiredAt);
        }

        synchronized void remove(String requestId) {
            _acquiredAt.remove(requestId);
        }

        synchronized int size() {
            return _acquiredAt.size();
        }

        synchronized boolean isEmpty() {
            return _acquiredAt.isEmpty();
        }

        synchronized int countAcquiredSince(Instant cutoff) {
            int count = 0;
            for (Instant acquiredAt : _acquiredAt.values()) {
                if (!acquiredAt.isBefore(cutoff)) {
                    count++;
                }
            }
            return count;
        }
    }
}
