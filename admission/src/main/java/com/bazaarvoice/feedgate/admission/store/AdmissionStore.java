package com.bazaarvoice.feedgate.admission.store;

import java.time.Duration;

/**
 * Shared counter store behind the admission controller.  Each tenant owns an ordered collection of slots keyed by
 * acquisition time.  Implementations must perform {@link #tryAcquire} as a single atomic unit with respect to every
 * other caller, including callers in other processes.
 */
public interface AdmissionStore {

    /**
     * Reclaims the tenant's slots older than {@code window}, inserts a slot for {@code requestId}, refreshes the
     * expiry of the tenant's record to {@code window} and, if the tenant now holds more than {@code limit} slots,
     * removes the slot again.
     *
     * @return true if the slot was granted
     * @throws AdmissionStoreException if the store could not be reached
     */
    boolean tryAcquire(String tenantKey, String requestId, int limit, Duration window);

    /**
     * Removes the named slot.  Removing a slot that was already released or has expired is a no-op.
     *
     * @throws AdmissionStoreException if the store could not be reached
     */
    void release(String tenantKey, String requestId);

    /**
     * Returns the number of the tenant's slots acquired within {@code window}.
     *
     * @throws AdmissionStoreException if the store could not be reached
     */
    int count(String tenantKey, Duration window);
}
